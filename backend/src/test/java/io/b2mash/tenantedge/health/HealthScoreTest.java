package io.b2mash.tenantedge.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class HealthScoreTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @ParameterizedTest
  @CsvSource({"999, 0.3", "1000, 0.7", "4999, 0.7", "5000, 0.9", "9999, 0.9", "10000, 1.0"})
  void quotaBands(long quota, double expected) {
    assertThat(HealthScore.calculate(quota, null, NOW)).isCloseTo(expected, within(1e-9));
  }

  @ParameterizedTest
  @CsvSource({"0, 0.1", "1, 0.5", "2, 0.5", "3, 0.8", "6, 0.8", "7, 0.95", "29, 0.95", "30, 1.0"})
  void expiryBands(long days, double expected) {
    var expiresAt = NOW.plus(Duration.ofDays(days)).plus(Duration.ofHours(1));
    assertThat(HealthScore.calculate(null, expiresAt, NOW)).isCloseTo(expected, within(1e-9));
  }

  @Test
  void factorsMultiply() {
    var expiresAt = NOW.plus(Duration.ofDays(2));
    assertThat(HealthScore.calculate(500L, expiresAt, NOW)).isCloseTo(0.15, within(1e-9));
  }

  @Test
  void unknownQuotaAndExpiry_scoreFull() {
    assertThat(HealthScore.calculate(null, null, NOW)).isEqualTo(1.0);
  }
}
