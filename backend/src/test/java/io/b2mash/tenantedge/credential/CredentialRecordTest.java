package io.b2mash.tenantedge.credential;

import static io.b2mash.tenantedge.testutil.TestFixtures.tenantRecord;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CredentialRecordTest {

  private final Instant now = Instant.parse("2026-03-01T12:00:00Z");
  private final CredentialRecord unchecked =
      tenantRecord("t1", "7", "hubspot", HealthStatus.UNKNOWN, 5000L);

  @Test
  void validCheck_marksHealthyWithScore() {
    var checked =
        unchecked.withCheckResult(new CredentialCheck(true, 4000L, null, null, false), 0.7, now);

    assertThat(checked.healthStatus()).isEqualTo(HealthStatus.HEALTHY);
    assertThat(checked.quotaRemaining()).isEqualTo(4000L);
    assertThat(checked.healthScore()).isEqualTo(0.7);
    assertThat(checked.lastCheckedAt()).isEqualTo(now);
    assertThat(checked.lastError()).isNull();
  }

  @Test
  void zeroQuota_isNeverHealthy() {
    var checked =
        unchecked.withCheckResult(new CredentialCheck(true, 0L, null, null, false), 1.0, now);

    assertThat(checked.healthStatus()).isEqualTo(HealthStatus.UNHEALTHY);
    assertThat(checked.healthScore()).isZero();
    assertThat(checked.lastError()).isEqualTo("Quota exhausted");
  }

  @Test
  void expiredCredential_isUnhealthy() {
    var checked =
        unchecked.withCheckResult(
            new CredentialCheck(true, 100L, now.minus(Duration.ofMinutes(1)), null, false),
            1.0,
            now);

    assertThat(checked.healthStatus()).isEqualTo(HealthStatus.UNHEALTHY);
    assertThat(checked.lastError()).isEqualTo("Credential expired");
  }

  @Test
  void failedCheck_keepsPreviousQuotaAndRecordsError() {
    var checked = unchecked.withCheckResult(CredentialCheck.failed("401 from provider"), 1.0, now);

    assertThat(checked.healthStatus()).isEqualTo(HealthStatus.UNHEALTHY);
    assertThat(checked.quotaRemaining()).isEqualTo(5000L);
    assertThat(checked.lastError()).isEqualTo("401 from provider");
  }

  @Test
  void consumingLastUnits_makesRecordUnhealthy() {
    var healthy = tenantRecord("t1", "7", "hubspot", HealthStatus.HEALTHY, 10L);

    var partly = healthy.withQuotaConsumed(4);
    var exhausted = partly.withQuotaConsumed(50);

    assertThat(partly.quotaRemaining()).isEqualTo(6L);
    assertThat(partly.healthStatus()).isEqualTo(HealthStatus.HEALTHY);
    assertThat(exhausted.quotaRemaining()).isZero();
    assertThat(exhausted.healthStatus()).isEqualTo(HealthStatus.UNHEALTHY);
    assertThat(exhausted.hasQuota()).isFalse();
  }

  @Test
  void unmeteredQuota_isUnaffectedByConsumption() {
    var unmetered = tenantRecord("t1", "7", "hubspot", HealthStatus.HEALTHY, null);

    assertThat(unmetered.withQuotaConsumed(1_000_000)).isSameAs(unmetered);
    assertThat(unmetered.hasQuota()).isTrue();
  }

  @Test
  void newRecordWithExhaustedQuota_startsUnhealthy() {
    var record = newTenantRecord(0L, null);

    assertThat(record.healthStatus()).isEqualTo(HealthStatus.UNHEALTHY);
    assertThat(record.lastError()).isEqualTo("Quota exhausted");
    assertThat(record.healthScore()).isZero();
    assertThat(record.isUsable()).isFalse();
  }

  @Test
  void newRecordAlreadyExpired_startsUnhealthy() {
    var record = newTenantRecord(500L, Instant.now().minus(Duration.ofHours(1)));

    assertThat(record.healthStatus()).isEqualTo(HealthStatus.UNHEALTHY);
    assertThat(record.lastError()).isEqualTo("Credential expired");
  }

  @Test
  void newRecordWithQuotaAndFutureExpiry_startsUnknown() {
    var record = newTenantRecord(500L, Instant.now().plus(Duration.ofDays(30)));

    assertThat(record.healthStatus()).isEqualTo(HealthStatus.UNKNOWN);
    assertThat(record.lastError()).isNull();
    assertThat(record.isUsable()).isTrue();
  }

  @Test
  void healthyRecordPastItsExpiry_isNotUsable() {
    var expired =
        tenantRecord(
            "t1",
            "7",
            "hubspot",
            HealthStatus.HEALTHY,
            500L,
            Instant.now().minus(Duration.ofMinutes(5)),
            null);

    assertThat(expired.isUsable()).isFalse();
    assertThat(expired.unusableReason()).isEqualTo("Credential expired");
  }

  @Test
  void toString_doesNotExposeSecretRef() {
    assertThat(unchecked.toString()).doesNotContain(unchecked.secretRef());
  }

  private static CredentialRecord newTenantRecord(Long quota, Instant expiresAt) {
    return CredentialRecord.unchecked(
        "t1",
        "7",
        "hubspot",
        CredentialSource.TENANT,
        CredentialStrategy.BYOK,
        quota,
        expiresAt,
        Set.of(),
        null,
        "secret-t1",
        null);
  }
}
