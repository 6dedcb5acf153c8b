package io.b2mash.tenantedge.health;

import java.time.Duration;
import java.time.Instant;

/** Health score in 0..1, lowered by a shrinking quota and an approaching expiry. */
final class HealthScore {

  private HealthScore() {}

  static double calculate(Long quotaRemaining, Instant expiresAt, Instant now) {
    double score = 1.0;

    if (quotaRemaining != null) {
      if (quotaRemaining < 1_000) {
        score *= 0.3;
      } else if (quotaRemaining < 5_000) {
        score *= 0.7;
      } else if (quotaRemaining < 10_000) {
        score *= 0.9;
      }
    }

    if (expiresAt != null) {
      long daysToExpiry = Duration.between(now, expiresAt).toDays();
      if (daysToExpiry < 1) {
        score *= 0.1;
      } else if (daysToExpiry < 3) {
        score *= 0.5;
      } else if (daysToExpiry < 7) {
        score *= 0.8;
      } else if (daysToExpiry < 30) {
        score *= 0.95;
      }
    }

    return Math.max(0.0, Math.min(1.0, score));
  }
}
