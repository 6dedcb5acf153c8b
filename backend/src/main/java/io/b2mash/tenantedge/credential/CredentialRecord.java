package io.b2mash.tenantedge.credential;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;

/**
 * Cached state of one credential. Immutable; the registry replaces a record as a whole.
 *
 * @param recordId registry key
 * @param tenantId owning tenant, null for platform credentials
 * @param platformId external platform the credential is for (e.g. "hubspot")
 * @param source who supplied the credential
 * @param strategy strategy the credential was provisioned under
 * @param healthStatus last known health
 * @param quotaRemaining remaining quota, null when the platform does not report one
 * @param expiresAt expiry, null when the credential does not expire
 * @param lastCheckedAt time of the last validity check, null before the first one
 * @param capabilities capabilities the credential grants; empty means any
 * @param unitCost price per call, null to use the strategy's fee schedule
 * @param secretRef reference to the secret in the external secret store
 * @param keySuffix last characters of the key, for display
 * @param healthScore 0..1, lowered by low quota and near expiry
 * @param lastError reason of the last failed check
 * @param degraded true when the current state comes from sample data
 */
public record CredentialRecord(
    String recordId,
    String tenantId,
    String platformId,
    CredentialSource source,
    CredentialStrategy strategy,
    HealthStatus healthStatus,
    Long quotaRemaining,
    Instant expiresAt,
    Instant lastCheckedAt,
    Set<String> capabilities,
    BigDecimal unitCost,
    String secretRef,
    String keySuffix,
    double healthScore,
    String lastError,
    boolean degraded) {

  public CredentialRecord {
    capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
  }

  /**
   * A newly registered record that has not been checked yet. It starts UNKNOWN unless its quota is
   * already used up or it has already expired, in which case it starts UNHEALTHY.
   */
  public static CredentialRecord unchecked(
      String recordId,
      String tenantId,
      String platformId,
      CredentialSource source,
      CredentialStrategy strategy,
      Long quotaRemaining,
      Instant expiresAt,
      Set<String> capabilities,
      BigDecimal unitCost,
      String secretRef,
      String keySuffix) {
    String error = null;
    if (quotaRemaining != null && quotaRemaining <= 0) {
      error = "Quota exhausted";
    } else if (expiresAt != null && !expiresAt.isAfter(Instant.now())) {
      error = "Credential expired";
    }
    return new CredentialRecord(
        recordId,
        tenantId,
        platformId,
        source,
        strategy,
        error == null ? HealthStatus.UNKNOWN : HealthStatus.UNHEALTHY,
        quotaRemaining,
        expiresAt,
        null,
        capabilities,
        unitCost,
        secretRef,
        keySuffix,
        error == null ? 1.0 : 0.0,
        error,
        false);
  }

  /**
   * Applies a validity check. A record is UNHEALTHY when the check failed, the quota is used up or
   * the credential has expired; otherwise HEALTHY.
   */
  public CredentialRecord withCheckResult(CredentialCheck check, double score, Instant now) {
    var quota = check.quotaRemaining() != null ? check.quotaRemaining() : quotaRemaining;
    var expiry = check.expiresAt() != null ? check.expiresAt() : expiresAt;

    String error = null;
    if (!check.valid()) {
      error = check.errorMessage() != null ? check.errorMessage() : "Credential rejected";
    } else if (quota != null && quota <= 0) {
      error = "Quota exhausted";
    } else if (expiry != null && !expiry.isAfter(now)) {
      error = "Credential expired";
    }
    var status = error == null ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY;

    return new CredentialRecord(
        recordId,
        tenantId,
        platformId,
        source,
        strategy,
        status,
        quota,
        expiry,
        now,
        capabilities,
        unitCost,
        secretRef,
        keySuffix,
        status == HealthStatus.UNHEALTHY ? 0.0 : score,
        error,
        check.degraded());
  }

  /** Records consumed quota without a full check. Reaching zero makes the record unhealthy. */
  public CredentialRecord withQuotaConsumed(long units) {
    if (quotaRemaining == null || units <= 0) {
      return this;
    }
    long remaining = Math.max(0, quotaRemaining - units);
    var exhausted = remaining == 0;
    return new CredentialRecord(
        recordId,
        tenantId,
        platformId,
        source,
        strategy,
        exhausted ? HealthStatus.UNHEALTHY : healthStatus,
        remaining,
        expiresAt,
        lastCheckedAt,
        capabilities,
        unitCost,
        secretRef,
        keySuffix,
        exhausted ? 0.0 : healthScore,
        exhausted ? "Quota exhausted" : lastError,
        degraded);
  }

  /**
   * Usable for resolution: not known to be broken and not expired. UNKNOWN counts as usable. Expiry
   * is judged at call time, so a record that expired since its last check is not usable.
   */
  public boolean isUsable() {
    return healthStatus != HealthStatus.UNHEALTHY && !isExpired(Instant.now());
  }

  public boolean isExpired(Instant now) {
    return expiresAt != null && !expiresAt.isAfter(now);
  }

  /** Why the record cannot serve a call: its last error, or expiry. */
  public String unusableReason() {
    if (isExpired(Instant.now())) {
      return "Credential expired";
    }
    return lastError != null ? lastError : "Credential unhealthy";
  }

  public boolean hasQuota() {
    return quotaRemaining == null || quotaRemaining > 0;
  }

  public boolean supports(String capability) {
    return capability == null
        || capability.isBlank()
        || capabilities.isEmpty()
        || capabilities.contains(capability);
  }

  @Override
  public String toString() {
    return "CredentialRecord[recordId="
        + recordId
        + ", tenantId="
        + tenantId
        + ", platformId="
        + platformId
        + ", source="
        + source
        + ", healthStatus="
        + healthStatus
        + ", quotaRemaining="
        + quotaRemaining
        + "]";
  }
}
