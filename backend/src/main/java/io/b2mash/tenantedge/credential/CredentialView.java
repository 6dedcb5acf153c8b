package io.b2mash.tenantedge.credential;

import java.time.Instant;
import java.util.Set;

/** Tenant-facing view of a credential record. Carries no secret material. */
public record CredentialView(
    String recordId,
    String platformId,
    CredentialSource source,
    CredentialStrategy strategy,
    HealthStatus healthStatus,
    Long quotaRemaining,
    Instant expiresAt,
    Instant lastCheckedAt,
    Set<String> capabilities,
    String keySuffix,
    double healthScore,
    String lastError,
    boolean degraded) {

  public static CredentialView from(CredentialRecord record) {
    return new CredentialView(
        record.recordId(),
        record.platformId(),
        record.source(),
        record.strategy(),
        record.healthStatus(),
        record.quotaRemaining(),
        record.expiresAt(),
        record.lastCheckedAt(),
        record.capabilities(),
        record.keySuffix(),
        record.healthScore(),
        record.lastError(),
        record.degraded());
  }
}
