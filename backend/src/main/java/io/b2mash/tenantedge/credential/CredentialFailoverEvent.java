package io.b2mash.tenantedge.credential;

import java.time.Instant;

/** Published when a HYBRID tenant's call was served by the platform key instead of its own. */
public record CredentialFailoverEvent(
    String tenantId,
    String platformId,
    String fromRecordId,
    String toRecordId,
    String reason,
    Instant occurredAt) {}
