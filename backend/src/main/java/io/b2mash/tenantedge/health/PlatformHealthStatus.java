package io.b2mash.tenantedge.health;

import io.b2mash.tenantedge.credential.CredentialView;
import java.util.List;

/**
 * Health of the credentials a tenant can use for one platform: its own key, if any, and the
 * platform's.
 *
 * @param usable true when at least one of them can serve calls right now
 */
public record PlatformHealthStatus(
    String tenantId,
    String platformId,
    int healthyCount,
    int totalCount,
    boolean usable,
    List<CredentialView> statuses) {}
