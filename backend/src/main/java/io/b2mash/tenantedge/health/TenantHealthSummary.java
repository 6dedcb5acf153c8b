package io.b2mash.tenantedge.health;

import io.b2mash.tenantedge.credential.CredentialView;
import java.util.List;

/**
 * @param overallHealthScore mean health score of the listed credentials, 1.0 when there are none
 * @param degraded true when any status comes from sample data
 */
public record TenantHealthSummary(
    String tenantId,
    int healthyCount,
    int totalCount,
    double overallHealthScore,
    boolean degraded,
    List<CredentialView> statuses) {}
