package io.b2mash.tenantedge.health;

import io.b2mash.tenantedge.credential.CredentialRecord;
import io.b2mash.tenantedge.credential.CredentialRegistry;
import io.b2mash.tenantedge.credential.CredentialView;
import io.b2mash.tenantedge.credential.HealthStatus;
import io.b2mash.tenantedge.exception.ResourceNotFoundException;
import org.springframework.stereotype.Service;

@Service
public class HealthStatusService {

  private final CredentialRegistry registry;

  public HealthStatusService(CredentialRegistry registry) {
    this.registry = registry;
  }

  public TenantHealthSummary summary(String tenantId) {
    var records = registry.visibleTo(tenantId);
    int healthy =
        (int) records.stream().filter(r -> r.healthStatus() == HealthStatus.HEALTHY).count();
    double overall =
        records.stream().mapToDouble(CredentialRecord::healthScore).average().orElse(1.0);
    boolean degraded = records.stream().anyMatch(CredentialRecord::degraded);
    return new TenantHealthSummary(
        tenantId,
        healthy,
        records.size(),
        overall,
        degraded,
        records.stream().map(CredentialView::from).toList());
  }

  /** Status of one platform's credentials as seen by the tenant. */
  public PlatformHealthStatus platformStatus(String tenantId, String platformId) {
    var records =
        registry.visibleTo(tenantId).stream()
            .filter(r -> platformId.equals(r.platformId()))
            .toList();
    if (records.isEmpty()) {
      throw new ResourceNotFoundException("Credential for platform", platformId);
    }
    int healthy =
        (int) records.stream().filter(r -> r.healthStatus() == HealthStatus.HEALTHY).count();
    boolean usable = records.stream().anyMatch(r -> r.isUsable() && r.hasQuota());
    return new PlatformHealthStatus(
        tenantId,
        platformId,
        healthy,
        records.size(),
        usable,
        records.stream().map(CredentialView::from).toList());
  }
}
