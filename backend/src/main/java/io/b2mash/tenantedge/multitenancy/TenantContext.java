package io.b2mash.tenantedge.multitenancy;

import java.util.List;

/**
 * Tenant resolved for a single request. Never persisted and never changed once the request has been
 * resolved.
 *
 * @param tenantId tenant identifier (e.g. "coreldove")
 * @param brandName display name of the tenant's brand
 * @param routingType which resolution rule matched
 * @param features feature flags enabled for the tenant
 */
public record TenantContext(
    String tenantId, String brandName, RoutingType routingType, List<String> features) {

  public TenantContext {
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("tenantId must not be blank");
    }
    features = features == null ? List.of() : List.copyOf(features);
  }
}
