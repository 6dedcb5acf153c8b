package io.b2mash.tenantedge.multitenancy;

import io.b2mash.tenantedge.credential.CredentialStrategy;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Static tenant table and resolution settings.
 *
 * @param tenants known tenants
 * @param baseDomain shared parent domain for subdomain routing (e.g. "bizosaas.com"); may be null
 * @param defaultTenantId tenant used when nothing else matches; null means unmatched requests get
 *     404
 * @param pathPrefix prefix for path-based routing, followed by the tenant id
 */
@ConfigurationProperties(prefix = "tenantedge.tenancy")
public record TenancyProperties(
    List<TenantDefinition> tenants,
    String baseDomain,
    String defaultTenantId,
    @DefaultValue("/client") String pathPrefix) {

  public TenancyProperties {
    tenants = tenants == null ? List.of() : List.copyOf(tenants);
  }

  /**
   * One configured tenant.
   *
   * @param id tenant id, also the subdomain label and path segment
   * @param name brand name
   * @param domains custom domains mapped to this tenant
   * @param devPort local development port mapped to this tenant, or null
   * @param features feature flags
   * @param credentialStrategy initial credential strategy, null for the platform default
   */
  public record TenantDefinition(
      String id,
      String name,
      List<String> domains,
      Integer devPort,
      List<String> features,
      CredentialStrategy credentialStrategy) {

    public TenantDefinition {
      domains = domains == null ? List.of() : List.copyOf(domains);
      features = features == null ? List.of() : List.copyOf(features);
    }
  }
}
