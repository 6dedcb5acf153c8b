package io.b2mash.tenantedge.credential;

import io.b2mash.tenantedge.multitenancy.TenancyProperties;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Current credential strategy per tenant. Seeded from the tenant table, changed by migration. */
@Component
public class TenantCredentialSettings {

  private static final Logger log = LoggerFactory.getLogger(TenantCredentialSettings.class);

  private final Map<String, CredentialStrategy> strategies = new ConcurrentHashMap<>();
  private final CredentialStrategy defaultStrategy;

  public TenantCredentialSettings(
      TenancyProperties tenancyProperties, CredentialProperties credentialProperties) {
    this.defaultStrategy = credentialProperties.defaultStrategy();
    for (var tenant : tenancyProperties.tenants()) {
      if (tenant.credentialStrategy() != null) {
        strategies.put(tenant.id(), tenant.credentialStrategy());
      }
    }
  }

  public CredentialStrategy strategyFor(String tenantId) {
    return strategies.getOrDefault(tenantId, defaultStrategy);
  }

  /** Switches the tenant to a new strategy and returns the previous one. */
  public CredentialStrategy migrate(String tenantId, CredentialStrategy strategy) {
    var previous = strategies.put(tenantId, strategy);
    var effectivePrevious = previous != null ? previous : defaultStrategy;
    log.info(
        "Credential strategy changed: tenant={}, from={}, to={}",
        tenantId,
        effectivePrevious,
        strategy);
    return effectivePrevious;
  }
}
