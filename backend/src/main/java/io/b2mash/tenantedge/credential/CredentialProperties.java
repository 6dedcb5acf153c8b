package io.b2mash.tenantedge.credential;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Credential settings.
 *
 * @param defaultStrategy strategy for tenants that configure none
 * @param projectionUnits expected calls in the remaining quota window, used to compare candidate
 *     cost under AUTO_RESOLVE
 * @param platform platform-owned credentials registered at startup
 */
@ConfigurationProperties(prefix = "tenantedge.credentials")
public record CredentialProperties(
    @DefaultValue("HYBRID") CredentialStrategy defaultStrategy,
    @DefaultValue("1000") long projectionUnits,
    List<PlatformCredential> platform) {

  public CredentialProperties {
    platform = platform == null ? List.of() : List.copyOf(platform);
  }

  public record PlatformCredential(
      String platformId,
      String secretRef,
      Set<String> capabilities,
      BigDecimal unitCost,
      Long quota) {}
}
