package io.b2mash.tenantedge.oauth;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * OAuth handshake settings.
 *
 * @param callbackBaseUrl public base URL the provider redirects back to
 * @param integrationsPath tenant page that shows the handshake outcome
 * @param nonceTtl lifetime of an issued state nonce
 * @param stateSigningKey key for the state integrity tag; a random per-process key is used when
 *     blank
 * @param providers client registration per provider slug
 */
@ConfigurationProperties(prefix = "tenantedge.oauth")
public record OAuthProperties(
    String callbackBaseUrl,
    @DefaultValue("/dashboard/integrations") String integrationsPath,
    @DefaultValue("10m") Duration nonceTtl,
    String stateSigningKey,
    Map<String, ProviderRegistration> providers) {

  public OAuthProperties {
    providers = providers == null ? Map.of() : Map.copyOf(providers);
  }

  /**
   * Client registration with one provider. Blank {@code authorizeUrl}/{@code scopes} fall back to
   * the provider's defaults.
   */
  public record ProviderRegistration(
      String clientId, String clientSecret, String authorizeUrl, List<String> scopes) {

    public boolean isConfigured() {
      return clientId != null && !clientId.isBlank();
    }
  }
}
