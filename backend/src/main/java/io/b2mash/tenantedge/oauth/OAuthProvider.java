package io.b2mash.tenantedge.oauth;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Integration providers that support the authorization-code handshake, with their default
 * authorization endpoint, scope set and the credential capabilities a linked account grants.
 * Endpoints and scopes can be overridden per provider in configuration.
 */
public enum OAuthProvider {
  HUBSPOT(
      "hubspot",
      "https://app.hubspot.com/oauth/authorize",
      List.of("crm.objects.contacts.read", "crm.objects.contacts.write", "oauth"),
      Set.of("crm")),
  GOOGLE(
      "google",
      "https://accounts.google.com/o/oauth2/v2/auth",
      List.of(
          "https://www.googleapis.com/auth/adwords",
          "https://www.googleapis.com/auth/analytics.readonly"),
      Set.of("ads", "analytics")),
  FACEBOOK(
      "facebook",
      "https://www.facebook.com/v19.0/dialog/oauth",
      List.of("ads_management", "ads_read", "pages_show_list"),
      Set.of("ads", "social")),
  LINKEDIN(
      "linkedin",
      "https://www.linkedin.com/oauth/v2/authorization",
      List.of("r_ads", "rw_ads", "r_organization_social"),
      Set.of("ads", "social")),
  SALESFORCE(
      "salesforce",
      "https://login.salesforce.com/services/oauth2/authorize",
      List.of("api", "refresh_token"),
      Set.of("crm")),
  ZOHO(
      "zoho",
      "https://accounts.zoho.com/oauth/v2/auth",
      List.of("ZohoCRM.modules.ALL"),
      Set.of("crm"));

  private final String slug;
  private final String defaultAuthorizeUrl;
  private final List<String> defaultScopes;
  private final Set<String> capabilities;

  OAuthProvider(
      String slug,
      String defaultAuthorizeUrl,
      List<String> defaultScopes,
      Set<String> capabilities) {
    this.slug = slug;
    this.defaultAuthorizeUrl = defaultAuthorizeUrl;
    this.defaultScopes = defaultScopes;
    this.capabilities = capabilities;
  }

  /** Lowercase identifier used in URLs, state payloads and as the credential platform id. */
  public String getSlug() {
    return slug;
  }

  public String getDefaultAuthorizeUrl() {
    return defaultAuthorizeUrl;
  }

  public List<String> getDefaultScopes() {
    return defaultScopes;
  }

  public Set<String> getCapabilities() {
    return capabilities;
  }

  public static Optional<OAuthProvider> fromSlug(String slug) {
    if (slug == null) {
      return Optional.empty();
    }
    var normalized = slug.toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(p -> p.slug.equals(normalized)).findFirst();
  }
}
