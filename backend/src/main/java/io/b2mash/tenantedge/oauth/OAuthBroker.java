package io.b2mash.tenantedge.oauth;

import io.b2mash.tenantedge.credential.CredentialService;
import io.b2mash.tenantedge.exception.InvalidOAuthStateException;
import io.b2mash.tenantedge.exception.InvalidRequestException;
import io.b2mash.tenantedge.exception.ProviderErrorException;
import io.b2mash.tenantedge.exception.TokenExchangeFailedException;
import io.b2mash.tenantedge.exception.TokenExchangeTimeoutException;
import io.b2mash.tenantedge.exception.UpstreamTimeoutException;
import io.b2mash.tenantedge.oauth.OAuthProperties.ProviderRegistration;
import io.b2mash.tenantedge.oauth.TokenExchangeClient.TokenExchangeRequest;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Two-phase OAuth handshake on behalf of a tenant user. Initiate issues a signed single-use state
 * and the provider authorization URL; callback validates the state, redeems the code through the
 * auth service and registers the resulting credential.
 */
@Service
public class OAuthBroker {

  private static final Logger log = LoggerFactory.getLogger(OAuthBroker.class);

  private static final String CALLBACK_PATH = "/api/oauth/{provider}/callback";

  private final OAuthProperties properties;
  private final OAuthStateCodec stateCodec;
  private final NonceStore nonceStore;
  private final TokenExchangeClient tokenExchangeClient;
  private final CredentialService credentialService;
  private final SecureRandom random = new SecureRandom();

  public OAuthBroker(
      OAuthProperties properties,
      OAuthStateCodec stateCodec,
      NonceStore nonceStore,
      TokenExchangeClient tokenExchangeClient,
      CredentialService credentialService) {
    this.properties = properties;
    this.stateCodec = stateCodec;
    this.nonceStore = nonceStore;
    this.tokenExchangeClient = tokenExchangeClient;
    this.credentialService = credentialService;
  }

  /** Builds the provider authorization URL and registers the state nonce. */
  public String initiate(
      String userId, String tenantId, String providerSlug, String desiredRedirectUrl) {
    var provider = requireProvider(providerSlug);
    var registration = requireRegistration(provider);

    var nonce = newNonce();
    var state =
        new OAuthState(
            userId,
            tenantId,
            safeRedirectUrl(desiredRedirectUrl),
            provider.getSlug(),
            nonce,
            Instant.now());
    var encodedState = stateCodec.encode(state);
    nonceStore.register(nonce, tenantId);

    var authorizeUrl =
        registration.authorizeUrl() != null && !registration.authorizeUrl().isBlank()
            ? registration.authorizeUrl()
            : provider.getDefaultAuthorizeUrl();
    var scopes =
        registration.scopes() != null && !registration.scopes().isEmpty()
            ? registration.scopes()
            : provider.getDefaultScopes();

    log.info(
        "OAuth initiated: provider={}, tenant={}, user={}", provider.getSlug(), tenantId, userId);
    return UriComponentsBuilder.fromUriString(authorizeUrl)
        .queryParam("client_id", registration.clientId())
        .queryParam("redirect_uri", redirectUri(provider))
        .queryParam("response_type", "code")
        .queryParam("scope", String.join(" ", scopes))
        .queryParam("state", encodedState)
        .encode()
        .build()
        .toUriString();
  }

  /**
   * Completes the handshake. Each failure is raised as an {@code OAuthFlowException} subtype; the
   * token exchange is attempted at most once.
   *
   * @return the redirect URL carried in the state
   */
  public String callback(
      String providerSlug, String code, String state, String error, String errorDescription) {
    if (error != null && !error.isBlank()) {
      log.warn(
          "OAuth provider returned an error: provider={}, error={}, description={}",
          providerSlug,
          error,
          errorDescription);
      throw new ProviderErrorException(providerSlug, error);
    }
    if (code == null || code.isBlank() || state == null || state.isBlank()) {
      throw new InvalidOAuthStateException(providerSlug, "Missing code or state");
    }
    var decoded =
        stateCodec
            .decode(state)
            .orElseThrow(
                () -> new InvalidOAuthStateException(providerSlug, "State failed verification"));
    var provider = OAuthProvider.fromSlug(providerSlug).orElse(null);
    if (provider == null || !provider.getSlug().equals(decoded.provider())) {
      throw new InvalidOAuthStateException(providerSlug, "State was issued for another provider");
    }
    if (!nonceStore.consume(decoded.nonce(), decoded.tenantId())) {
      throw new InvalidOAuthStateException(providerSlug, "State expired or already used");
    }

    var registration = properties.providers().get(provider.getSlug());
    if (registration == null || !registration.isConfigured()) {
      throw new TokenExchangeFailedException(
          provider.getSlug(), decoded.redirectUrl(), "Provider is no longer configured", null);
    }

    TokenExchangeClient.TokenExchangeResult result;
    try {
      result =
          tokenExchangeClient.exchange(
              new TokenExchangeRequest(
                  provider.getSlug(),
                  code,
                  redirectUri(provider),
                  registration.clientId(),
                  registration.clientSecret(),
                  decoded.tenantId(),
                  decoded.userId()));
    } catch (UpstreamTimeoutException e) {
      log.warn(
          "OAuth token exchange timed out: provider={}, tenant={}",
          provider.getSlug(),
          decoded.tenantId());
      throw new TokenExchangeTimeoutException(provider.getSlug(), decoded.redirectUrl(), e);
    } catch (RuntimeException e) {
      log.warn(
          "OAuth token exchange failed: provider={}, tenant={}, cause={}",
          provider.getSlug(),
          decoded.tenantId(),
          e.getMessage());
      throw new TokenExchangeFailedException(
          provider.getSlug(), decoded.redirectUrl(), "Token exchange failed", e);
    }

    credentialService.registerOAuthCredential(
        decoded.tenantId(),
        provider.getSlug(),
        result.credentialRef(),
        result.expiresAt(),
        result.quotaRemaining(),
        provider.getCapabilities());
    log.info(
        "OAuth completed: provider={}, tenant={}, user={}",
        provider.getSlug(),
        decoded.tenantId(),
        decoded.userId());
    return decoded.redirectUrl();
  }

  /** Callback URL registered with the provider. Identical at both phases. */
  String redirectUri(OAuthProvider provider) {
    return UriComponentsBuilder.fromUriString(properties.callbackBaseUrl())
        .path(CALLBACK_PATH)
        .buildAndExpand(provider.getSlug())
        .toUriString();
  }

  String safeRedirectUrl(String desired) {
    if (desired == null
        || !desired.startsWith("/")
        || desired.startsWith("//")
        || desired.contains("\\")) {
      return properties.integrationsPath();
    }
    return desired;
  }

  private OAuthProvider requireProvider(String slug) {
    return OAuthProvider.fromSlug(slug)
        .orElseThrow(
            () -> new InvalidRequestException("provider", "Unsupported provider: " + slug));
  }

  private ProviderRegistration requireRegistration(OAuthProvider provider) {
    var registration = properties.providers().get(provider.getSlug());
    if (registration == null || !registration.isConfigured()) {
      throw new InvalidRequestException(
          "provider", "No client registration for provider " + provider.getSlug());
    }
    return registration;
  }

  private String newNonce() {
    var bytes = new byte[24];
    random.nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }
}
