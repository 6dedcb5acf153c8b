package io.b2mash.tenantedge.oauth;

import java.time.Instant;

/**
 * Port to the external auth/secret service that redeems authorization codes and stores the
 * resulting tokens. Only a reference to the stored credential comes back.
 */
public interface TokenExchangeClient {

  TokenExchangeResult exchange(TokenExchangeRequest request);

  record TokenExchangeRequest(
      String provider,
      String code,
      String redirectUri,
      String clientId,
      String clientSecret,
      String tenantId,
      String userId) {

    @Override
    public String toString() {
      return "TokenExchangeRequest[provider="
          + provider
          + ", redirectUri="
          + redirectUri
          + ", tenantId="
          + tenantId
          + ", userId="
          + userId
          + "]";
    }
  }

  /**
   * @param credentialRef identifier of the stored credential in the secret service
   * @param expiresAt access token expiry, may be null
   * @param quotaRemaining quota reported by the provider, may be null
   */
  record TokenExchangeResult(String credentialRef, Instant expiresAt, Long quotaRemaining) {}
}
