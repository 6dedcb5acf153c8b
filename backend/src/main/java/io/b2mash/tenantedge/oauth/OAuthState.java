package io.b2mash.tenantedge.oauth;

import java.time.Instant;

/**
 * Payload carried through the provider in the {@code state} parameter. Issued at initiate and
 * consumed once at callback.
 */
public record OAuthState(
    String userId,
    String tenantId,
    String redirectUrl,
    String provider,
    String nonce,
    Instant issuedAt) {

  boolean isStructurallyValid() {
    return notBlank(userId)
        && notBlank(tenantId)
        && notBlank(redirectUrl)
        && notBlank(provider)
        && notBlank(nonce)
        && issuedAt != null;
  }

  private static boolean notBlank(String value) {
    return value != null && !value.isBlank();
  }
}
