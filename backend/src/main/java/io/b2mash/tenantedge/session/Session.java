package io.b2mash.tenantedge.session;

import java.time.Instant;

/**
 * Authenticated session as reported by the external session service. Tokens are opaque: they are
 * forwarded upstream and to cookies, never parsed here.
 */
public record Session(
    String userId,
    String tenantId,
    String role,
    boolean onboarded,
    String accessToken,
    String refreshToken,
    Instant expiresAt) {

  public boolean isExpired(Instant now) {
    return expiresAt != null && !expiresAt.isAfter(now);
  }

  public boolean belongsTo(String resolvedTenantId) {
    return tenantId != null && tenantId.equals(resolvedTenantId);
  }

  @Override
  public String toString() {
    return "Session[userId="
        + userId
        + ", tenantId="
        + tenantId
        + ", role="
        + role
        + ", onboarded="
        + onboarded
        + ", expiresAt="
        + expiresAt
        + "]";
  }
}
