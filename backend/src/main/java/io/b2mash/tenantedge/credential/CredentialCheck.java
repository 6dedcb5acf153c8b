package io.b2mash.tenantedge.credential;

import java.time.Instant;

/**
 * Outcome of one validity check against the secret service.
 *
 * @param valid whether the provider accepted the credential
 * @param quotaRemaining quota reported by the provider, null when not reported
 * @param expiresAt credential expiry, null when it does not expire
 * @param errorMessage reason for an invalid result
 * @param degraded true when the result is sample data rather than a real check
 */
public record CredentialCheck(
    boolean valid, Long quotaRemaining, Instant expiresAt, String errorMessage, boolean degraded) {

  public static CredentialCheck failed(String errorMessage) {
    return new CredentialCheck(false, null, null, errorMessage, false);
  }

  public CredentialCheck asDegraded() {
    return new CredentialCheck(valid, quotaRemaining, expiresAt, errorMessage, true);
  }
}
