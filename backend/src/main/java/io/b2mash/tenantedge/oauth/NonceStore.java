package io.b2mash.tenantedge.oauth;

/** Short-lived single-use nonces for OAuth state replay protection. */
public interface NonceStore {

  /** Registers a freshly issued nonce for the configured TTL. */
  void register(String nonce, String tenantId);

  /**
   * Atomically removes the nonce. Returns true only for the single caller that removed a live
   * nonce; expired, unknown or already consumed nonces return false.
   */
  boolean consume(String nonce, String tenantId);
}
