package io.b2mash.tenantedge.credential;

/**
 * Port to the external secret store. Secrets never stay in this process: they are handed over on
 * registration and only the returned reference is kept.
 */
public interface SecretStore {

  /** Stores a secret and returns the reference under which it was stored. */
  String store(String tenantId, String platformId, String plaintext);

  /** Deletes a secret. No-op if not found. */
  void delete(String secretRef);
}
