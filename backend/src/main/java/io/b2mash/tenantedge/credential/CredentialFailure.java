package io.b2mash.tenantedge.credential;

public enum CredentialFailure {
  CREDENTIAL_UNAVAILABLE,
  QUOTA_EXHAUSTED
}
