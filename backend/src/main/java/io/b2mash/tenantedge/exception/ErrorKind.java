package io.b2mash.tenantedge.exception;

/**
 * User-facing error kinds. The enum constant name is the value carried in {@code ?error=<kind>}
 * redirects and in the {@code errorKind} property of problem responses.
 */
public enum ErrorKind {
  TenantNotResolved,
  Unauthenticated,
  NotOnboarded,
  InvalidOAuthState,
  ProviderError,
  TokenExchangeFailed,
  CredentialUnavailable,
  QuotaExhausted,
  UpstreamTimeout
}
