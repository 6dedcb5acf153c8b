package io.b2mash.tenantedge.credential;

/** How a tenant's calls to an external platform obtain a credential. */
public enum CredentialStrategy {
  /** Tenant supplies its own key. Never falls back to a platform key. */
  BYOK,
  /** Platform-owned key; usage is billed to the tenant. */
  PLATFORM_MANAGED,
  /** Tenant key first, platform key when the tenant key is unusable. */
  HYBRID,
  /** Cheapest healthy candidate, ties broken by observed performance. */
  AUTO_RESOLVE
}
