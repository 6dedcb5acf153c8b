package io.b2mash.tenantedge.security;

/** Role constants used by the security filter chain. */
public final class Roles {

  // Role name as used in hasRole(...)
  public static final String INTERNAL_SERVICE = "INTERNAL_SERVICE";

  // Spring Security granted authority
  public static final String AUTHORITY_INTERNAL = "ROLE_" + INTERNAL_SERVICE;

  private Roles() {}
}
