package io.b2mash.tenantedge.session;

/** Groups of routes that share an access policy. */
public enum RouteGroup {
  /** Login and sign-up pages. */
  PUBLIC,
  ONBOARDING,
  DASHBOARD,
  /** JSON endpoints that need a session; never redirected, answered with 401 instead. */
  API,
  /** Not guarded at all (OAuth callback, internal service calls, error page). */
  UNGUARDED
}
