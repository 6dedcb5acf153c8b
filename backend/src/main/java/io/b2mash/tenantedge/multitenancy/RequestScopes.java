package io.b2mash.tenantedge.multitenancy;

import io.b2mash.tenantedge.exception.NotOnboardedException;
import io.b2mash.tenantedge.exception.TenantNotResolvedException;
import io.b2mash.tenantedge.exception.UnauthenticatedException;
import io.b2mash.tenantedge.session.Session;

/**
 * Request-scoped values bound by the servlet filters and read by controllers and services. Each
 * binding is cleared by the filter that made it once the request leaves the chain.
 */
public final class RequestScopes {

  private static final ThreadLocal<TenantContext> TENANT = new ThreadLocal<>();
  private static final ThreadLocal<Session> SESSION = new ThreadLocal<>();

  private RequestScopes() {}

  /** Bound by TenantResolutionFilter. */
  public static void bindTenant(TenantContext tenant) {
    TENANT.set(tenant);
  }

  /** Bound by SessionGuardFilter when the session check succeeded. */
  public static void bindSession(Session session) {
    SESSION.set(session);
  }

  /** Returns the resolved tenant. Throws if the request was not resolved. */
  public static TenantContext requireTenant() {
    var tenant = TENANT.get();
    if (tenant == null) {
      throw new TenantNotResolvedException("Tenant context not available for this request");
    }
    return tenant;
  }

  public static TenantContext getTenantOrNull() {
    return TENANT.get();
  }

  /** Returns the authenticated session. Throws 401 if there is none. */
  public static Session requireSession() {
    var session = SESSION.get();
    if (session == null) {
      throw new UnauthenticatedException("A valid session is required");
    }
    return session;
  }

  /** Returns the session of a user who finished onboarding. Throws 401 or 403 otherwise. */
  public static Session requireOnboardedSession() {
    var session = requireSession();
    if (!session.onboarded()) {
      throw new NotOnboardedException("Complete onboarding before managing integrations");
    }
    return session;
  }

  public static Session getSessionOrNull() {
    return SESSION.get();
  }

  public static void clearTenant() {
    TENANT.remove();
  }

  public static void clearSession() {
    SESSION.remove();
  }
}
