package io.b2mash.tenantedge.session;

import io.b2mash.tenantedge.multitenancy.RequestScopes;
import io.b2mash.tenantedge.multitenancy.TenantResolutionFilter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Applies the {@link SessionGuard} policy after tenant resolution. Sessions that belong to another
 * tenant are rejected with 403 rather than downgraded to anonymous.
 */
@Component
public class SessionGuardFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(SessionGuardFilter.class);

  private final SessionResolver sessionResolver;
  private final SessionGuard sessionGuard;
  private final RouteGroupMatcher routeGroupMatcher;

  public SessionGuardFilter(
      SessionResolver sessionResolver,
      SessionGuard sessionGuard,
      RouteGroupMatcher routeGroupMatcher) {
    this.sessionResolver = sessionResolver;
    this.sessionGuard = sessionGuard;
    this.routeGroupMatcher = routeGroupMatcher;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    var tenant = RequestScopes.requireTenant();
    var group = routeGroupMatcher.match(pathWithinApplication(request));
    if (group == RouteGroup.UNGUARDED) {
      filterChain.doFilter(request, response);
      return;
    }

    var session = sessionResolver.resolve(request, response).orElse(null);
    if (session != null && !session.belongsTo(tenant.tenantId())) {
      log.warn(
          "Cross-tenant session rejected: user={}, sessionTenant={}, requestTenant={}, path={}",
          session.userId(),
          session.tenantId(),
          tenant.tenantId(),
          request.getRequestURI());
      response.sendError(
          HttpServletResponse.SC_FORBIDDEN, "Session does not belong to this tenant");
      return;
    }

    var state = SessionState.of(session);
    var decision =
        sessionGuard.evaluate(group, state, routeBase(request), originalPathAndQuery(request));

    switch (decision.outcome()) {
      case REDIRECT -> {
        log.debug(
            "Guard redirect: group={}, state={}, location={}", group, state, decision.location());
        response.sendRedirect(decision.location());
      }
      case UNAUTHORIZED -> response.sendError(
          HttpServletResponse.SC_UNAUTHORIZED, "Authentication required");
      case ALLOW -> {
        try {
          if (session != null) {
            RequestScopes.bindSession(session);
          }
          filterChain.doFilter(request, response);
        } finally {
          RequestScopes.clearSession();
        }
      }
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return RequestScopes.getTenantOrNull() == null;
  }

  private static String routeBase(HttpServletRequest request) {
    var base = request.getAttribute(TenantResolutionFilter.ROUTE_BASE_ATTRIBUTE);
    return base instanceof String value ? value : "";
  }

  private static String originalPathAndQuery(HttpServletRequest request) {
    var original = request.getAttribute(TenantResolutionFilter.ORIGINAL_PATH_ATTRIBUTE);
    if (original instanceof String value) {
      return value;
    }
    var query = request.getQueryString();
    return query != null ? request.getRequestURI() + "?" + query : request.getRequestURI();
  }

  private static String pathWithinApplication(HttpServletRequest request) {
    var uri = request.getRequestURI();
    var contextPath = request.getContextPath();
    return contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)
        ? uri.substring(contextPath.length())
        : uri;
  }
}
