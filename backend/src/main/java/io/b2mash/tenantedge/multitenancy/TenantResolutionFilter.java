package io.b2mash.tenantedge.multitenancy;

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
 * First filter of every request: resolves the tenant, binds it for the request and hands a wrapped
 * request (tenant headers, rewritten path) to the rest of the chain. Unresolvable requests end here
 * with 404.
 */
@Component
public class TenantResolutionFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(TenantResolutionFilter.class);

  /** Path and query exactly as the browser sent them, before any rewrite. */
  public static final String ORIGINAL_PATH_ATTRIBUTE =
      TenantResolutionFilter.class.getName() + ".originalPath";

  /** Tenant path prefix stripped by the rewrite (e.g. "/client/coreldove"), or "". */
  public static final String ROUTE_BASE_ATTRIBUTE =
      TenantResolutionFilter.class.getName() + ".routeBase";

  private final TenantResolver tenantResolver;

  public TenantResolutionFilter(TenantResolver tenantResolver) {
    this.tenantResolver = tenantResolver;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    var pathAndQuery = pathWithinApplication(request);
    if (request.getQueryString() != null) {
      pathAndQuery = pathAndQuery + "?" + request.getQueryString();
    }

    var resolution =
        tenantResolver.resolve(request.getServerName(), request.getServerPort(), pathAndQuery);
    if (resolution.isEmpty()) {
      log.warn(
          "Tenant not resolved: host={}, port={}, path={}",
          request.getServerName(),
          request.getServerPort(),
          request.getRequestURI());
      response.sendError(HttpServletResponse.SC_NOT_FOUND, "Tenant not found");
      return;
    }

    var resolved = resolution.get();
    if (log.isDebugEnabled()) {
      log.debug(
          "Resolved tenant {} via {} (path {} -> {})",
          resolved.tenant().tenantId(),
          resolved.tenant().routingType().getWireValue(),
          pathAndQuery,
          resolved.rewrittenPath());
    }

    request.setAttribute(ORIGINAL_PATH_ATTRIBUTE, pathAndQuery);
    request.setAttribute(ROUTE_BASE_ATTRIBUTE, routeBase(pathAndQuery, resolved));

    try {
      RequestScopes.bindTenant(resolved.tenant());
      filterChain.doFilter(new TenantRequestWrapper(request, resolved), response);
    } finally {
      RequestScopes.clearTenant();
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return pathWithinApplication(request).startsWith("/internal/");
  }

  private static String routeBase(String original, TenantResolution resolved) {
    if (resolved.tenant().routingType() != RoutingType.PATH_BASED) {
      return "";
    }
    var originalPath = stripQuery(original);
    var rewrittenPath = stripQuery(resolved.rewrittenPath());
    if ("/".equals(rewrittenPath)) {
      return originalPath.endsWith("/")
          ? originalPath.substring(0, originalPath.length() - 1)
          : originalPath;
    }
    return originalPath.substring(0, originalPath.length() - rewrittenPath.length());
  }

  private static String stripQuery(String pathAndQuery) {
    int queryStart = pathAndQuery.indexOf('?');
    return queryStart >= 0 ? pathAndQuery.substring(0, queryStart) : pathAndQuery;
  }

  private static String pathWithinApplication(HttpServletRequest request) {
    var uri = request.getRequestURI();
    var contextPath = request.getContextPath();
    if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
      return uri.substring(contextPath.length());
    }
    return uri;
  }
}
