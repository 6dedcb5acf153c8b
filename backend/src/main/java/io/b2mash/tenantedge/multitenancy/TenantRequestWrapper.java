package io.b2mash.tenantedge.multitenancy;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Exposes the resolved tenant to downstream handlers as request headers and, for path-based
 * routing, presents the rewritten path as the request URI. Incoming headers with the same names are
 * replaced so clients cannot spoof the tenant.
 */
public class TenantRequestWrapper extends HttpServletRequestWrapper {

  public static final String HEADER_TENANT_ID = "tenant-id";
  public static final String HEADER_TENANT_NAME = "tenant-name";
  public static final String HEADER_ROUTING_TYPE = "routing-type";
  public static final String HEADER_TENANT_FEATURES = "tenant-features";

  private final Map<String, String> tenantHeaders = new LinkedHashMap<>();
  private final String path;

  public TenantRequestWrapper(HttpServletRequest request, TenantResolution resolution) {
    super(request);
    var tenant = resolution.tenant();
    tenantHeaders.put(HEADER_TENANT_ID, tenant.tenantId());
    tenantHeaders.put(HEADER_TENANT_NAME, tenant.brandName());
    tenantHeaders.put(HEADER_ROUTING_TYPE, tenant.routingType().getWireValue());
    tenantHeaders.put(HEADER_TENANT_FEATURES, String.join(",", tenant.features()));

    var rewritten = resolution.rewrittenPath();
    int queryStart = rewritten.indexOf('?');
    this.path = queryStart >= 0 ? rewritten.substring(0, queryStart) : rewritten;
  }

  @Override
  public String getRequestURI() {
    return getContextPath() + path;
  }

  @Override
  public StringBuffer getRequestURL() {
    var url = new StringBuffer();
    url.append(getScheme()).append("://").append(getServerName());
    int port = getServerPort();
    if (port > 0
        && !("http".equals(getScheme()) && port == 80)
        && !("https".equals(getScheme()) && port == 443)) {
      url.append(':').append(port);
    }
    url.append(getRequestURI());
    return url;
  }

  @Override
  public String getServletPath() {
    return path;
  }

  @Override
  public String getPathInfo() {
    return null;
  }

  @Override
  public String getHeader(String name) {
    var value = tenantHeaders.get(name.toLowerCase(Locale.ROOT));
    return value != null ? value : super.getHeader(name);
  }

  @Override
  public Enumeration<String> getHeaders(String name) {
    var value = tenantHeaders.get(name.toLowerCase(Locale.ROOT));
    return value != null ? Collections.enumeration(List.of(value)) : super.getHeaders(name);
  }

  @Override
  public Enumeration<String> getHeaderNames() {
    var names = new ArrayList<>(tenantHeaders.keySet());
    var original = super.getHeaderNames();
    while (original != null && original.hasMoreElements()) {
      var name = original.nextElement();
      if (!tenantHeaders.containsKey(name.toLowerCase(Locale.ROOT))) {
        names.add(name);
      }
    }
    return Collections.enumeration(names);
  }
}
