package io.b2mash.tenantedge.multitenancy;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class TenantLoggingFilter extends OncePerRequestFilter {

  private static final String MDC_REQUEST_ID = "requestId";
  private static final String MDC_TENANT_ID = "tenantId";
  private static final String MDC_ROUTING_TYPE = "routingType";
  private static final String MDC_USER_ID = "userId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      var tenant = RequestScopes.getTenantOrNull();
      if (tenant != null) {
        MDC.put(MDC_TENANT_ID, tenant.tenantId());
        MDC.put(MDC_ROUTING_TYPE, tenant.routingType().getWireValue());
      }

      var session = RequestScopes.getSessionOrNull();
      if (session != null) {
        MDC.put(MDC_USER_ID, session.userId());
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_REQUEST_ID);
      MDC.remove(MDC_TENANT_ID);
      MDC.remove(MDC_ROUTING_TYPE);
      MDC.remove(MDC_USER_ID);
    }
  }
}
