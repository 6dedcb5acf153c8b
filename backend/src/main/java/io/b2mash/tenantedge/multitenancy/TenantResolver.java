package io.b2mash.tenantedge.multitenancy;

import io.b2mash.tenantedge.exception.TenantNotResolvedException;
import io.b2mash.tenantedge.multitenancy.TenancyProperties.TenantDefinition;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Maps a request's host, port and path to a tenant. Rules are tried in order and the first match
 * wins: custom domain, subdomain or dev port, path prefix, configured default.
 */
@Component
public class TenantResolver {

  private final Map<String, TenantDefinition> tenantsById = new LinkedHashMap<>();
  private final Map<String, TenantDefinition> tenantsByDomain = new HashMap<>();
  private final Map<Integer, TenantDefinition> tenantsByPort = new HashMap<>();
  private final String baseDomain;
  private final String pathPrefix;
  private final TenantDefinition defaultTenant;

  public TenantResolver(TenancyProperties properties) {
    for (var tenant : properties.tenants()) {
      if (tenantsById.putIfAbsent(tenant.id(), tenant) != null) {
        throw new IllegalStateException("Duplicate tenant id: " + tenant.id());
      }
      for (var domain : tenant.domains()) {
        var existing = tenantsByDomain.putIfAbsent(domain.toLowerCase(Locale.ROOT), tenant);
        if (existing != null) {
          throw new IllegalStateException(
              "Domain " + domain + " mapped to both " + existing.id() + " and " + tenant.id());
        }
      }
      if (tenant.devPort() != null) {
        var existing = tenantsByPort.putIfAbsent(tenant.devPort(), tenant);
        if (existing != null) {
          throw new IllegalStateException(
              "Dev port "
                  + tenant.devPort()
                  + " mapped to both "
                  + existing.id()
                  + " and "
                  + tenant.id());
        }
      }
    }
    this.baseDomain =
        properties.baseDomain() == null || properties.baseDomain().isBlank()
            ? null
            : properties.baseDomain().toLowerCase(Locale.ROOT);
    this.pathPrefix = stripTrailingSlash(properties.pathPrefix());

    var defaultId = properties.defaultTenantId();
    if (defaultId != null && !defaultId.isBlank()) {
      this.defaultTenant = tenantsById.get(defaultId);
      if (defaultTenant == null) {
        throw new IllegalStateException("Default tenant " + defaultId + " is not configured");
      }
    } else {
      this.defaultTenant = null;
    }
  }

  /**
   * Resolves the tenant for a request.
   *
   * @param host request host, with or without a port suffix
   * @param port request port, used for dev port mapping
   * @param pathAndQuery raw request path, optionally followed by {@code ?query}
   * @return the resolution, or empty if no rule matched and no default tenant is configured
   */
  public Optional<TenantResolution> resolve(String host, int port, String pathAndQuery) {
    var normalizedHost = normalizeHost(host);
    var target = pathAndQuery == null || pathAndQuery.isEmpty() ? "/" : pathAndQuery;

    if (normalizedHost != null) {
      var byDomain = tenantsByDomain.get(normalizedHost);
      if (byDomain != null) {
        return Optional.of(resolved(byDomain, RoutingType.CUSTOM_DOMAIN, target));
      }
      var bySubdomain = matchSubdomain(normalizedHost);
      if (bySubdomain != null) {
        return Optional.of(resolved(bySubdomain, RoutingType.SUBDOMAIN, target));
      }
    }
    var byPort = tenantsByPort.get(port);
    if (byPort != null) {
      return Optional.of(resolved(byPort, RoutingType.SUBDOMAIN, target));
    }

    var byPath = matchPathPrefix(target);
    if (byPath.isPresent()) {
      return byPath;
    }

    if (defaultTenant != null) {
      return Optional.of(resolved(defaultTenant, RoutingType.DEFAULT, target));
    }
    return Optional.empty();
  }

  /** Like {@link #resolve} but throws {@link TenantNotResolvedException} when nothing matched. */
  public TenantResolution resolveOrThrow(String host, int port, String pathAndQuery) {
    return resolve(host, port, pathAndQuery)
        .orElseThrow(
            () -> new TenantNotResolvedException("No tenant configured for host " + host));
  }

  public Optional<TenantContext> findById(String tenantId) {
    var tenant = tenantsById.get(tenantId);
    return tenant == null
        ? Optional.empty()
        : Optional.of(toContext(tenant, RoutingType.DEFAULT));
  }

  public Collection<TenantDefinition> tenants() {
    return tenantsById.values();
  }

  private TenantDefinition matchSubdomain(String host) {
    if (baseDomain == null || !host.endsWith("." + baseDomain)) {
      return null;
    }
    var labels = host.substring(0, host.length() - baseDomain.length() - 1);
    var lastDot = labels.lastIndexOf('.');
    var label = lastDot >= 0 ? labels.substring(lastDot + 1) : labels;
    return tenantsById.get(label);
  }

  private Optional<TenantResolution> matchPathPrefix(String pathAndQuery) {
    int queryStart = pathAndQuery.indexOf('?');
    var path = queryStart >= 0 ? pathAndQuery.substring(0, queryStart) : pathAndQuery;
    // Query is carried over untouched, including an empty one ("?")
    var query = queryStart >= 0 ? pathAndQuery.substring(queryStart) : "";

    var marker = pathPrefix + "/";
    if (!path.startsWith(marker)) {
      return Optional.empty();
    }
    var rest = path.substring(marker.length());
    int slash = rest.indexOf('/');
    var tenantId = slash >= 0 ? rest.substring(0, slash) : rest;
    var tenant = tenantsById.get(tenantId);
    if (tenant == null) {
      return Optional.empty();
    }
    var remainder = slash >= 0 ? rest.substring(slash) : "/";
    return Optional.of(
        new TenantResolution(toContext(tenant, RoutingType.PATH_BASED), remainder + query));
  }

  private static TenantResolution resolved(
      TenantDefinition tenant, RoutingType routingType, String pathAndQuery) {
    return new TenantResolution(toContext(tenant, routingType), pathAndQuery);
  }

  private static TenantContext toContext(TenantDefinition tenant, RoutingType routingType) {
    var name = tenant.name() != null ? tenant.name() : tenant.id();
    return new TenantContext(tenant.id(), name, routingType, tenant.features());
  }

  static String normalizeHost(String host) {
    if (host == null || host.isBlank()) {
      return null;
    }
    var value = host.trim().toLowerCase(Locale.ROOT);
    if (value.startsWith("[")) {
      int end = value.indexOf(']');
      return end > 0 ? value.substring(0, end + 1) : value;
    }
    int colon = value.indexOf(':');
    if (colon >= 0) {
      value = value.substring(0, colon);
    }
    if (value.endsWith(".")) {
      value = value.substring(0, value.length() - 1);
    }
    return value;
  }

  private static String stripTrailingSlash(String prefix) {
    if (prefix == null || prefix.isBlank()) {
      return "/client";
    }
    return prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;
  }
}
