package io.b2mash.tenantedge.session;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;

/** Classifies a tenant-relative path into its {@link RouteGroup}. Unmatched paths are unguarded. */
@Component
public class RouteGroupMatcher {

  private final AntPathMatcher pathMatcher = new AntPathMatcher();

  // Checked in insertion order; UNGUARDED first so the OAuth callback wins over /api/**
  private final Map<RouteGroup, List<String>> patterns = new LinkedHashMap<>();

  public RouteGroupMatcher(SessionProperties properties) {
    patterns.put(RouteGroup.UNGUARDED, properties.unguardedPaths());
    patterns.put(RouteGroup.PUBLIC, properties.publicPaths());
    patterns.put(RouteGroup.ONBOARDING, properties.onboardingPaths());
    patterns.put(RouteGroup.DASHBOARD, properties.dashboardPaths());
    patterns.put(RouteGroup.API, properties.apiPaths());
  }

  public RouteGroup match(String path) {
    for (var entry : patterns.entrySet()) {
      for (var pattern : entry.getValue()) {
        if (pathMatcher.match(pattern, path)) {
          return entry.getKey();
        }
      }
    }
    return RouteGroup.UNGUARDED;
  }
}
