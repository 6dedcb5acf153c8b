package io.b2mash.tenantedge.session;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Session cookie names, redirect targets and the path patterns of each route group. Patterns use
 * Ant syntax and are matched against the tenant-relative path.
 */
@ConfigurationProperties(prefix = "tenantedge.session")
public record SessionProperties(
    @DefaultValue("session_token") String cookieName,
    @DefaultValue("refresh_token") String refreshCookieName,
    @DefaultValue("true") boolean secureCookies,
    @DefaultValue("/login") String loginPath,
    @DefaultValue("/onboarding") String onboardingPath,
    @DefaultValue("/dashboard") String dashboardPath,
    @DefaultValue("returnTo") String returnToParameter,
    @DefaultValue({"/login/**", "/signup/**"}) List<String> publicPaths,
    @DefaultValue("/onboarding/**") List<String> onboardingPaths,
    @DefaultValue("/dashboard/**") List<String> dashboardPaths,
    @DefaultValue("/api/**") List<String> apiPaths,
    @DefaultValue({"/api/oauth/*/callback", "/internal/**", "/error"})
        List<String> unguardedPaths) {}
