package io.b2mash.tenantedge.testutil;

import io.b2mash.tenantedge.credential.CredentialProperties;
import io.b2mash.tenantedge.credential.CredentialRecord;
import io.b2mash.tenantedge.credential.CredentialSource;
import io.b2mash.tenantedge.credential.CredentialStrategy;
import io.b2mash.tenantedge.credential.HealthStatus;
import io.b2mash.tenantedge.multitenancy.TenancyProperties;
import io.b2mash.tenantedge.multitenancy.TenancyProperties.TenantDefinition;
import io.b2mash.tenantedge.session.SessionProperties;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/** Shared builders for unit tests. */
public final class TestFixtures {

  private TestFixtures() {}

  public static TenancyProperties tenancy(String defaultTenantId) {
    return new TenancyProperties(
        List.of(
            new TenantDefinition(
                "bizoholic", "Bizoholic", List.of("bizoholic.com"), 3008, List.of("marketing"),
                CredentialStrategy.HYBRID),
            new TenantDefinition(
                "coreldove", "CoreLDove", List.of("coreldove.com"), 3007, List.of("ecommerce"),
                CredentialStrategy.PLATFORM_MANAGED),
            new TenantDefinition(
                "thrillring", "ThrillRing", List.of("thrillring.com"), 3005, List.of("gaming"),
                null),
            new TenantDefinition("7", "Tenant Seven", List.of(), null, List.of(), null)),
        "bizosaas.com",
        defaultTenantId,
        "/client");
  }

  public static SessionProperties sessionProperties() {
    return new SessionProperties(
        "session_token",
        "refresh_token",
        true,
        "/login",
        "/onboarding",
        "/dashboard",
        "returnTo",
        List.of("/login/**", "/signup/**"),
        List.of("/onboarding/**"),
        List.of("/dashboard/**"),
        List.of("/api/**"),
        List.of("/api/oauth/*/callback", "/internal/**", "/error"));
  }

  public static CredentialProperties credentialProperties(
      CredentialStrategy defaultStrategy, CredentialProperties.PlatformCredential... platform) {
    return new CredentialProperties(defaultStrategy, 1000, List.of(platform));
  }

  public static CredentialRecord tenantRecord(
      String recordId, String tenantId, String platformId, HealthStatus status, Long quota) {
    return tenantRecord(recordId, tenantId, platformId, status, quota, null, null);
  }

  public static CredentialRecord tenantRecord(
      String recordId,
      String tenantId,
      String platformId,
      HealthStatus status,
      Long quota,
      Instant expiresAt,
      BigDecimal unitCost) {
    return new CredentialRecord(
        recordId,
        tenantId,
        platformId,
        CredentialSource.TENANT,
        CredentialStrategy.BYOK,
        status,
        quota,
        expiresAt,
        status == HealthStatus.UNKNOWN ? null : Instant.now(),
        Set.of(),
        unitCost,
        "secret-" + recordId,
        "abc123",
        status == HealthStatus.UNHEALTHY ? 0.0 : 1.0,
        status == HealthStatus.UNHEALTHY ? "Quota exhausted" : null,
        false);
  }

  public static CredentialRecord platformRecord(
      String platformId, HealthStatus status, Long quota, BigDecimal unitCost) {
    return new CredentialRecord(
        "platform-" + platformId,
        null,
        platformId,
        CredentialSource.PLATFORM,
        CredentialStrategy.PLATFORM_MANAGED,
        status,
        quota,
        null,
        status == HealthStatus.UNKNOWN ? null : Instant.now(),
        Set.of(),
        unitCost,
        "platform-secret-" + platformId,
        null,
        status == HealthStatus.UNHEALTHY ? 0.0 : 1.0,
        null,
        false);
  }
}
