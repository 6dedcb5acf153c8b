package io.b2mash.tenantedge.upstream;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Outbound service endpoints and the timeouts applied to every call made to them.
 *
 * @param authServiceUrl base URL of the external auth/secret service (sessions, token exchange,
 *     credential validation, secret storage)
 * @param billingServiceUrl base URL of the billing/quota ledger
 * @param connectTimeout TCP connect timeout
 * @param readTimeout response timeout; a call exceeding it fails with UpstreamTimeout
 */
@ConfigurationProperties(prefix = "tenantedge.upstream")
public record UpstreamProperties(
    String authServiceUrl,
    String billingServiceUrl,
    @DefaultValue("5s") Duration connectTimeout,
    @DefaultValue("8s") Duration readTimeout) {}
