package io.b2mash.tenantedge.health;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Credential health monitoring settings. The scheduler reads the poll interval and initial delay
 * straight from the environment, so both must use ISO-8601 durations (e.g. {@code PT30S}).
 *
 * @param pollInterval delay between sweeps
 * @param initialDelay delay before the first sweep after startup
 * @param retryBackoff wait before the single retry of a timed-out validation
 * @param alertCooldown minimum time between two alerts for the same credential
 * @param maxAlertsPerTenant alerts kept per tenant, newest first
 * @param healthScoreThreshold alert when the score drops below this
 * @param quotaThreshold alert when the remaining quota drops below this
 * @param expiryWarningDays alert when the credential expires within this many days
 * @param checkConcurrency validations run in parallel during a sweep
 */
@ConfigurationProperties(prefix = "tenantedge.health")
public record HealthProperties(
    @DefaultValue("PT30S") Duration pollInterval,
    @DefaultValue("PT5S") Duration initialDelay,
    @DefaultValue("PT2S") Duration retryBackoff,
    @DefaultValue("PT1H") Duration alertCooldown,
    @DefaultValue("50") int maxAlertsPerTenant,
    @DefaultValue("0.8") double healthScoreThreshold,
    @DefaultValue("1000") long quotaThreshold,
    @DefaultValue("7") int expiryWarningDays,
    @DefaultValue("10") int checkConcurrency) {}
