package io.b2mash.tenantedge.health;

import io.b2mash.tenantedge.credential.CredentialCheck;
import io.b2mash.tenantedge.credential.CredentialRecord;
import io.b2mash.tenantedge.credential.CredentialRegistry;
import io.b2mash.tenantedge.exception.UpstreamTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically validates every registered credential and writes the result back to the registry.
 * Validations of one sweep run in parallel on the credential check pool; the sweep returns once
 * every record has been checked. A timed-out validation is retried once; any other failure marks
 * the credential unhealthy.
 */
@Component
public class CredentialHealthMonitor {

  private static final Logger log = LoggerFactory.getLogger(CredentialHealthMonitor.class);

  private final CredentialRegistry registry;
  private final CredentialValidator validator;
  private final HealthAlertService alertService;
  private final FallbackProvider fallbackProvider;
  private final Duration retryBackoff;
  private final Executor checkExecutor;

  @Autowired
  public CredentialHealthMonitor(
      CredentialRegistry registry,
      CredentialValidator validator,
      HealthAlertService alertService,
      ObjectProvider<FallbackProvider> fallbackProvider,
      HealthProperties properties,
      @Qualifier(HealthCheckExecutorConfig.CREDENTIAL_CHECK_EXECUTOR) Executor checkExecutor) {
    this(
        registry,
        validator,
        alertService,
        fallbackProvider.getIfAvailable(),
        properties.retryBackoff(),
        checkExecutor);
  }

  CredentialHealthMonitor(
      CredentialRegistry registry,
      CredentialValidator validator,
      HealthAlertService alertService,
      FallbackProvider fallbackProvider,
      Duration retryBackoff,
      Executor checkExecutor) {
    this.registry = registry;
    this.validator = validator;
    this.alertService = alertService;
    this.fallbackProvider = fallbackProvider;
    this.retryBackoff = retryBackoff;
    this.checkExecutor = checkExecutor;
    if (fallbackProvider != null) {
      log.warn("Credential fallback provider active; failed checks will apply sample data");
    }
  }

  @Scheduled(
      fixedDelayString = "${tenantedge.health.poll-interval:PT30S}",
      initialDelayString = "${tenantedge.health.initial-delay:PT5S}")
  public void sweep() {
    var checked = checkAll(registry.all());
    if (!checked.isEmpty()) {
      long unhealthy = checked.stream().filter(r -> !r.isUsable()).count();
      log.debug("Credential health sweep: checked={}, unhealthy={}", checked.size(), unhealthy);
    }
  }

  /** Checks the tenant's credentials now, optionally only those for one platform. */
  public List<CredentialRecord> checkTenant(String tenantId, String platformId) {
    var selected =
        registry.visibleTo(tenantId).stream()
            .filter(r -> platformId == null || platformId.equals(r.platformId()))
            .toList();
    return checkAll(selected);
  }

  private List<CredentialRecord> checkAll(Collection<CredentialRecord> records) {
    var checks =
        records.stream()
            .map(
                record ->
                    CompletableFuture.supplyAsync(() -> check(record), checkExecutor)
                        .exceptionally(
                            e -> {
                              var cause = e instanceof CompletionException ? e.getCause() : e;
                              log.warn(
                                  "Health check failed for credential {} ({}): {}",
                                  record.recordId(),
                                  record.platformId(),
                                  cause.getMessage());
                              return Optional.empty();
                            }))
            .toList();
    CompletableFuture.allOf(checks.toArray(new CompletableFuture<?>[0])).join();
    return checks.stream().map(CompletableFuture::join).flatMap(Optional::stream).toList();
  }

  /** Validates one record and stores the outcome. Empty if the record was removed meanwhile. */
  public Optional<CredentialRecord> check(CredentialRecord record) {
    var result = validate(record);
    var now = Instant.now();
    var quota = result.quotaRemaining() != null ? result.quotaRemaining() : record.quotaRemaining();
    var expiry = result.expiresAt() != null ? result.expiresAt() : record.expiresAt();
    var score = HealthScore.calculate(quota, expiry, now);

    var updated =
        registry.update(record.recordId(), current -> current.withCheckResult(result, score, now));
    updated.ifPresent(r -> alertService.evaluate(r, now));
    return updated;
  }

  private CredentialCheck validate(CredentialRecord record) {
    try {
      return validateWithRetry(record);
    } catch (RuntimeException e) {
      if (fallbackProvider != null) {
        log.info(
            "Applying sample health data for credential {} after failure: {}",
            record.recordId(),
            e.getMessage());
        return fallbackProvider.sampleCheck(record).asDegraded();
      }
      return CredentialCheck.failed(e.getMessage());
    }
  }

  private CredentialCheck validateWithRetry(CredentialRecord record) {
    try {
      return validator.validate(record);
    } catch (UpstreamTimeoutException e) {
      log.info(
          "Validation of credential {} timed out; retrying in {}", record.recordId(), retryBackoff);
      pause(e);
      return validator.validate(record);
    }
  }

  private void pause(UpstreamTimeoutException cause) {
    if (retryBackoff.isZero() || retryBackoff.isNegative()) {
      return;
    }
    try {
      Thread.sleep(retryBackoff.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw cause;
    }
  }
}
