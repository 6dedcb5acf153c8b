package io.b2mash.tenantedge.credential;

import io.b2mash.tenantedge.cost.FeeScheduleCatalog;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Picks the credential for one outbound call according to the tenant's strategy. Reads the registry
 * only; health is maintained by the monitor.
 */
@Component
public class CredentialResolutionEngine {

  private static final Logger log = LoggerFactory.getLogger(CredentialResolutionEngine.class);

  private final Map<CredentialStrategy, StrategyPolicy> policies =
      new EnumMap<>(CredentialStrategy.class);

  private final CredentialRegistry registry;
  private final TenantCredentialSettings settings;
  private final UsageLedger usageLedger;
  private final ApplicationEventPublisher eventPublisher;

  public CredentialResolutionEngine(
      CredentialRegistry registry,
      TenantCredentialSettings settings,
      UsageLedger usageLedger,
      ApplicationEventPublisher eventPublisher,
      FeeScheduleCatalog feeSchedules,
      CredentialPerformanceTracker performance,
      CredentialProperties properties) {
    this.registry = registry;
    this.settings = settings;
    this.usageLedger = usageLedger;
    this.eventPublisher = eventPublisher;
    policies.put(CredentialStrategy.BYOK, new ByokPolicy());
    policies.put(CredentialStrategy.PLATFORM_MANAGED, new PlatformManagedPolicy());
    policies.put(CredentialStrategy.HYBRID, new HybridPolicy());
    policies.put(
        CredentialStrategy.AUTO_RESOLVE,
        new AutoResolvePolicy(feeSchedules, performance, properties.projectionUnits()));
  }

  /** Decides without side effects. */
  public CredentialResolution preview(ResolutionRequest request) {
    var strategy = settings.strategyFor(request.tenantId());
    var capability = request.requiredCapability();
    var candidates =
        new ResolutionCandidates(
            request,
            registry
                .tenantRecord(request.tenantId(), request.platformId())
                .filter(r -> r.supports(capability)),
            registry.platformRecord(request.platformId()).filter(r -> r.supports(capability)));
    return policies.get(strategy).resolve(candidates);
  }

  /**
   * Resolves a credential for an actual call. Platform usage is reported to the billing ledger and
   * a failover raises a {@link CredentialFailoverEvent}.
   */
  public CredentialResolution resolve(ResolutionRequest request) {
    var resolution = preview(request);
    if (!resolution.isResolved()) {
      log.info(
          "Credential resolution failed: tenant={}, platform={}, strategy={}, failure={}",
          request.tenantId(),
          request.platformId(),
          resolution.strategy(),
          resolution.failure());
      return resolution;
    }

    var record = resolution.record();
    if (resolution.isFailover()) {
      log.warn(
          "Credential failover: tenant={}, platform={}, reason={}",
          request.tenantId(),
          request.platformId(),
          resolution.detail());
      eventPublisher.publishEvent(
          new CredentialFailoverEvent(
              request.tenantId(),
              request.platformId(),
              resolution.failedOverFrom().recordId(),
              record.recordId(),
              resolution.detail(),
              Instant.now()));
    }
    if (record.source() == CredentialSource.PLATFORM) {
      recordPlatformUsage(request, record);
    }
    return resolution;
  }

  private void recordPlatformUsage(ResolutionRequest request, CredentialRecord record) {
    try {
      usageLedger.recordUsage(request.tenantId(), request.platformId(), record.recordId(), 1);
    } catch (RuntimeException e) {
      // The call itself can proceed; the ledger reconciles from the billing side
      log.warn(
          "Failed to record platform usage for tenant {} on {}: {}",
          request.tenantId(),
          request.platformId(),
          e.getMessage());
    }
  }
}
