package io.b2mash.tenantedge.credential;

import io.b2mash.tenantedge.cost.FeeScheduleCatalog;
import io.b2mash.tenantedge.cost.UsageType;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Cheapest healthy candidate with quota left. Every candidate is priced over the same expected
 * demand; a candidate whose remaining quota cannot cover that demand ranks after those that can.
 * Equal costs go to the better-performing record.
 */
class AutoResolvePolicy implements StrategyPolicy {

  private final FeeScheduleCatalog feeSchedules;
  private final CredentialPerformanceTracker performance;
  private final long projectionUnits;

  AutoResolvePolicy(
      FeeScheduleCatalog feeSchedules,
      CredentialPerformanceTracker performance,
      long projectionUnits) {
    this.feeSchedules = feeSchedules;
    this.performance = performance;
    this.projectionUnits = projectionUnits;
  }

  @Override
  public CredentialResolution resolve(ResolutionCandidates candidates) {
    var platformId = candidates.platformId();
    var all =
        Stream.of(candidates.tenantRecord(), candidates.platformRecord())
            .flatMap(Optional::stream)
            .toList();

    var chosen =
        all.stream()
            .filter(r -> r.healthStatus() == HealthStatus.HEALTHY)
            .filter(CredentialRecord::isUsable)
            .filter(CredentialRecord::hasQuota)
            .min(cheapestThenFastest());
    if (chosen.isPresent()) {
      return CredentialResolution.resolved(
          platformId, chosen.get(), CredentialStrategy.AUTO_RESOLVE);
    }

    if (!all.isEmpty() && all.stream().noneMatch(CredentialRecord::hasQuota)) {
      return CredentialResolution.failed(
          platformId,
          CredentialStrategy.AUTO_RESOLVE,
          CredentialFailure.QUOTA_EXHAUSTED,
          "All credentials for " + platformId + " are out of quota");
    }
    return CredentialResolution.failed(
        platformId,
        CredentialStrategy.AUTO_RESOLVE,
        CredentialFailure.CREDENTIAL_UNAVAILABLE,
        "No healthy credential for " + platformId);
  }

  private Comparator<CredentialRecord> cheapestThenFastest() {
    // false sorts first: candidates covering the demand win over cheaper ones that cannot
    Comparator<CredentialRecord> byShortfall = Comparator.comparing(r -> !coversDemand(r));
    Comparator<CredentialRecord> byCost = Comparator.comparing(this::projectedCost);
    Comparator<CredentialRecord> bySuccessRate =
        Comparator.comparingDouble(
            (CredentialRecord r) -> performance.statsFor(r.recordId()).successRate());
    Comparator<CredentialRecord> byLatency =
        Comparator.comparingDouble(
            (CredentialRecord r) -> performance.statsFor(r.recordId()).averageLatencyMs());
    return byShortfall
        .thenComparing(byCost)
        .thenComparing(bySuccessRate.reversed())
        .thenComparing(byLatency);
  }

  BigDecimal projectedCost(CredentialRecord record) {
    return unitCost(record).multiply(BigDecimal.valueOf(projectionUnits));
  }

  boolean coversDemand(CredentialRecord record) {
    return record.quotaRemaining() == null || record.quotaRemaining() >= projectionUnits;
  }

  private BigDecimal unitCost(CredentialRecord record) {
    if (record.unitCost() != null) {
      return record.unitCost();
    }
    var strategy =
        record.source() == CredentialSource.TENANT
            ? CredentialStrategy.BYOK
            : CredentialStrategy.PLATFORM_MANAGED;
    var schedules = feeSchedules.all();
    var schedule = schedules.get(strategy);
    return schedule == null ? BigDecimal.ZERO : schedule.rateFor(UsageType.API_CALL);
  }
}
