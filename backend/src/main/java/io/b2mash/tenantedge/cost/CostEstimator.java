package io.b2mash.tenantedge.cost;

import io.b2mash.tenantedge.credential.CredentialStrategy;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Compares the projected monthly cost of two fee schedules for the same usage. Pure and
 * deterministic: no state is read or written, so "what-if" comparisons can be repeated freely.
 */
@Component
public class CostEstimator {

  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private final BigDecimal savingsThresholdPct;

  @Autowired
  public CostEstimator(CostProperties properties) {
    this(properties.savingsThresholdPct());
  }

  CostEstimator(BigDecimal savingsThresholdPct) {
    this.savingsThresholdPct = savingsThresholdPct;
  }

  public CostEstimate estimate(
      CredentialStrategy currentStrategy,
      FeeSchedule current,
      CredentialStrategy proposedStrategy,
      FeeSchedule proposed,
      Map<UsageType, Long> usage) {
    var currentCost = projectMonthlyCost(current, usage);
    var proposedCost = projectMonthlyCost(proposed, usage);
    var savings = currentCost.subtract(proposedCost);

    var savingsPct =
        currentCost.signum() == 0
            ? BigDecimal.ZERO.setScale(2)
            : savings.multiply(HUNDRED).divide(currentCost, 2, RoundingMode.HALF_UP);

    var recommendation =
        savingsPct.compareTo(savingsThresholdPct) > 0 ? Recommendation.SWITCH : Recommendation.STAY;

    return new CostEstimate(
        currentStrategy,
        proposedStrategy,
        currentCost,
        proposedCost,
        savings,
        savingsPct,
        recommendation);
  }

  /** Base fee plus every usage dimension billed above its included quota. */
  public BigDecimal projectMonthlyCost(FeeSchedule schedule, Map<UsageType, Long> usage) {
    var total = schedule.monthlyBaseFee();
    if (usage != null) {
      for (var entry : usage.entrySet()) {
        long units = entry.getValue() == null ? 0 : entry.getValue();
        long billable = Math.max(0, units - schedule.includedFor(entry.getKey()));
        if (billable > 0) {
          var rate = schedule.rateFor(entry.getKey());
          total = total.add(rate.multiply(BigDecimal.valueOf(billable)));
        }
      }
    }
    return total.setScale(2, RoundingMode.HALF_UP);
  }
}
