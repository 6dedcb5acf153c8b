package io.b2mash.tenantedge.cost;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.tenantedge.credential.CredentialStrategy;
import java.math.BigDecimal;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CostEstimatorTest {

  private final CostEstimator estimator = new CostEstimator(BigDecimal.TEN);

  private static FeeSchedule schedule(String base, String apiRate, long included) {
    return new FeeSchedule(
        new BigDecimal(base),
        Map.of(UsageType.API_CALL, new BigDecimal(apiRate)),
        Map.of(UsageType.API_CALL, included));
  }

  private CostEstimate estimate(FeeSchedule current, FeeSchedule proposed, long apiCalls) {
    return estimator.estimate(
        CredentialStrategy.PLATFORM_MANAGED,
        current,
        CredentialStrategy.BYOK,
        proposed,
        Map.of(UsageType.API_CALL, apiCalls));
  }

  @Test
  void identicalSchedules_stay() {
    var schedule = schedule("99.00", "0.002", 10_000);

    var estimate = estimate(schedule, schedule, 50_000);

    assertThat(estimate.savings()).isEqualByComparingTo("0");
    assertThat(estimate.savingsPct()).isEqualTo(new BigDecimal("0.00"));
    assertThat(estimate.recommendation()).isEqualTo(Recommendation.STAY);
  }

  @Test
  void usageBeyondIncludedQuota_isBilled() {
    var cost =
        estimator.projectMonthlyCost(
            schedule("99", "0.002", 10_000), Map.of(UsageType.API_CALL, 60_000L));

    assertThat(cost).isEqualTo(new BigDecimal("199.00"));
  }

  @Test
  void usageWithinIncludedQuota_costsBaseFeeOnly() {
    var cost =
        estimator.projectMonthlyCost(
            schedule("29", "0.002", 10_000), Map.of(UsageType.API_CALL, 5_000L));

    assertThat(cost).isEqualTo(new BigDecimal("29.00"));
  }

  @Test
  void savingsAboveThreshold_switch() {
    var estimate = estimate(schedule("100", "0", 0), schedule("80", "0", 0), 0);

    assertThat(estimate.savings()).isEqualByComparingTo("20");
    assertThat(estimate.savingsPct()).isEqualTo(new BigDecimal("20.00"));
    assertThat(estimate.recommendation()).isEqualTo(Recommendation.SWITCH);
  }

  @Test
  void savingsExactlyAtThreshold_stay() {
    var estimate = estimate(schedule("100", "0", 0), schedule("90", "0", 0), 0);

    assertThat(estimate.savingsPct()).isEqualTo(new BigDecimal("10.00"));
    assertThat(estimate.recommendation()).isEqualTo(Recommendation.STAY);
  }

  @Test
  void moreExpensiveProposal_hasNegativeSavings() {
    var estimate = estimate(schedule("50", "0", 0), schedule("75", "0", 0), 0);

    assertThat(estimate.savingsPct()).isEqualTo(new BigDecimal("-50.00"));
    assertThat(estimate.recommendation()).isEqualTo(Recommendation.STAY);
  }

  @Test
  void freeCurrentSchedule_reportsZeroPercent() {
    var estimate = estimate(schedule("0", "0", 0), schedule("10", "0", 0), 100);

    assertThat(estimate.savingsPct()).isEqualTo(new BigDecimal("0.00"));
    assertThat(estimate.recommendation()).isEqualTo(Recommendation.STAY);
  }

  @Test
  void missingUsage_costsBaseFee() {
    assertThat(estimator.projectMonthlyCost(schedule("29", "0.002", 0), null))
        .isEqualTo(new BigDecimal("29.00"));
  }
}
