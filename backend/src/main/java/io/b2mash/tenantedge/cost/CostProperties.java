package io.b2mash.tenantedge.cost;

import io.b2mash.tenantedge.credential.CredentialStrategy;
import java.math.BigDecimal;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param savingsThresholdPct minimum savings percentage before a switch is recommended
 * @param feeSchedules pricing per credential strategy
 */
@ConfigurationProperties(prefix = "tenantedge.cost")
public record CostProperties(
    @DefaultValue("10") BigDecimal savingsThresholdPct,
    Map<CredentialStrategy, FeeSchedule> feeSchedules) {

  public CostProperties {
    feeSchedules = feeSchedules == null ? Map.of() : Map.copyOf(feeSchedules);
  }
}
