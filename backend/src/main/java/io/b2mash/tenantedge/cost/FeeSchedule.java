package io.b2mash.tenantedge.cost;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Monthly pricing of one credential strategy.
 *
 * @param monthlyBaseFee flat monthly fee
 * @param perUnitRates price per unit above the included quota
 * @param includedQuota units per month covered by the base fee
 */
public record FeeSchedule(
    BigDecimal monthlyBaseFee,
    Map<UsageType, BigDecimal> perUnitRates,
    Map<UsageType, Long> includedQuota) {

  public FeeSchedule {
    monthlyBaseFee = monthlyBaseFee == null ? BigDecimal.ZERO : monthlyBaseFee;
    perUnitRates = perUnitRates == null || perUnitRates.isEmpty()
        ? Map.of()
        : Map.copyOf(new EnumMap<>(perUnitRates));
    includedQuota = includedQuota == null || includedQuota.isEmpty()
        ? Map.of()
        : Map.copyOf(new EnumMap<>(includedQuota));
  }

  public BigDecimal rateFor(UsageType type) {
    return perUnitRates.getOrDefault(type, BigDecimal.ZERO);
  }

  public long includedFor(UsageType type) {
    return includedQuota.getOrDefault(type, 0L);
  }
}
