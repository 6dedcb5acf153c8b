package io.b2mash.tenantedge.cost;

import io.b2mash.tenantedge.credential.CredentialStrategy;
import java.math.BigDecimal;

/**
 * Projected monthly cost of staying on the current strategy versus switching. Derived on demand,
 * never stored.
 */
public record CostEstimate(
    CredentialStrategy currentStrategy,
    CredentialStrategy proposedStrategy,
    BigDecimal currentMonthlyCost,
    BigDecimal proposedMonthlyCost,
    BigDecimal savings,
    BigDecimal savingsPct,
    Recommendation recommendation) {}
