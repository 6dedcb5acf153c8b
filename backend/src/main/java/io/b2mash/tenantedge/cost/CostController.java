package io.b2mash.tenantedge.cost;

import io.b2mash.tenantedge.credential.CredentialStrategy;
import io.b2mash.tenantedge.credential.TenantCredentialSettings;
import io.b2mash.tenantedge.multitenancy.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** What-if cost comparison between the tenant's strategy and another. Changes nothing. */
@RestController
@RequestMapping("/api/credentials")
public class CostController {

  private final CostEstimator costEstimator;
  private final FeeScheduleCatalog feeScheduleCatalog;
  private final TenantCredentialSettings credentialSettings;

  public CostController(
      CostEstimator costEstimator,
      FeeScheduleCatalog feeScheduleCatalog,
      TenantCredentialSettings credentialSettings) {
    this.costEstimator = costEstimator;
    this.feeScheduleCatalog = feeScheduleCatalog;
    this.credentialSettings = credentialSettings;
  }

  @PostMapping("/estimate")
  public ResponseEntity<CostEstimate> estimate(@Valid @RequestBody EstimateRequest request) {
    var tenantId = RequestScopes.requireTenant().tenantId();
    var current = credentialSettings.strategyFor(tenantId);
    var proposed = request.proposedStrategy();
    return ResponseEntity.ok(
        costEstimator.estimate(
            current,
            feeScheduleCatalog.scheduleFor(current),
            proposed,
            feeScheduleCatalog.scheduleFor(proposed),
            request.usage() != null ? request.usage() : Map.of()));
  }

  @GetMapping("/tiers")
  public ResponseEntity<Map<CredentialStrategy, FeeSchedule>> tiers() {
    return ResponseEntity.ok(feeScheduleCatalog.all());
  }

  // --- DTOs ---

  public record EstimateRequest(
      @NotNull(message = "proposedStrategy is required") CredentialStrategy proposedStrategy,
      Map<UsageType, Long> usage) {}
}
