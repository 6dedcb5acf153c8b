package io.b2mash.tenantedge.credential;

import io.b2mash.tenantedge.multitenancy.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/credentials")
public class CredentialController {

  private final CredentialService credentialService;
  private final CredentialResolutionEngine resolutionEngine;

  public CredentialController(
      CredentialService credentialService, CredentialResolutionEngine resolutionEngine) {
    this.credentialService = credentialService;
    this.resolutionEngine = resolutionEngine;
  }

  @GetMapping
  public ResponseEntity<List<CredentialView>> listCredentials() {
    var tenantId = RequestScopes.requireTenant().tenantId();
    return ResponseEntity.ok(credentialService.listForTenant(tenantId));
  }

  @PostMapping
  public ResponseEntity<CredentialView> registerCredential(
      @Valid @RequestBody RegisterCredentialRequest request) {
    RequestScopes.requireOnboardedSession();
    var tenantId = RequestScopes.requireTenant().tenantId();
    var view =
        credentialService.registerTenantKey(
            tenantId,
            request.platformId(),
            request.apiKey(),
            request.capabilities(),
            request.unitCost(),
            request.quota());
    return ResponseEntity.status(HttpStatus.CREATED).body(view);
  }

  @DeleteMapping("/{recordId}")
  public ResponseEntity<Void> removeCredential(@PathVariable String recordId) {
    RequestScopes.requireOnboardedSession();
    var tenantId = RequestScopes.requireTenant().tenantId();
    credentialService.removeTenantCredential(tenantId, recordId);
    return ResponseEntity.noContent().build();
  }

  @PutMapping("/strategy")
  public ResponseEntity<CredentialService.StrategyChange> changeStrategy(
      @Valid @RequestBody ChangeStrategyRequest request) {
    RequestScopes.requireOnboardedSession();
    var tenantId = RequestScopes.requireTenant().tenantId();
    return ResponseEntity.ok(credentialService.changeStrategy(tenantId, request.strategy()));
  }

  /** Which credential a call would use right now. Nothing is billed or recorded. */
  @GetMapping("/{platformId}/resolution")
  public ResponseEntity<ResolutionView> previewResolution(
      @PathVariable String platformId, @RequestParam(required = false) String capability) {
    var tenantId = RequestScopes.requireTenant().tenantId();
    var resolution =
        resolutionEngine.preview(new ResolutionRequest(tenantId, platformId, capability));
    var record = resolution.orElseThrow();
    return ResponseEntity.ok(
        new ResolutionView(
            platformId,
            resolution.strategy(),
            record.source(),
            record.recordId(),
            record.healthStatus(),
            resolution.isFailover()));
  }

  // --- DTOs ---

  public record RegisterCredentialRequest(
      @NotBlank(message = "platformId must not be blank") String platformId,
      @NotBlank(message = "apiKey must not be blank") String apiKey,
      Set<String> capabilities,
      BigDecimal unitCost,
      Long quota) {

    @Override
    public String toString() {
      return "RegisterCredentialRequest[platformId=" + platformId + "]";
    }
  }

  public record ChangeStrategyRequest(
      @NotNull(message = "strategy is required") CredentialStrategy strategy) {}

  public record ResolutionView(
      String platformId,
      CredentialStrategy strategy,
      CredentialSource source,
      String recordId,
      HealthStatus healthStatus,
      boolean failover) {}
}
