package io.b2mash.tenantedge.credential;

import io.b2mash.tenantedge.exception.TenantNotResolvedException;
import io.b2mash.tenantedge.multitenancy.TenantResolver;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Service-to-service credential endpoints, authenticated by API key. */
@RestController
@RequestMapping("/internal/credentials")
public class InternalCredentialController {

  private final CredentialResolutionEngine resolutionEngine;
  private final CredentialService credentialService;
  private final TenantResolver tenantResolver;

  public InternalCredentialController(
      CredentialResolutionEngine resolutionEngine,
      CredentialService credentialService,
      TenantResolver tenantResolver) {
    this.resolutionEngine = resolutionEngine;
    this.credentialService = credentialService;
    this.tenantResolver = tenantResolver;
  }

  @PostMapping("/resolve")
  public ResponseEntity<ResolveResponse> resolve(@Valid @RequestBody ResolveRequest request) {
    if (tenantResolver.findById(request.tenantId()).isEmpty()) {
      throw new TenantNotResolvedException("Unknown tenant " + request.tenantId());
    }
    var resolution =
        resolutionEngine.resolve(
            new ResolutionRequest(request.tenantId(), request.platformId(), request.capability()));
    var record = resolution.orElseThrow();
    return ResponseEntity.ok(
        new ResolveResponse(
            record.source(),
            record.recordId(),
            record.platformId(),
            resolution.strategy(),
            record.secretRef(),
            resolution.isFailover()));
  }

  @PostMapping("/{recordId}/outcome")
  public ResponseEntity<Void> recordOutcome(
      @PathVariable String recordId, @RequestBody OutcomeRequest request) {
    credentialService.recordOutcome(
        recordId, request.success(), request.latencyMs(), request.unitsConsumed());
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record ResolveRequest(
      @NotBlank(message = "tenantId must not be blank") String tenantId,
      @NotBlank(message = "platformId must not be blank") String platformId,
      String capability) {}

  /**
   * @param secretRef reference the caller exchanges with the secret store for the key itself
   */
  public record ResolveResponse(
      CredentialSource source,
      String recordId,
      String platformId,
      CredentialStrategy strategy,
      String secretRef,
      boolean failover) {}

  public record OutcomeRequest(boolean success, long latencyMs, long unitsConsumed) {}
}
