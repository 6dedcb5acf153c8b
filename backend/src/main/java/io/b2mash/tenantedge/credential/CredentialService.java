package io.b2mash.tenantedge.credential;

import io.b2mash.tenantedge.exception.InvalidRequestException;
import io.b2mash.tenantedge.exception.ResourceNotFoundException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Registration, removal and strategy management of tenant credentials. */
@Service
public class CredentialService {

  private static final Logger log = LoggerFactory.getLogger(CredentialService.class);

  private static final int KEY_SUFFIX_LENGTH = 6;

  private final CredentialRegistry registry;
  private final SecretStore secretStore;
  private final TenantCredentialSettings settings;
  private final CredentialPerformanceTracker performance;

  public CredentialService(
      CredentialRegistry registry,
      SecretStore secretStore,
      TenantCredentialSettings settings,
      CredentialPerformanceTracker performance) {
    this.registry = registry;
    this.secretStore = secretStore;
    this.settings = settings;
    this.performance = performance;
  }

  public List<CredentialView> listForTenant(String tenantId) {
    return registry.visibleTo(tenantId).stream().map(CredentialView::from).toList();
  }

  /**
   * Registers a tenant's own API key. The key goes to the secret store; only its reference and last
   * characters are kept. Replaces any key the tenant already holds for the platform.
   */
  public CredentialView registerTenantKey(
      String tenantId,
      String platformId,
      String apiKey,
      Set<String> capabilities,
      BigDecimal unitCost,
      Long quota) {
    if (apiKey == null || apiKey.isBlank()) {
      throw new InvalidRequestException("apiKey", "API key must not be blank");
    }
    var secretRef = secretStore.store(tenantId, platformId, apiKey);
    var suffix =
        apiKey.length() > KEY_SUFFIX_LENGTH
            ? apiKey.substring(apiKey.length() - KEY_SUFFIX_LENGTH)
            : apiKey;
    var record =
        CredentialRecord.unchecked(
            CredentialRegistry.newRecordId(),
            tenantId,
            platformId,
            CredentialSource.TENANT,
            CredentialStrategy.BYOK,
            quota,
            null,
            capabilities,
            unitCost,
            secretRef,
            suffix);
    replaceTenantRecord(record);
    log.info("Registered tenant key: tenant={}, platform={}", tenantId, platformId);
    return CredentialView.from(record);
  }

  /**
   * Registers a credential obtained through an OAuth handshake. UNKNOWN until first polled, or
   * UNHEALTHY straight away when it arrives expired or without quota.
   */
  public CredentialView registerOAuthCredential(
      String tenantId,
      String platformId,
      String credentialRef,
      Instant expiresAt,
      Long quotaRemaining,
      Set<String> capabilities) {
    var record =
        CredentialRecord.unchecked(
            CredentialRegistry.newRecordId(),
            tenantId,
            platformId,
            CredentialSource.TENANT,
            CredentialStrategy.BYOK,
            quotaRemaining,
            expiresAt,
            capabilities,
            null,
            credentialRef,
            null);
    replaceTenantRecord(record);
    log.info("Registered OAuth credential: tenant={}, platform={}", tenantId, platformId);
    return CredentialView.from(record);
  }

  public void removeTenantCredential(String tenantId, String recordId) {
    var record =
        registry
            .find(recordId)
            .filter(r -> tenantId.equals(r.tenantId()))
            .orElseThrow(() -> new ResourceNotFoundException("Credential", recordId));
    secretStore.delete(record.secretRef());
    registry.remove(recordId);
    performance.forget(recordId);
    log.info("Removed tenant credential: tenant={}, platform={}", tenantId, record.platformId());
  }

  public StrategyChange changeStrategy(String tenantId, CredentialStrategy strategy) {
    if (strategy == null) {
      throw new InvalidRequestException("strategy", "Credential strategy is required");
    }
    var previous = settings.migrate(tenantId, strategy);
    return new StrategyChange(tenantId, previous, strategy);
  }

  public CredentialStrategy currentStrategy(String tenantId) {
    return settings.strategyFor(tenantId);
  }

  /** Feeds the outcome of a call made with a resolved credential back into the tracker. */
  public void recordOutcome(String recordId, boolean success, long latencyMs, long unitsConsumed) {
    if (registry.find(recordId).isEmpty()) {
      throw new ResourceNotFoundException("Credential", recordId);
    }
    performance.recordOutcome(recordId, success, Math.max(0, latencyMs));
    if (unitsConsumed > 0) {
      registry.update(recordId, r -> r.withQuotaConsumed(unitsConsumed));
    }
  }

  private void replaceTenantRecord(CredentialRecord record) {
    registry
        .replaceTenantRecord(record)
        .ifPresent(
            existing -> {
              performance.forget(existing.recordId());
              try {
                secretStore.delete(existing.secretRef());
              } catch (RuntimeException e) {
                log.warn(
                    "Failed to delete replaced secret for tenant {} on {}: {}",
                    existing.tenantId(),
                    existing.platformId(),
                    e.getMessage());
              }
            });
  }

  public record StrategyChange(
      String tenantId, CredentialStrategy previousStrategy, CredentialStrategy currentStrategy) {}
}
