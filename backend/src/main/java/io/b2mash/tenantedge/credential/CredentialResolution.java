package io.b2mash.tenantedge.credential;

import io.b2mash.tenantedge.exception.CredentialUnavailableException;
import io.b2mash.tenantedge.exception.QuotaExhaustedException;

/**
 * Result of resolving a credential: either a chosen record or a typed failure.
 *
 * @param record chosen record, null on failure
 * @param strategy strategy the decision was made under
 * @param failure failure kind, null on success
 * @param detail human-readable reason for a failure or fallback
 * @param failedOverFrom tenant record that was passed over in favour of the platform, or null
 */
public record CredentialResolution(
    String platformId,
    CredentialRecord record,
    CredentialStrategy strategy,
    CredentialFailure failure,
    String detail,
    CredentialRecord failedOverFrom) {

  public static CredentialResolution resolved(
      String platformId, CredentialRecord record, CredentialStrategy strategy) {
    return new CredentialResolution(platformId, record, strategy, null, null, null);
  }

  public static CredentialResolution failedOver(
      String platformId,
      CredentialRecord platformRecord,
      CredentialRecord tenantRecord,
      String reason) {
    return new CredentialResolution(
        platformId, platformRecord, CredentialStrategy.HYBRID, null, reason, tenantRecord);
  }

  public static CredentialResolution failed(
      String platformId, CredentialStrategy strategy, CredentialFailure failure, String detail) {
    return new CredentialResolution(platformId, null, strategy, failure, detail, null);
  }

  public boolean isResolved() {
    return record != null;
  }

  public boolean isFailover() {
    return failedOverFrom != null;
  }

  /** Returns the chosen record or throws the exception matching the failure kind. */
  public CredentialRecord orElseThrow() {
    if (record != null) {
      return record;
    }
    if (failure == CredentialFailure.QUOTA_EXHAUSTED) {
      throw new QuotaExhaustedException(platformId, detail);
    }
    throw new CredentialUnavailableException(platformId, detail);
  }
}
