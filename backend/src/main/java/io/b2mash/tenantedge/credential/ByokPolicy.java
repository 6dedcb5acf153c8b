package io.b2mash.tenantedge.credential;

/** Tenant key only. */
class ByokPolicy implements StrategyPolicy {

  @Override
  public CredentialResolution resolve(ResolutionCandidates candidates) {
    var platformId = candidates.platformId();
    var tenantRecord = candidates.tenantRecord().orElse(null);
    if (tenantRecord == null) {
      return CredentialResolution.failed(
          platformId,
          CredentialStrategy.BYOK,
          CredentialFailure.CREDENTIAL_UNAVAILABLE,
          "No key registered for " + platformId);
    }
    if (!tenantRecord.hasQuota()) {
      return CredentialResolution.failed(
          platformId,
          CredentialStrategy.BYOK,
          CredentialFailure.QUOTA_EXHAUSTED,
          "Quota of the registered " + platformId + " key is exhausted");
    }
    if (!tenantRecord.isUsable()) {
      return CredentialResolution.failed(
          platformId,
          CredentialStrategy.BYOK,
          CredentialFailure.CREDENTIAL_UNAVAILABLE,
          "Registered " + platformId + " key is unusable: " + tenantRecord.unusableReason());
    }
    return CredentialResolution.resolved(platformId, tenantRecord, CredentialStrategy.BYOK);
  }
}
