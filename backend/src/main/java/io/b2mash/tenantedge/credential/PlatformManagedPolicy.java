package io.b2mash.tenantedge.credential;

/** Platform key only. */
class PlatformManagedPolicy implements StrategyPolicy {

  @Override
  public CredentialResolution resolve(ResolutionCandidates candidates) {
    var platformId = candidates.platformId();
    var platformRecord = candidates.platformRecord().orElse(null);
    if (platformRecord == null) {
      return CredentialResolution.failed(
          platformId,
          CredentialStrategy.PLATFORM_MANAGED,
          CredentialFailure.CREDENTIAL_UNAVAILABLE,
          "No platform credential available for " + platformId);
    }
    if (!platformRecord.hasQuota()) {
      return CredentialResolution.failed(
          platformId,
          CredentialStrategy.PLATFORM_MANAGED,
          CredentialFailure.QUOTA_EXHAUSTED,
          "Platform quota for " + platformId + " is exhausted");
    }
    if (!platformRecord.isUsable()) {
      return CredentialResolution.failed(
          platformId,
          CredentialStrategy.PLATFORM_MANAGED,
          CredentialFailure.CREDENTIAL_UNAVAILABLE,
          "Platform credential for " + platformId + " is unhealthy");
    }
    return CredentialResolution.resolved(
        platformId, platformRecord, CredentialStrategy.PLATFORM_MANAGED);
  }
}
