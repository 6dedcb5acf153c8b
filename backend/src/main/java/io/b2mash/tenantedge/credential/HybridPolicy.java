package io.b2mash.tenantedge.credential;

/** Tenant key while it is usable, platform key otherwise. */
class HybridPolicy implements StrategyPolicy {

  @Override
  public CredentialResolution resolve(ResolutionCandidates candidates) {
    var platformId = candidates.platformId();
    var tenantRecord = candidates.tenantRecord().orElse(null);
    if (tenantRecord != null && tenantRecord.isUsable() && tenantRecord.hasQuota()) {
      return CredentialResolution.resolved(platformId, tenantRecord, CredentialStrategy.HYBRID);
    }

    var platformRecord = candidates.platformRecord().orElse(null);
    if (platformRecord != null && platformRecord.isUsable() && platformRecord.hasQuota()) {
      if (tenantRecord == null) {
        return CredentialResolution.resolved(platformId, platformRecord, CredentialStrategy.HYBRID);
      }
      var reason =
          tenantRecord.hasQuota()
              ? "Tenant key unusable: " + tenantRecord.unusableReason()
              : "Tenant key quota exhausted";
      return CredentialResolution.failedOver(platformId, platformRecord, tenantRecord, reason);
    }

    if (platformRecord != null && !platformRecord.hasQuota()) {
      return CredentialResolution.failed(
          platformId,
          CredentialStrategy.HYBRID,
          CredentialFailure.QUOTA_EXHAUSTED,
          "Tenant key unusable and platform quota for " + platformId + " is exhausted");
    }
    return CredentialResolution.failed(
        platformId,
        CredentialStrategy.HYBRID,
        CredentialFailure.CREDENTIAL_UNAVAILABLE,
        "No usable credential for " + platformId);
  }
}
