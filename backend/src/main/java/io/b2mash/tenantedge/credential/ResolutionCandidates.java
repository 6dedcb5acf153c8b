package io.b2mash.tenantedge.credential;

import java.util.Optional;

/** Credentials that may serve one request, already filtered by capability. */
record ResolutionCandidates(
    ResolutionRequest request,
    Optional<CredentialRecord> tenantRecord,
    Optional<CredentialRecord> platformRecord) {

  String platformId() {
    return request.platformId();
  }
}
