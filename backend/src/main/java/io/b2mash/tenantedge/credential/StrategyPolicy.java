package io.b2mash.tenantedge.credential;

/** Decision rule of one {@link CredentialStrategy}. Implementations are stateless. */
interface StrategyPolicy {

  CredentialResolution resolve(ResolutionCandidates candidates);
}
