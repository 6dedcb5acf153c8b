package io.b2mash.tenantedge.credential;

/** Port to the external billing ledger that meters platform credential usage per tenant. */
public interface UsageLedger {

  void recordUsage(String tenantId, String platformId, String recordId, long units);
}
