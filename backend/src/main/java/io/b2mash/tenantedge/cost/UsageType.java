package io.b2mash.tenantedge.cost;

/** Billable usage dimensions of an integration credential. */
public enum UsageType {
  API_CALL,
  CAMPAIGN_EXECUTION,
  LEAD_PROCESSING,
  REPORT_GENERATION,
  STORAGE_GB,
  BANDWIDTH_GB
}
