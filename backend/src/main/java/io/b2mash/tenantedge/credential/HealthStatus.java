package io.b2mash.tenantedge.credential;

public enum HealthStatus {
  HEALTHY,
  UNHEALTHY,
  /** Not polled yet. */
  UNKNOWN
}
