package io.b2mash.tenantedge.upstream;

/** External collaborators reached over HTTP. */
public enum Upstream {
  AUTH_SERVICE("auth-service"),
  BILLING_SERVICE("billing-service");

  private final String displayName;

  Upstream(String displayName) {
    this.displayName = displayName;
  }

  public String getDisplayName() {
    return displayName;
  }
}
