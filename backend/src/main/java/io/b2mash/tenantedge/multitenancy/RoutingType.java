package io.b2mash.tenantedge.multitenancy;

/** How a request was mapped to its tenant. */
public enum RoutingType {
  CUSTOM_DOMAIN("custom_domain"),
  SUBDOMAIN("subdomain"),
  PATH_BASED("path_based"),
  DEFAULT("default");

  private final String wireValue;

  RoutingType(String wireValue) {
    this.wireValue = wireValue;
  }

  /** Value propagated in the {@code routing-type} header. */
  public String getWireValue() {
    return wireValue;
  }
}
