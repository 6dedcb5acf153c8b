package io.b2mash.tenantedge.cost;

public enum Recommendation {
  SWITCH,
  STAY
}
