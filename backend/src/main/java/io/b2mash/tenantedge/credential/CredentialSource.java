package io.b2mash.tenantedge.credential;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CredentialSource {
  TENANT("tenant"),
  PLATFORM("platform");

  private final String wireValue;

  CredentialSource(String wireValue) {
    this.wireValue = wireValue;
  }

  @JsonValue
  public String getWireValue() {
    return wireValue;
  }
}
