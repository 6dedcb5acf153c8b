package io.b2mash.tenantedge.exception;

import org.springframework.http.HttpStatus;

public class InvalidOAuthStateException extends OAuthFlowException {

  public InvalidOAuthStateException(String provider, String detail) {
    super(HttpStatus.BAD_REQUEST, ErrorKind.InvalidOAuthState, provider, null, detail, null);
  }
}
