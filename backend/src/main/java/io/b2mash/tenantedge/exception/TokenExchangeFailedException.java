package io.b2mash.tenantedge.exception;

import org.springframework.http.HttpStatus;

public class TokenExchangeFailedException extends OAuthFlowException {

  public TokenExchangeFailedException(
      String provider, String redirectUrl, String detail, Throwable cause) {
    super(
        HttpStatus.BAD_GATEWAY,
        ErrorKind.TokenExchangeFailed,
        provider,
        redirectUrl,
        detail,
        cause);
  }
}
