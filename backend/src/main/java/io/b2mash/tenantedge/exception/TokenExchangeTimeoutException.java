package io.b2mash.tenantedge.exception;

import org.springframework.http.HttpStatus;

/** The token exchange got no answer in time. Not retried. */
public class TokenExchangeTimeoutException extends OAuthFlowException {

  public TokenExchangeTimeoutException(
      String provider, String redirectUrl, UpstreamTimeoutException cause) {
    super(
        HttpStatus.GATEWAY_TIMEOUT,
        ErrorKind.UpstreamTimeout,
        provider,
        redirectUrl,
        "Token exchange timed out",
        cause);
  }
}
