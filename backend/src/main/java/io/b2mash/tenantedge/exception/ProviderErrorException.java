package io.b2mash.tenantedge.exception;

import org.springframework.http.HttpStatus;

/** The provider redirected back with an {@code error} parameter instead of a code. */
public class ProviderErrorException extends OAuthFlowException {

  private final String providerErrorCode;

  public ProviderErrorException(String provider, String providerErrorCode) {
    super(
        HttpStatus.BAD_GATEWAY,
        ErrorKind.ProviderError,
        provider,
        null,
        "Provider rejected the authorization request",
        null);
    this.providerErrorCode = providerErrorCode;
  }

  public String getProviderErrorCode() {
    return providerErrorCode;
  }
}
