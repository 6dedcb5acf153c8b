package io.b2mash.tenantedge.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Base type for failures of the OAuth callback. Carries the error kind for the {@code ?error=}
 * redirect and, once the state has been decoded, the redirect URL the flow started with.
 */
public abstract class OAuthFlowException extends ErrorResponseException {

  private final ErrorKind errorKind;
  private final String provider;
  private final String redirectUrl;

  protected OAuthFlowException(
      HttpStatus status,
      ErrorKind errorKind,
      String provider,
      String redirectUrl,
      String detail,
      Throwable cause) {
    super(status, createProblem(status, errorKind, detail), cause);
    this.errorKind = errorKind;
    this.provider = provider;
    this.redirectUrl = redirectUrl;
  }

  public ErrorKind getErrorKind() {
    return errorKind;
  }

  public String getProvider() {
    return provider;
  }

  /** Redirect URL decoded from the state, or null if the state was never decoded. */
  public String getRedirectUrl() {
    return redirectUrl;
  }

  private static ProblemDetail createProblem(HttpStatus status, ErrorKind kind, String detail) {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle("OAuth " + kind.name());
    problem.setDetail(detail);
    problem.setProperty("errorKind", kind.name());
    return problem;
  }
}
