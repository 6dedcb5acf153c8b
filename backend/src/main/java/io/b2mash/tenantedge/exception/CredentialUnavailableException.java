package io.b2mash.tenantedge.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * No usable credential source exists under the tenant's strategy. Rendered by callers as a "needs
 * setup" state.
 */
public class CredentialUnavailableException extends ErrorResponseException {

  public CredentialUnavailableException(String platformId, String detail) {
    super(HttpStatus.CONFLICT, createProblem(platformId, detail), null);
  }

  private static ProblemDetail createProblem(String platformId, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Credential needs setup");
    problem.setDetail(detail);
    problem.setProperty("errorKind", ErrorKind.CredentialUnavailable.name());
    problem.setProperty("platformId", platformId);
    return problem;
  }
}
