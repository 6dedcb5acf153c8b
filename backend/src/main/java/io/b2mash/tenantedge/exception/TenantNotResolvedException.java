package io.b2mash.tenantedge.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class TenantNotResolvedException extends ErrorResponseException {

  public TenantNotResolvedException(String detail) {
    super(HttpStatus.NOT_FOUND, createProblem(detail), null);
  }

  public ErrorKind getErrorKind() {
    return ErrorKind.TenantNotResolved;
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle("Tenant not found");
    problem.setDetail(detail);
    problem.setProperty("errorKind", ErrorKind.TenantNotResolved.name());
    return problem;
  }
}
