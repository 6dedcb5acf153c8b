package io.b2mash.tenantedge.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class UnauthenticatedException extends ErrorResponseException {

  public UnauthenticatedException(String detail) {
    super(HttpStatus.UNAUTHORIZED, createProblem(detail), null);
  }

  public ErrorKind getErrorKind() {
    return ErrorKind.Unauthenticated;
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNAUTHORIZED);
    problem.setTitle("Authentication required");
    problem.setDetail(detail);
    problem.setProperty("errorKind", ErrorKind.Unauthenticated.name());
    return problem;
  }
}
