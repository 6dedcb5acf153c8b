package io.b2mash.tenantedge.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class NotOnboardedException extends ErrorResponseException {

  public NotOnboardedException(String detail) {
    super(HttpStatus.FORBIDDEN, createProblem(detail), null);
  }

  public ErrorKind getErrorKind() {
    return ErrorKind.NotOnboarded;
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Onboarding incomplete");
    problem.setDetail(detail);
    problem.setProperty("errorKind", ErrorKind.NotOnboarded.name());
    return problem;
  }
}
