package io.b2mash.tenantedge.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class QuotaExhaustedException extends ErrorResponseException {

  public QuotaExhaustedException(String platformId, String detail) {
    super(HttpStatus.TOO_MANY_REQUESTS, createProblem(platformId, detail), null);
  }

  private static ProblemDetail createProblem(String platformId, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.TOO_MANY_REQUESTS);
    problem.setTitle("Quota exceeded");
    problem.setDetail(detail);
    problem.setProperty("errorKind", ErrorKind.QuotaExhausted.name());
    problem.setProperty("platformId", platformId);
    return problem;
  }
}
