package io.b2mash.tenantedge.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A request value the edge cannot act on. The rejected field is named in the problem body. */
public class InvalidRequestException extends ErrorResponseException {

  private final String field;

  public InvalidRequestException(String field, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(field, detail), null);
    this.field = field;
  }

  public String getField() {
    return field;
  }

  private static ProblemDetail createProblem(String field, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid " + field);
    problem.setDetail(detail);
    problem.setProperty("field", field);
    return problem;
  }
}
