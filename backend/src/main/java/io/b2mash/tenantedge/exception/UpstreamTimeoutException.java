package io.b2mash.tenantedge.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** An outbound call exceeded its bounded timeout and was aborted. */
public class UpstreamTimeoutException extends ErrorResponseException {

  private final String upstream;

  public UpstreamTimeoutException(String upstream, Throwable cause) {
    super(HttpStatus.GATEWAY_TIMEOUT, createProblem(upstream), cause);
    this.upstream = upstream;
  }

  public String getUpstream() {
    return upstream;
  }

  private static ProblemDetail createProblem(String upstream) {
    var problem = ProblemDetail.forStatus(HttpStatus.GATEWAY_TIMEOUT);
    problem.setTitle("Upstream timeout");
    problem.setDetail("Call to " + upstream + " timed out");
    problem.setProperty("errorKind", ErrorKind.UpstreamTimeout.name());
    return problem;
  }
}
