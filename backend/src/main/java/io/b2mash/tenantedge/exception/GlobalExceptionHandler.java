package io.b2mash.tenantedge.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler({CredentialUnavailableException.class, QuotaExhaustedException.class})
  public ResponseEntity<ProblemDetail> handleCredentialFailure(
      ErrorResponseException ex, HttpServletRequest request) {
    log.warn(
        "Credential resolution failed: path={}, kind={}, detail={}",
        request.getRequestURI(),
        ex.getBody().getProperties() != null ? ex.getBody().getProperties().get("errorKind") : null,
        ex.getBody().getDetail());
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  @ExceptionHandler(UpstreamTimeoutException.class)
  public ResponseEntity<ProblemDetail> handleUpstreamTimeout(
      UpstreamTimeoutException ex, HttpServletRequest request) {
    log.warn(
        "Upstream timeout: path={}, upstream={}", request.getRequestURI(), ex.getUpstream());
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  @ExceptionHandler(InvalidRequestException.class)
  public ResponseEntity<ProblemDetail> handleInvalidRequest(
      InvalidRequestException ex, HttpServletRequest request) {
    log.warn(
        "Rejected request: path={}, field={}, detail={}",
        request.getRequestURI(),
        ex.getField(),
        ex.getBody().getDetail());
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  @ExceptionHandler(UnauthenticatedException.class)
  public ResponseEntity<ProblemDetail> handleUnauthenticated(
      UnauthenticatedException ex, HttpServletRequest request) {
    log.warn("Unauthenticated: path={}, method={}", request.getRequestURI(), request.getMethod());
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }
}
