package com.scholary.avatar.api;

import com.scholary.avatar.service.GenerationTimeoutException;
import com.scholary.avatar.service.InvalidInputException;
import com.scholary.avatar.service.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps generation failures to HTTP responses.
 *
 * <ul>
 *   <li>invalid input: 400
 *   <li>bad or missing API key: 401
 *   <li>provider or storage failure: 502
 *   <li>polling budget exceeded: 504
 *   <li>Spring exceptions that carry a status: that status
 *   <li>anything else: 500
 * </ul>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidInputException.class)
  public ResponseEntity<ErrorResponse> handleInvalidInput(InvalidInputException e) {
    return respond(HttpStatus.BAD_REQUEST, e.getMessage());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
    return respond(HttpStatus.BAD_REQUEST, "Malformed JSON request body");
  }

  @ExceptionHandler(UnauthorizedException.class)
  public ResponseEntity<ErrorResponse> handleUnauthorized(UnauthorizedException e) {
    return respond(HttpStatus.UNAUTHORIZED, e.getMessage());
  }

  @ExceptionHandler(UpstreamException.class)
  public ResponseEntity<ErrorResponse> handleUpstream(UpstreamException e) {
    LOGGER.warn("Upstream failure: jobId={}, message={}", e.getJobId(), e.getMessage());
    return respond(HttpStatus.BAD_GATEWAY, e.getMessage());
  }

  @ExceptionHandler(GenerationTimeoutException.class)
  public ResponseEntity<ErrorResponse> handleTimeout(GenerationTimeoutException e) {
    LOGGER.warn("Generation timed out: jobId={}", e.getJobId());
    return respond(HttpStatus.GATEWAY_TIMEOUT, e.getMessage());
  }

  @ExceptionHandler(ErrorResponseException.class)
  public ResponseEntity<ErrorResponse> handleWithStatus(ErrorResponseException e) {
    String detail = e.getBody().getDetail();
    return respond(e.getStatusCode(), detail != null ? detail : e.getMessage());
  }

  @ExceptionHandler(TypeMismatchException.class)
  public ResponseEntity<ErrorResponse> handleTypeMismatch(TypeMismatchException e) {
    String message =
        e.getPropertyName() == null
            ? String.format("Invalid value '%s'", e.getValue())
            : String.format("Invalid value '%s' for '%s'", e.getValue(), e.getPropertyName());
    return respond(HttpStatus.BAD_REQUEST, message);
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(RuntimeException e) {
    LOGGER.error("Unexpected error", e);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error: " + e.getMessage());
  }

  private static ResponseEntity<ErrorResponse> respond(HttpStatusCode status, String message) {
    return ResponseEntity.status(status).body(new ErrorResponse(message));
  }
}
