package com.mk.fx.qa.consistency.resource;

import com.mk.fx.qa.consistency.cfg.ErrorResponse;
import com.mk.fx.qa.consistency.model.UnknownScenarioException;
import com.mk.fx.qa.consistency.rest.TransportException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps harness failures to error bodies. A failed SLO is not an error and never reaches this
 * handler: it comes back as a report with {@code passed=false}.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

  private final ApiResponseFactory responseFactory;

  @ExceptionHandler(UnknownScenarioException.class)
  public ResponseEntity<ErrorResponse> handleUnknownScenario(UnknownScenarioException ex) {
    log.warn("Rejected unknown scenario '{}'", ex.getRequested());
    return responseFactory.error(HttpStatus.BAD_REQUEST, "Unknown Scenario", ex.getMessage());
  }

  /** Invalid harness configuration, detected before any request is sent. */
  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleInvalidConfiguration(IllegalArgumentException ex) {
    log.warn("Scenario rejected, invalid configuration: {}", ex.getMessage());
    return responseFactory.error(HttpStatus.BAD_REQUEST, "Invalid Configuration", ex.getMessage());
  }

  /** The system under test could not be reached outside of a scenario's own accounting. */
  @ExceptionHandler(TransportException.class)
  public ResponseEntity<ErrorResponse> handleTransport(TransportException ex) {
    log.error("System under test unreachable: {}", ex.getMessage());
    return responseFactory.error(
        HttpStatus.BAD_GATEWAY, "System Under Test Unreachable", ex.getMessage());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
    log.error("Scenario run failed unexpectedly", ex);
    return responseFactory.error(
        HttpStatus.INTERNAL_SERVER_ERROR, "Harness Error", ex.getMessage());
  }
}
