package com.radar.api.controller;

import com.radar.anomaly.error.AnomalyNotFoundException;
import com.radar.anomaly.error.DataUnavailableException;
import com.radar.anomaly.error.IllegalStatusTransitionException;
import com.radar.anomaly.error.InvalidRuleConfigException;
import com.radar.api.model.ErrorResponse;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({InvalidRuleConfigException.class, IllegalArgumentException.class,
      MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class,
      HttpMessageNotReadableException.class})
  public ResponseEntity<ErrorResponse> badRequest(Exception e) {
    return error(HttpStatus.BAD_REQUEST, e.getMessage());
  }

  @ExceptionHandler(AnomalyNotFoundException.class)
  public ResponseEntity<ErrorResponse> notFound(AnomalyNotFoundException e) {
    return error(HttpStatus.NOT_FOUND, e.getMessage());
  }

  @ExceptionHandler(IllegalStatusTransitionException.class)
  public ResponseEntity<ErrorResponse> conflict(IllegalStatusTransitionException e) {
    return error(HttpStatus.CONFLICT, e.getMessage());
  }

  @ExceptionHandler(DataUnavailableException.class)
  public ResponseEntity<ErrorResponse> unprocessable(DataUnavailableException e) {
    return error(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> internal(Exception e) {
    log.error("Unhandled API error", e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal error");
  }

  private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
    return ResponseEntity.status(status)
        .body(new ErrorResponse(status.getReasonPhrase(), message, Instant.now()));
  }
}
