package io.b2mash.b2b.timeledger.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(IntervalConflictException.class)
  public ResponseEntity<ProblemDetail> handleIntervalConflict(
      IntervalConflictException ex, HttpServletRequest request) {
    var conflict = ex.getConflict();
    log.warn(
        "Interval conflict: path={}, entity={}, field={}, kind={}",
        request.getRequestURI(),
        conflict.entity(),
        conflict.field(),
        conflict.kind());
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }
}
