package io.b2mash.worldtax.exception;

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

  @ExceptionHandler(RegionValidationException.class)
  public ResponseEntity<ProblemDetail> handleRegionValidation(
      RegionValidationException ex, HttpServletRequest request) {
    log.warn(
        "Region rejected: path={}, reason={}, code={}",
        request.getRequestURI(),
        ex.getReason(),
        ex.getCode());
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  @ExceptionHandler(TaxProcessingException.class)
  public ResponseEntity<ProblemDetail> handleTaxProcessing(
      TaxProcessingException ex, HttpServletRequest request) {
    log.warn(
        "Tax evaluation failed: path={}, title={}, detail={}",
        request.getRequestURI(),
        ex.getBody().getTitle(),
        ex.getBody().getDetail());
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }
}
