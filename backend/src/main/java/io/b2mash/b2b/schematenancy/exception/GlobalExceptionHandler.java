package io.b2mash.b2b.schematenancy.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(ContextViolationException.class)
  public ResponseEntity<ProblemDetail> handleContextViolation(
      ContextViolationException ex, HttpServletRequest request) {
    log.warn(
        "Context violation: path={}, method={}, currentSchema={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getCurrentSchema());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(ex.getBody());
  }

  @ExceptionHandler(MigrationFailureException.class)
  public ResponseEntity<ProblemDetail> handleMigrationFailure(MigrationFailureException ex) {
    log.error("Tenant migration failed for schema {}", ex.getSchemaName(), ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ex.getBody());
  }

  /** Duplicate schema names and domains surface here from the unique constraints. */
  @ExceptionHandler(DataIntegrityViolationException.class)
  public ResponseEntity<ProblemDetail> handleIntegrityViolation(
      DataIntegrityViolationException ex) {
    log.warn("Integrity violation: {}", ex.getMostSpecificCause().getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Integrity violation");
    problem.setDetail(ex.getMostSpecificCause().getMessage());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }
}
