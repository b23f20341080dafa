package io.b2mash.b2b.schematenancy.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a tenant mutation is attempted while the connection's search path points at a schema
 * that is neither public nor the tenant's own. Raised before any statement is issued.
 */
public class ContextViolationException extends ErrorResponseException {

  private final String currentSchema;

  private ContextViolationException(String currentSchema, String detail) {
    super(HttpStatus.CONFLICT, createProblem(currentSchema, detail), null);
    this.currentSchema = currentSchema;
  }

  public static ContextViolationException forCreate(String currentSchema) {
    return new ContextViolationException(
        currentSchema,
        "Can't create tenant outside the public schema. Current schema is " + currentSchema + ".");
  }

  public static ContextViolationException forMutation(
      String operation, String tenantSchema, String currentSchema) {
    return new ContextViolationException(
        currentSchema,
        "Can't "
            + operation
            + " tenant "
            + tenantSchema
            + " outside its own schema or the public schema. Current schema is "
            + currentSchema
            + ".");
  }

  public String getCurrentSchema() {
    return currentSchema;
  }

  private static ProblemDetail createProblem(String currentSchema, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Schema context violation");
    problem.setDetail(detail);
    problem.setProperty("currentSchema", currentSchema);
    return problem;
  }
}
