package io.b2mash.b2b.schematenancy.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Raised when applying tenant migrations to a schema fails. Tenant creation treats it like any
 * other schema step failure and rolls the tenant back.
 */
public class MigrationFailureException extends ErrorResponseException {

  private final String schemaName;

  public MigrationFailureException(String schemaName, Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(schemaName), cause);
    this.schemaName = schemaName;
  }

  public String getSchemaName() {
    return schemaName;
  }

  private static ProblemDetail createProblem(String schemaName) {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Migration failed");
    problem.setDetail("Applying tenant migrations to schema " + schemaName + " failed");
    problem.setProperty("schemaName", schemaName);
    return problem;
  }
}
