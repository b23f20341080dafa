package io.b2mash.b2b.schematenancy.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when a schema identifier fails validation. Never reaches the database. */
public class InvalidSchemaNameException extends ErrorResponseException {

  private final String schemaName;

  public InvalidSchemaNameException(String schemaName, String reason) {
    super(HttpStatus.BAD_REQUEST, createProblem(schemaName, reason), null);
    this.schemaName = schemaName;
  }

  public String getSchemaName() {
    return schemaName;
  }

  private static ProblemDetail createProblem(String schemaName, String reason) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid schema name");
    problem.setDetail("Schema name '" + schemaName + "' is invalid: " + reason);
    problem.setProperty("schemaName", schemaName);
    return problem;
  }
}
