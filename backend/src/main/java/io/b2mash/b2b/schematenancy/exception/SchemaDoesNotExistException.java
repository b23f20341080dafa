package io.b2mash.b2b.schematenancy.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class SchemaDoesNotExistException extends ErrorResponseException {

  private final String schemaName;

  public SchemaDoesNotExistException(String schemaName) {
    this(schemaName, null);
  }

  public SchemaDoesNotExistException(String schemaName, Throwable cause) {
    super(HttpStatus.NOT_FOUND, createProblem(schemaName), cause);
    this.schemaName = schemaName;
  }

  public String getSchemaName() {
    return schemaName;
  }

  private static ProblemDetail createProblem(String schemaName) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle("Schema does not exist");
    problem.setDetail("Schema " + schemaName + " does not exist");
    problem.setProperty("schemaName", schemaName);
    return problem;
  }
}
