package io.b2mash.b2b.schematenancy.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class SchemaAlreadyExistsException extends ErrorResponseException {

  private final String schemaName;

  public SchemaAlreadyExistsException(String schemaName, Throwable cause) {
    super(HttpStatus.CONFLICT, createProblem(schemaName), cause);
    this.schemaName = schemaName;
  }

  public String getSchemaName() {
    return schemaName;
  }

  private static ProblemDetail createProblem(String schemaName) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Schema already exists");
    problem.setDetail("Schema " + schemaName + " already exists");
    problem.setProperty("schemaName", schemaName);
    return problem;
  }
}
