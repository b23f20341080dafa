package io.b2mash.b2b.schematenancy.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class TenantNotFoundException extends ErrorResponseException {

  public TenantNotFoundException(String schemaName) {
    super(HttpStatus.NOT_FOUND, createProblem(schemaName), null);
  }

  private static ProblemDetail createProblem(String schemaName) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle("Tenant not found");
    problem.setDetail("No tenant found with schema " + schemaName);
    return problem;
  }
}
