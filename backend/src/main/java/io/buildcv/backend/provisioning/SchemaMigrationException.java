package io.buildcv.backend.provisioning;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class SchemaMigrationException extends ErrorResponseException {

  public SchemaMigrationException(String dbName, Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(dbName, cause), cause);
  }

  private static ProblemDetail createProblem(String dbName, Throwable cause) {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Schema migration failed");
    problem.setDetail(
        "Could not apply schema to database "
            + dbName
            + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""));
    return problem;
  }
}
