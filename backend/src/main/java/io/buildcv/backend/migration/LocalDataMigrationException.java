package io.buildcv.backend.migration;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Anonymous data could not be copied to the tenant database. The device data was kept. */
public class LocalDataMigrationException extends ErrorResponseException {

  public LocalDataMigrationException(String principalId, Throwable cause) {
    super(
        HttpStatus.INTERNAL_SERVER_ERROR,
        createProblem(
            principalId,
            cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(),
            List.of()),
        cause);
  }

  public LocalDataMigrationException(String principalId, List<String> errors) {
    super(
        HttpStatus.INTERNAL_SERVER_ERROR,
        createProblem(principalId, errors.size() + " records could not be imported", errors),
        null);
  }

  private static ProblemDetail createProblem(
      String principalId, String reason, List<String> errors) {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Data migration failed");
    problem.setDetail(
        "Local data for user " + principalId + " was not migrated and is kept: " + reason);
    if (!errors.isEmpty()) {
      problem.setProperty("errors", errors);
    }
    return problem;
  }
}
