package io.buildcv.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class TenantDatabaseNotReadyException extends ErrorResponseException {

  private final String principalId;

  public TenantDatabaseNotReadyException(String principalId, String status) {
    super(HttpStatus.CONFLICT, createProblem(principalId, status), null);
    this.principalId = principalId;
  }

  public String getPrincipalId() {
    return principalId;
  }

  private static ProblemDetail createProblem(String principalId, String status) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Tenant database not ready");
    problem.setDetail(
        "Database for user " + principalId + " is in status " + status + ", expected READY");
    problem.setProperty("status", status);
    return problem;
  }
}
