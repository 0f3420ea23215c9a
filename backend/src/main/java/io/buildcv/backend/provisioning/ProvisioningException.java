package io.buildcv.backend.provisioning;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * The database platform rejected or failed a provisioning call. The registry record has already
 * been marked {@code ERROR} when this reaches the caller; calling provision again restarts.
 */
public class ProvisioningException extends ErrorResponseException {

  private final ProvisioningStep step;

  public ProvisioningException(String principalId, ProvisioningStep step, Throwable cause) {
    super(HttpStatus.BAD_GATEWAY, createProblem(principalId, step, cause), cause);
    this.step = step;
  }

  public ProvisioningStep getStep() {
    return step;
  }

  private static ProblemDetail createProblem(
      String principalId, ProvisioningStep step, Throwable cause) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("Database provisioning failed");
    problem.setDetail(
        "Provisioning for user "
            + principalId
            + " failed at step "
            + step
            + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""));
    problem.setProperty("step", step.name());
    return problem;
  }
}
