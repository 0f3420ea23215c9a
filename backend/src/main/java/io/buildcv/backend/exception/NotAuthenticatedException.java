package io.buildcv.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when an operation needs a principal id and the request carries none. */
public class NotAuthenticatedException extends ErrorResponseException {

  public NotAuthenticatedException() {
    super(HttpStatus.UNAUTHORIZED, createProblem(), null);
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.UNAUTHORIZED);
    problem.setTitle("Not authenticated");
    problem.setDetail("This operation requires a signed-in user");
    return problem;
  }
}
