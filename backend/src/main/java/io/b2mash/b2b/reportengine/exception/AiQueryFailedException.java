package io.b2mash.b2b.reportengine.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The natural-language query service failed or timed out. Results in HTTP 502. */
public class AiQueryFailedException extends ErrorResponseException {

  public AiQueryFailedException(String detail, Throwable cause) {
    super(HttpStatus.BAD_GATEWAY, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("AI query failed");
    problem.setDetail(detail);
    return problem;
  }
}
