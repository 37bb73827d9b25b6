package io.b2mash.b2b.reportengine.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The report executor failed or timed out. Results in HTTP 502. */
public class ReportExecutionException extends ErrorResponseException {

  public ReportExecutionException(String detail, Throwable cause) {
    super(HttpStatus.BAD_GATEWAY, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("Report execution failed");
    problem.setDetail(detail);
    return problem;
  }
}
