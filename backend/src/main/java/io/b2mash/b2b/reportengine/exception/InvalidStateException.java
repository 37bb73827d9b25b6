package io.b2mash.b2b.reportengine.exception;

import java.util.Collection;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Validation failure on a report definition or a run request. Results in HTTP 400. When the
 * failure is caused by unknown field references, the offending ids are exposed as the {@code
 * invalidFields} problem property.
 */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail), null);
  }

  public static InvalidStateException invalidFields(
      String entityType, Collection<String> invalidFields) {
    var ex =
        new InvalidStateException(
            "Invalid report fields",
            "Unknown fields for entity type " + entityType + ": " + invalidFields);
    ex.getBody().setProperty("invalidFields", List.copyOf(invalidFields));
    return ex;
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
