package io.b2mash.b2b.reportengine.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a scheduled export was created but could not be linked back to its report. The
 * schedule exists and is reported through the {@code scheduleId} problem property so the caller can
 * retry the link or remove the orphan. Results in HTTP 502.
 */
public class ScheduleLinkFailedException extends ErrorResponseException {

  private final UUID scheduleId;

  public ScheduleLinkFailedException(UUID reportId, UUID scheduleId, Throwable cause) {
    super(HttpStatus.BAD_GATEWAY, createProblem(reportId, scheduleId), cause);
    this.scheduleId = scheduleId;
  }

  public UUID getScheduleId() {
    return scheduleId;
  }

  private static ProblemDetail createProblem(UUID reportId, UUID scheduleId) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("Schedule link failed");
    problem.setDetail(
        "Scheduled export " + scheduleId + " was created but could not be linked to report "
            + reportId);
    problem.setProperty("reportId", reportId);
    problem.setProperty("scheduleId", scheduleId);
    return problem;
  }
}
