package io.b2mash.b2b.reportengine.report.schedule;

import io.b2mash.b2b.reportengine.exception.InvalidStateException;
import io.b2mash.b2b.reportengine.exception.ResourceNotFoundException;
import io.b2mash.b2b.reportengine.exception.ScheduleLinkFailedException;
import io.b2mash.b2b.reportengine.export.ScheduledExportService;
import io.b2mash.b2b.reportengine.export.dto.CreateScheduledExportRequest;
import io.b2mash.b2b.reportengine.export.dto.UpdateScheduledExportRequest;
import io.b2mash.b2b.reportengine.report.SavedReport;
import io.b2mash.b2b.reportengine.report.SavedReportService;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Binds at most one scheduled export to a saved report and forwards schedule control to it.
 *
 * <p>Create is not transactional: the schedule is committed first and linked second,
 * so a failed link leaves a schedule that the caller must reconcile. Delete removes the schedule
 * and the link together.
 */
@Service
public class ReportScheduleService {

  private static final Logger log = LoggerFactory.getLogger(ReportScheduleService.class);

  private final SavedReportService savedReportService;
  private final ScheduledExportService scheduledExportService;

  public ReportScheduleService(
      SavedReportService savedReportService, ScheduledExportService scheduledExportService) {
    this.savedReportService = savedReportService;
    this.scheduledExportService = scheduledExportService;
  }

  public ReportScheduleResponse create(UUID reportId, ReportScheduleRequest req) {
    var report = savedReportService.requireReport(reportId);
    if (report.getScheduledExportId() != null) {
      throw ResourceNotFoundException.withDetail(
          "Schedule already exists",
          "Report "
              + reportId
              + " already has schedule "
              + report.getScheduledExportId()
              + "; update it instead");
    }
    if (req.scheduleType() == null
        || req.scheduleConfig() == null
        || req.recipients() == null
        || req.recipients().isEmpty()) {
      throw new InvalidStateException(
          "Invalid schedule", "scheduleType, scheduleConfig and recipients are required");
    }

    var schedule =
        scheduledExportService.create(
            new CreateScheduledExportRequest(
                req.name() != null ? req.name() : report.getName(),
                reportId,
                req.scheduleType(),
                req.scheduleConfig(),
                req.timezone(),
                ReportFormat.fromValue(req.format()).toExportFormat(),
                req.recipients()));

    try {
      savedReportService.linkSchedule(reportId, schedule.id());
    } catch (RuntimeException e) {
      log.error(
          "Failed to link schedule to report: reportId={}, scheduledExportId={}",
          reportId,
          schedule.id(),
          e);
      throw new ScheduleLinkFailedException(reportId, schedule.id(), e);
    }

    return ReportScheduleResponse.from(reportId, schedule);
  }

  public ReportScheduleResponse get(UUID reportId) {
    UUID scheduleId = requireScheduleId(reportId);
    return ReportScheduleResponse.from(reportId, scheduledExportService.get(scheduleId));
  }

  public ReportScheduleResponse update(UUID reportId, ReportScheduleRequest req) {
    UUID scheduleId = requireScheduleId(reportId);
    var updated =
        scheduledExportService.update(
            scheduleId,
            new UpdateScheduledExportRequest(
                req.name(),
                req.scheduleType(),
                req.scheduleConfig(),
                req.timezone(),
                req.format() != null ? ReportFormat.fromValue(req.format()).toExportFormat() : null,
                req.recipients()));
    return ReportScheduleResponse.from(reportId, updated);
  }

  /** Deletes the schedule and clears the report's link in one transaction. */
  @Transactional
  public void delete(UUID reportId) {
    UUID scheduleId = requireScheduleId(reportId);
    scheduledExportService.delete(scheduleId);
    savedReportService.unlinkSchedule(reportId);
  }

  public ReportScheduleResponse pause(UUID reportId) {
    UUID scheduleId = requireScheduleId(reportId);
    return ReportScheduleResponse.from(reportId, scheduledExportService.pause(scheduleId));
  }

  public ReportScheduleResponse resume(UUID reportId) {
    UUID scheduleId = requireScheduleId(reportId);
    return ReportScheduleResponse.from(reportId, scheduledExportService.resume(scheduleId));
  }

  /** Returns the id of the queued run. */
  public UUID runNow(UUID reportId) {
    return scheduledExportService.runNow(requireScheduleId(reportId));
  }

  private UUID requireScheduleId(UUID reportId) {
    SavedReport report = savedReportService.requireReport(reportId);
    if (report.getScheduledExportId() == null) {
      throw ResourceNotFoundException.withDetail(
          "Schedule not found", "Report " + reportId + " has no schedule");
    }
    return report.getScheduledExportId();
  }
}
