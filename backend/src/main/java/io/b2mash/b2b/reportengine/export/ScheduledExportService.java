package io.b2mash.b2b.reportengine.export;

import io.b2mash.b2b.reportengine.audit.AuditEventBuilder;
import io.b2mash.b2b.reportengine.audit.AuditService;
import io.b2mash.b2b.reportengine.exception.InvalidStateException;
import io.b2mash.b2b.reportengine.exception.ResourceNotFoundException;
import io.b2mash.b2b.reportengine.export.dto.CreateScheduledExportRequest;
import io.b2mash.b2b.reportengine.export.dto.ScheduledExportResponse;
import io.b2mash.b2b.reportengine.export.dto.UpdateScheduledExportRequest;
import io.b2mash.b2b.reportengine.multitenancy.RequestScopes;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Recurring export definitions and their run requests. Each operation is its own transaction. */
@Service
public class ScheduledExportService {

  private static final Logger log = LoggerFactory.getLogger(ScheduledExportService.class);

  private static final String ENTITY_TYPE = "scheduled_export";
  private static final String DEFAULT_TIMEZONE = "UTC";

  private final ScheduledExportRepository scheduledExportRepository;
  private final ScheduledExportRunRepository runRepository;
  private final NextRunCalculator nextRunCalculator;
  private final AuditService auditService;

  public ScheduledExportService(
      ScheduledExportRepository scheduledExportRepository,
      ScheduledExportRunRepository runRepository,
      NextRunCalculator nextRunCalculator,
      AuditService auditService) {
    this.scheduledExportRepository = scheduledExportRepository;
    this.runRepository = runRepository;
    this.nextRunCalculator = nextRunCalculator;
    this.auditService = auditService;
  }

  @Transactional
  public ScheduledExportResponse create(CreateScheduledExportRequest req) {
    String orgId = RequestScopes.requireOrgId();
    UUID memberId = RequestScopes.requireMemberId();
    String timezone = req.timezone() != null ? req.timezone() : DEFAULT_TIMEZONE;

    var nextRunAt = nextRunCalculator.nextRun(req.scheduleType(), req.scheduleConfig(), timezone);
    var schedule =
        new ScheduledExport(
            orgId,
            req.name(),
            req.reportId(),
            req.scheduleType(),
            req.scheduleConfig(),
            timezone,
            req.format(),
            req.recipients(),
            memberId);
    schedule.resume(nextRunAt);
    schedule = scheduledExportRepository.save(schedule);

    log.info(
        "Created scheduled export: id={}, scheduleType={}, nextRunAt={}",
        schedule.getId(),
        schedule.getScheduleType(),
        schedule.getNextRunAt());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("scheduled_export.created")
            .entityType(ENTITY_TYPE)
            .entityId(schedule.getId())
            .details(
                Map.of(
                    "name", schedule.getName(),
                    "scheduleType", schedule.getScheduleType().name(),
                    "format", schedule.getFormat().name(),
                    "recipientCount", schedule.getRecipients().size()))
            .build());

    return ScheduledExportResponse.from(schedule);
  }

  @Transactional(readOnly = true)
  public ScheduledExportResponse get(UUID id) {
    return ScheduledExportResponse.from(requireSchedule(id));
  }

  @Transactional
  public ScheduledExportResponse update(UUID id, UpdateScheduledExportRequest req) {
    var schedule = requireSchedule(id);

    var scheduleType = req.scheduleType() != null ? req.scheduleType() : schedule.getScheduleType();
    var scheduleConfig =
        req.scheduleConfig() != null ? req.scheduleConfig() : schedule.getScheduleConfig();
    var timezone = req.timezone() != null ? req.timezone() : schedule.getTimezone();

    schedule.reschedule(
        scheduleType,
        scheduleConfig,
        timezone,
        nextRunCalculator.nextRun(scheduleType, scheduleConfig, timezone));
    schedule.redeliver(
        req.name() != null ? req.name() : schedule.getName(),
        req.format() != null ? req.format() : schedule.getFormat(),
        req.recipients() != null ? req.recipients() : schedule.getRecipients());
    schedule = scheduledExportRepository.save(schedule);

    log.info(
        "Updated scheduled export: id={}, nextRunAt={}", schedule.getId(), schedule.getNextRunAt());

    var details = new LinkedHashMap<String, Object>();
    details.put("name", schedule.getName());
    details.put("scheduleType", schedule.getScheduleType().name());
    details.put("nextRunAt", String.valueOf(schedule.getNextRunAt()));
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("scheduled_export.updated")
            .entityType(ENTITY_TYPE)
            .entityId(schedule.getId())
            .details(details)
            .build());

    return ScheduledExportResponse.from(schedule);
  }

  @Transactional
  public void delete(UUID id) {
    var schedule = requireSchedule(id);
    runRepository.deleteByScheduledExportId(schedule.getId());
    scheduledExportRepository.delete(schedule);

    log.info("Deleted scheduled export: id={}, name={}", schedule.getId(), schedule.getName());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("scheduled_export.deleted")
            .entityType(ENTITY_TYPE)
            .entityId(schedule.getId())
            .details(Map.of("name", schedule.getName()))
            .build());
  }

  @Transactional
  public ScheduledExportResponse pause(UUID id) {
    var schedule = requireSchedule(id);
    if (!schedule.isActive()) {
      throw new InvalidStateException(
          "Invalid state transition", "Scheduled export is already paused");
    }
    schedule.pause();
    schedule = scheduledExportRepository.save(schedule);

    log.info("Paused scheduled export: id={}", id);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("scheduled_export.paused")
            .entityType(ENTITY_TYPE)
            .entityId(id)
            .details(Map.of("name", schedule.getName()))
            .build());

    return ScheduledExportResponse.from(schedule);
  }

  /** Reactivates a paused schedule; the next run is computed from now. */
  @Transactional
  public ScheduledExportResponse resume(UUID id) {
    var schedule = requireSchedule(id);
    if (schedule.isActive()) {
      throw new InvalidStateException(
          "Invalid state transition", "Scheduled export is not paused");
    }
    schedule.resume(
        nextRunCalculator.nextRun(
            schedule.getScheduleType(), schedule.getScheduleConfig(), schedule.getTimezone()));
    schedule = scheduledExportRepository.save(schedule);

    log.info("Resumed scheduled export: id={}, nextRunAt={}", id, schedule.getNextRunAt());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("scheduled_export.resumed")
            .entityType(ENTITY_TYPE)
            .entityId(id)
            .details(Map.of("nextRunAt", schedule.getNextRunAt().toString()))
            .build());

    return ScheduledExportResponse.from(schedule);
  }

  /** Records a PENDING run for the export pipeline to pick up and returns its id. */
  @Transactional
  public UUID runNow(UUID id) {
    var schedule = requireSchedule(id);
    var run =
        runRepository.save(
            new ScheduledExportRun(
                schedule.getOrganizationId(), schedule.getId(), RequestScopes.getMemberIdOrNull()));

    log.info("Requested immediate run: scheduledExportId={}, runId={}", id, run.getId());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("scheduled_export.run_requested")
            .entityType(ENTITY_TYPE)
            .entityId(id)
            .details(Map.of("runId", String.valueOf(run.getId())))
            .build());

    return run.getId();
  }

  private ScheduledExport requireSchedule(UUID id) {
    String orgId = RequestScopes.requireOrgId();
    return scheduledExportRepository
        .findByIdAndOrganizationId(id, orgId)
        .orElseThrow(() -> new ResourceNotFoundException("ScheduledExport", id));
  }
}
