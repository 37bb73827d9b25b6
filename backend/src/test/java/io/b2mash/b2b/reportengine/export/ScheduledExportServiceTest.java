package io.b2mash.b2b.reportengine.export;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.reportengine.audit.AuditEventRecord;
import io.b2mash.b2b.reportengine.audit.AuditService;
import io.b2mash.b2b.reportengine.exception.InvalidStateException;
import io.b2mash.b2b.reportengine.exception.ResourceNotFoundException;
import io.b2mash.b2b.reportengine.export.dto.CreateScheduledExportRequest;
import io.b2mash.b2b.reportengine.export.dto.UpdateScheduledExportRequest;
import io.b2mash.b2b.reportengine.multitenancy.RequestScopes;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class ScheduledExportServiceTest {

  private static final String ORG_ID = "org_exports";
  private static final UUID MEMBER_ID = UUID.randomUUID();
  private static final Instant NOW = Instant.parse("2024-06-12T10:00:00Z");

  @Mock private ScheduledExportRepository scheduledExportRepository;
  @Mock private ScheduledExportRunRepository runRepository;
  @Mock private AuditService auditService;

  private ScheduledExportService service;

  @BeforeEach
  void setUp() {
    service =
        new ScheduledExportService(
            scheduledExportRepository,
            runRepository,
            new NextRunCalculator(Clock.fixed(NOW, ZoneOffset.UTC)),
            auditService);
  }

  @Test
  void create_defaultsTimezoneAndComputesFirstRun() {
    when(scheduledExportRepository.save(any(ScheduledExport.class)))
        .thenAnswer(i -> i.getArgument(0));

    var response =
        inOrg(
            () ->
                service.create(
                    new CreateScheduledExportRequest(
                        "Daily digest",
                        UUID.randomUUID(),
                        ScheduleType.DAILY,
                        new ScheduleConfig("09:15", null, null),
                        null,
                        ExportFormat.PDF,
                        List.of("cco@example.com", "legal@example.com"))));

    assertThat(response.timezone()).isEqualTo("UTC");
    assertThat(response.active()).isTrue();
    assertThat(response.nextRunAt()).isEqualTo(Instant.parse("2024-06-13T09:15:00Z"));
    var audit = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(audit.capture());
    assertThat(audit.getValue().eventType()).isEqualTo("scheduled_export.created");
    assertThat(audit.getValue().details()).containsEntry("recipientCount", 2);
  }

  @Test
  void pause_clearsNextRunAndRejectsSecondPause() {
    var schedule = persisted();
    when(scheduledExportRepository.findByIdAndOrganizationId(schedule.getId(), ORG_ID))
        .thenReturn(Optional.of(schedule));
    when(scheduledExportRepository.save(schedule)).thenReturn(schedule);

    var paused = inOrg(() -> service.pause(schedule.getId()));

    assertThat(paused.active()).isFalse();
    assertThat(paused.nextRunAt()).isNull();
    assertThatThrownBy(() -> inOrg(() -> service.pause(schedule.getId())))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            e -> assertThat(e.getBody().getTitle()).isEqualTo("Invalid state transition"));
  }

  @Test
  void resume_activeScheduleIsRejected() {
    var schedule = persisted();
    when(scheduledExportRepository.findByIdAndOrganizationId(schedule.getId(), ORG_ID))
        .thenReturn(Optional.of(schedule));

    assertThatThrownBy(() -> inOrg(() -> service.resume(schedule.getId())))
        .isInstanceOf(InvalidStateException.class);
    verify(scheduledExportRepository, never()).save(any());
  }

  @Test
  void resume_pausedScheduleComputesNextRunFromNow() {
    var schedule = persisted();
    schedule.pause();
    when(scheduledExportRepository.findByIdAndOrganizationId(schedule.getId(), ORG_ID))
        .thenReturn(Optional.of(schedule));
    when(scheduledExportRepository.save(schedule)).thenReturn(schedule);

    var resumed = inOrg(() -> service.resume(schedule.getId()));

    assertThat(resumed.active()).isTrue();
    assertThat(resumed.nextRunAt()).isEqualTo(Instant.parse("2024-06-13T08:00:00Z"));
  }

  @Test
  void update_pausedScheduleStaysWithoutNextRun() {
    var schedule = persisted();
    schedule.pause();
    when(scheduledExportRepository.findByIdAndOrganizationId(schedule.getId(), ORG_ID))
        .thenReturn(Optional.of(schedule));
    when(scheduledExportRepository.save(schedule)).thenReturn(schedule);

    var updated =
        inOrg(
            () ->
                service.update(
                    schedule.getId(),
                    new UpdateScheduledExportRequest(
                        null,
                        ScheduleType.MONTHLY,
                        new ScheduleConfig("06:00", null, 15),
                        null,
                        ExportFormat.CSV,
                        null)));

    assertThat(updated.scheduleType()).isEqualTo(ScheduleType.MONTHLY);
    assertThat(updated.format()).isEqualTo(ExportFormat.CSV);
    assertThat(updated.name()).isEqualTo("Daily digest");
    assertThat(updated.recipients()).containsExactly("cco@example.com");
    assertThat(updated.nextRunAt()).isNull();
  }

  @Test
  void delete_removesRunsBeforeSchedule() {
    var schedule = persisted();
    when(scheduledExportRepository.findByIdAndOrganizationId(schedule.getId(), ORG_ID))
        .thenReturn(Optional.of(schedule));

    inOrg(
        () -> {
          service.delete(schedule.getId());
          return null;
        });

    var order = inOrder(runRepository, scheduledExportRepository);
    order.verify(runRepository).deleteByScheduledExportId(schedule.getId());
    order.verify(scheduledExportRepository).delete(schedule);
  }

  @Test
  void runNow_recordsPendingRunForCaller() {
    var schedule = persisted();
    var runId = UUID.randomUUID();
    when(scheduledExportRepository.findByIdAndOrganizationId(schedule.getId(), ORG_ID))
        .thenReturn(Optional.of(schedule));
    when(runRepository.save(any(ScheduledExportRun.class)))
        .thenAnswer(
            i -> {
              ScheduledExportRun run = i.getArgument(0);
              ReflectionTestUtils.setField(run, "id", runId);
              return run;
            });

    var result = inOrg(() -> service.runNow(schedule.getId()));

    assertThat(result).isEqualTo(runId);
    var captor = ArgumentCaptor.forClass(ScheduledExportRun.class);
    verify(runRepository).save(captor.capture());
    assertThat(captor.getValue().getStatus()).isEqualTo(ExportRunStatus.PENDING);
    assertThat(captor.getValue().getRequestedById()).isEqualTo(MEMBER_ID);
  }

  @Test
  void get_otherOrganizationsScheduleIsNotFound() {
    var id = UUID.randomUUID();
    when(scheduledExportRepository.findByIdAndOrganizationId(id, ORG_ID))
        .thenReturn(Optional.empty());

    assertThatThrownBy(() -> inOrg(() -> service.get(id)))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  private static ScheduledExport persisted() {
    var schedule =
        new ScheduledExport(
            ORG_ID,
            "Daily digest",
            UUID.randomUUID(),
            ScheduleType.DAILY,
            new ScheduleConfig("08:00", null, null),
            "UTC",
            ExportFormat.XLSX,
            List.of("cco@example.com"),
            MEMBER_ID);
    schedule.resume(Instant.parse("2024-06-13T08:00:00Z"));
    ReflectionTestUtils.setField(schedule, "id", UUID.randomUUID());
    return schedule;
  }

  private static <T> T inOrg(Supplier<T> action) {
    return RequestScopes.callAs(
        new RequestScopes.Snapshot(ORG_ID, MEMBER_ID, "COMPLIANCE_OFFICER"), action);
  }
}
