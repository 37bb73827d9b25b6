package io.b2mash.b2b.reportengine.report.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.reportengine.exception.InvalidStateException;
import io.b2mash.b2b.reportengine.exception.ResourceNotFoundException;
import io.b2mash.b2b.reportengine.exception.ScheduleLinkFailedException;
import io.b2mash.b2b.reportengine.export.ExportFormat;
import io.b2mash.b2b.reportengine.export.ScheduleConfig;
import io.b2mash.b2b.reportengine.export.ScheduleType;
import io.b2mash.b2b.reportengine.export.ScheduledExportService;
import io.b2mash.b2b.reportengine.export.dto.CreateScheduledExportRequest;
import io.b2mash.b2b.reportengine.export.dto.ScheduledExportResponse;
import io.b2mash.b2b.reportengine.report.SavedReport;
import io.b2mash.b2b.reportengine.report.SavedReportService;
import io.b2mash.b2b.reportengine.testutil.TestReportFactory;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReportScheduleServiceTest {

  private static final String ORG_ID = "org_schedules";
  private static final UUID SCHEDULE_ID = UUID.randomUUID();

  @Mock private SavedReportService savedReportService;
  @Mock private ScheduledExportService scheduledExportService;

  private ReportScheduleService service;
  private SavedReport report;

  @BeforeEach
  void setUp() {
    service = new ReportScheduleService(savedReportService, scheduledExportService);
    report = TestReportFactory.persistedCasesReport(ORG_ID, "Open cases", UUID.randomUUID());
  }

  @Test
  void create_defaultsNameToReportAndLinksSchedule() {
    when(savedReportService.requireReport(report.getId())).thenReturn(report);
    when(scheduledExportService.create(any())).thenReturn(exportResponse(ExportFormat.CSV));

    var response =
        service.create(
            report.getId(),
            new ReportScheduleRequest(
                null,
                ScheduleType.WEEKLY,
                new ScheduleConfig("07:30", 1, null),
                "Europe/London",
                "csv",
                List.of("cco@example.com")));

    var captor = ArgumentCaptor.forClass(CreateScheduledExportRequest.class);
    verify(scheduledExportService).create(captor.capture());
    assertThat(captor.getValue().name()).isEqualTo("Open cases");
    assertThat(captor.getValue().reportId()).isEqualTo(report.getId());
    assertThat(captor.getValue().format()).isEqualTo(ExportFormat.CSV);
    verify(savedReportService).linkSchedule(report.getId(), SCHEDULE_ID);

    assertThat(response.id()).isEqualTo(SCHEDULE_ID);
    assertThat(response.reportId()).isEqualTo(report.getId());
    assertThat(response.format()).isEqualTo(ReportFormat.CSV);
    assertThat(response.active()).isTrue();
  }

  @Test
  void create_reportAlreadyScheduledIsRejected() {
    report.linkSchedule(SCHEDULE_ID);
    when(savedReportService.requireReport(report.getId())).thenReturn(report);

    assertThatThrownBy(() -> service.create(report.getId(), dailyRequest()))
        .isInstanceOfSatisfying(
            ResourceNotFoundException.class,
            e -> assertThat(e.getBody().getTitle()).isEqualTo("Schedule already exists"));
    verifyNoInteractions(scheduledExportService);
  }

  @Test
  void create_missingRecipientsIsRejected() {
    when(savedReportService.requireReport(report.getId())).thenReturn(report);
    var request =
        new ReportScheduleRequest(
            "Daily",
            ScheduleType.DAILY,
            new ScheduleConfig("08:00", null, null),
            null,
            null,
            List.of());

    assertThatThrownBy(() -> service.create(report.getId(), request))
        .isInstanceOf(InvalidStateException.class);
    verifyNoInteractions(scheduledExportService);
  }

  @Test
  void create_linkFailureSurfacesCreatedScheduleId() {
    when(savedReportService.requireReport(report.getId())).thenReturn(report);
    when(scheduledExportService.create(any())).thenReturn(exportResponse(ExportFormat.XLSX));
    doThrow(new IllegalStateException("connection reset"))
        .when(savedReportService)
        .linkSchedule(report.getId(), SCHEDULE_ID);

    assertThatThrownBy(() -> service.create(report.getId(), dailyRequest()))
        .isInstanceOfSatisfying(
            ScheduleLinkFailedException.class,
            e -> {
              assertThat(e.getScheduleId()).isEqualTo(SCHEDULE_ID);
              assertThat(e.getBody().getProperties()).containsEntry("scheduleId", SCHEDULE_ID);
            });
  }

  @Test
  void get_unscheduledReportIsNotFound() {
    when(savedReportService.requireReport(report.getId())).thenReturn(report);

    assertThatThrownBy(() -> service.get(report.getId()))
        .isInstanceOfSatisfying(
            ResourceNotFoundException.class,
            e -> assertThat(e.getBody().getTitle()).isEqualTo("Schedule not found"));
  }

  @Test
  void delete_removesScheduleThenClearsLink() {
    report.linkSchedule(SCHEDULE_ID);
    when(savedReportService.requireReport(report.getId())).thenReturn(report);

    service.delete(report.getId());

    var order = inOrder(scheduledExportService, savedReportService);
    order.verify(scheduledExportService).delete(SCHEDULE_ID);
    order.verify(savedReportService).unlinkSchedule(report.getId());
  }

  @Test
  void runNow_forwardsToLinkedSchedule() {
    report.linkSchedule(SCHEDULE_ID);
    var runId = UUID.randomUUID();
    when(savedReportService.requireReport(report.getId())).thenReturn(report);
    when(scheduledExportService.runNow(SCHEDULE_ID)).thenReturn(runId);

    assertThat(service.runNow(report.getId())).isEqualTo(runId);
  }

  private static ReportScheduleRequest dailyRequest() {
    return new ReportScheduleRequest(
        "Daily digest",
        ScheduleType.DAILY,
        new ScheduleConfig("08:00", null, null),
        "UTC",
        "EXCEL",
        List.of("cco@example.com"));
  }

  private ScheduledExportResponse exportResponse(ExportFormat format) {
    return new ScheduledExportResponse(
        SCHEDULE_ID,
        report.getName(),
        report.getId(),
        ScheduleType.WEEKLY,
        new ScheduleConfig("07:30", 1, null),
        "Europe/London",
        format,
        List.of("cco@example.com"),
        true,
        null,
        Instant.parse("2024-06-17T06:30:00Z"),
        Instant.now(),
        Instant.now());
  }
}
