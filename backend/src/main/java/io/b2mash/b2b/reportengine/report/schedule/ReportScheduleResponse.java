package io.b2mash.b2b.reportengine.report.schedule;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.b2b.reportengine.export.ScheduleConfig;
import io.b2mash.b2b.reportengine.export.ScheduleType;
import io.b2mash.b2b.reportengine.export.dto.ScheduledExportResponse;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ReportScheduleResponse(
    UUID id,
    UUID reportId,
    String name,
    ScheduleType scheduleType,
    ScheduleConfig scheduleConfig,
    String timezone,
    ReportFormat format,
    List<String> recipients,
    @JsonProperty("isActive") boolean active,
    Instant lastRunAt,
    Instant nextRunAt) {

  static ReportScheduleResponse from(UUID reportId, ScheduledExportResponse s) {
    return new ReportScheduleResponse(
        s.id(),
        reportId,
        s.name(),
        s.scheduleType(),
        s.scheduleConfig(),
        s.timezone(),
        ReportFormat.fromExportFormat(s.format()),
        s.recipients(),
        s.active(),
        s.lastRunAt(),
        s.nextRunAt());
  }
}
