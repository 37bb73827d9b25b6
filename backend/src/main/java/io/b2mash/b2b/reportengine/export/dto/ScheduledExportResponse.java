package io.b2mash.b2b.reportengine.export.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.b2b.reportengine.export.ExportFormat;
import io.b2mash.b2b.reportengine.export.ScheduleConfig;
import io.b2mash.b2b.reportengine.export.ScheduleType;
import io.b2mash.b2b.reportengine.export.ScheduledExport;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ScheduledExportResponse(
    UUID id,
    String name,
    UUID reportId,
    ScheduleType scheduleType,
    ScheduleConfig scheduleConfig,
    String timezone,
    ExportFormat format,
    List<String> recipients,
    @JsonProperty("isActive") boolean active,
    Instant lastRunAt,
    Instant nextRunAt,
    Instant createdAt,
    Instant updatedAt) {

  public static ScheduledExportResponse from(ScheduledExport s) {
    return new ScheduledExportResponse(
        s.getId(),
        s.getName(),
        s.getReportId(),
        s.getScheduleType(),
        s.getScheduleConfig(),
        s.getTimezone(),
        s.getFormat(),
        List.copyOf(s.getRecipients()),
        s.isActive(),
        s.getLastRunAt(),
        s.getNextRunAt(),
        s.getCreatedAt(),
        s.getUpdatedAt());
  }
}
