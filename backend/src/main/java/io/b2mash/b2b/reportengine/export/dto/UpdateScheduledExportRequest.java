package io.b2mash.b2b.reportengine.export.dto;

import io.b2mash.b2b.reportengine.export.ExportFormat;
import io.b2mash.b2b.reportengine.export.ScheduleConfig;
import io.b2mash.b2b.reportengine.export.ScheduleType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import java.util.List;

/** Partial update; null components are left unchanged. */
public record UpdateScheduledExportRequest(
    @Size(min = 1, max = 255) String name,
    ScheduleType scheduleType,
    @Valid ScheduleConfig scheduleConfig,
    String timezone,
    ExportFormat format,
    @Size(min = 1) List<@Email String> recipients) {}
