package io.b2mash.b2b.reportengine.export.dto;

import io.b2mash.b2b.reportengine.export.ExportFormat;
import io.b2mash.b2b.reportengine.export.ScheduleConfig;
import io.b2mash.b2b.reportengine.export.ScheduleType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.UUID;

public record CreateScheduledExportRequest(
    @NotBlank @Size(max = 255) String name,
    UUID reportId,
    @NotNull ScheduleType scheduleType,
    @NotNull @Valid ScheduleConfig scheduleConfig,
    String timezone,
    @NotNull ExportFormat format,
    @NotEmpty List<@Email String> recipients) {}
