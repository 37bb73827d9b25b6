package io.b2mash.b2b.reportengine.report.schedule;

import io.b2mash.b2b.reportengine.export.ScheduleConfig;
import io.b2mash.b2b.reportengine.export.ScheduleType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * Schedule settings for a report. On create, {@code scheduleType}, {@code scheduleConfig} and
 * {@code recipients} are required; on update, null components are left unchanged.
 *
 * @param format EXCEL, CSV or PDF; anything else is treated as EXCEL
 */
public record ReportScheduleRequest(
    @Size(max = 255) String name,
    ScheduleType scheduleType,
    @Valid ScheduleConfig scheduleConfig,
    String timezone,
    String format,
    List<@Email String> recipients) {}
