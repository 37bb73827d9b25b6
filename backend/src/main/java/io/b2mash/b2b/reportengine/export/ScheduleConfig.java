package io.b2mash.b2b.reportengine.export;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;

/**
 * When a schedule fires, interpreted in the schedule's timezone.
 *
 * @param time wall-clock time, {@code HH:mm}; 08:00 when absent
 * @param dayOfWeek 0 (Sunday) to 6, WEEKLY only; Monday when absent
 * @param dayOfMonth 1 to 31, MONTHLY only, clamped to the month's length; 1 when absent
 */
public record ScheduleConfig(
    @Pattern(regexp = "([01]\\d|2[0-3]):[0-5]\\d") String time,
    @Min(0) @Max(6) Integer dayOfWeek,
    @Min(1) @Max(31) Integer dayOfMonth) {}
