package io.b2mash.b2b.reportengine.report.execution;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import java.util.Map;

/**
 * Runtime overrides for a single run. All components are optional.
 *
 * @param overrideFilters filter tree used instead of the stored one
 * @param dateRangeStart ISO date or instant; lower bound on {@code createdAt}
 * @param dateRangeEnd ISO date or instant; upper bound on {@code createdAt}
 */
public record RunReportRequest(
    List<Map<String, Object>> overrideFilters,
    String dateRangeStart,
    String dateRangeEnd,
    @PositiveOrZero @Max(10_000) Integer limit,
    @PositiveOrZero Integer offset) {

  public static RunReportRequest none() {
    return new RunReportRequest(null, null, null, null, null);
  }
}
