package io.b2mash.b2b.reportengine.report.execution;

import io.b2mash.b2b.reportengine.config.ReportingConfig.ReportingProperties;
import io.b2mash.b2b.reportengine.exception.InvalidStateException;
import io.b2mash.b2b.reportengine.report.ReportAggregation;
import io.b2mash.b2b.reportengine.report.SavedReport;
import io.b2mash.b2b.reportengine.report.filter.FilterCondition;
import io.b2mash.b2b.reportengine.report.filter.FilterOperator;
import io.b2mash.b2b.reportengine.report.filter.FilterTreeFlattener;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Merges a stored definition with run overrides into a {@link ReportConfig}. */
@Component
public class ReportConfigBuilder {

  static final String DATE_RANGE_FIELD = "createdAt";

  private final ReportingProperties reportingProperties;
  private final Clock clock;

  @Autowired
  public ReportConfigBuilder(ReportingProperties reportingProperties) {
    this(reportingProperties, Clock.systemUTC());
  }

  ReportConfigBuilder(ReportingProperties reportingProperties, Clock clock) {
    this.reportingProperties = reportingProperties;
    this.clock = clock;
  }

  public ReportConfig build(SavedReport report, RunReportRequest overrides) {
    var request = overrides != null ? overrides : RunReportRequest.none();

    var filters =
        new ArrayList<>(
            FilterTreeFlattener.flatten(
                request.overrideFilters() != null
                    ? request.overrideFilters()
                    : report.getFilters()));
    if (hasText(request.dateRangeStart()) || hasText(request.dateRangeEnd())) {
      Instant start =
          hasText(request.dateRangeStart()) ? parseBound(request.dateRangeStart()) : Instant.EPOCH;
      Instant end =
          hasText(request.dateRangeEnd()) ? parseBound(request.dateRangeEnd()) : clock.instant();
      filters.add(new FilterCondition(DATE_RANGE_FIELD, FilterOperator.BETWEEN, start, end));
    }

    int limit =
        request.limit() != null && request.limit() > 0
            ? request.limit()
            : reportingProperties.run().defaultLimit();
    int offset = request.offset() != null ? Math.max(request.offset(), 0) : 0;

    return new ReportConfig(
        report.getEntityType(),
        report.getColumns() != null ? List.copyOf(report.getColumns()) : List.of(),
        List.copyOf(filters),
        report.getGroupBy(),
        firstAggregation(report.getAggregation()),
        report.getSortBy(),
        report.getSortOrder(),
        limit,
        offset);
  }

  /** Only the first stored aggregation is executed. */
  private static AggregationSpec firstAggregation(List<ReportAggregation> aggregation) {
    if (aggregation == null || aggregation.isEmpty()) {
      return null;
    }
    var first = aggregation.get(0);
    return new AggregationSpec(first.function(), first.field());
  }

  /** Accepts a calendar date (start of day, UTC), an offset date-time or an instant. */
  static Instant parseBound(String raw) {
    String value = raw.trim();
    try {
      if (value.length() == 10) {
        return LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC);
      }
      return OffsetDateTime.parse(value).toInstant();
    } catch (DateTimeParseException e) {
      throw new InvalidStateException(
          "Invalid date range", "Cannot parse date range bound '" + raw + "'");
    }
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
