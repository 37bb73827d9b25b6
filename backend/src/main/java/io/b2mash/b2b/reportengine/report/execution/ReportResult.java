package io.b2mash.b2b.reportengine.report.execution;

import java.util.List;
import java.util.Map;

/** Executor output, passed through to the caller as received. */
public record ReportResult(
    List<Column> columns,
    List<Map<String, Object>> rows,
    long totalCount,
    List<GroupedDataPoint> groupedData,
    Summary summary) {

  public record Column(String key, String label, String type) {}

  public record GroupedDataPoint(String label, double value, Map<String, Object> metadata) {}

  public record Summary(long totalRows, long executionTimeMs) {}
}
