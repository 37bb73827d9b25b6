package io.b2mash.b2b.reportengine.report.execution;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.b2mash.b2b.reportengine.report.ReportEntityType;
import io.b2mash.b2b.reportengine.report.SortOrder;
import io.b2mash.b2b.reportengine.report.filter.FilterCondition;
import java.util.List;

/**
 * Execution-ready shape of a report: the definition's filter tree flattened and runtime overrides
 * merged. Built per run and never stored.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportConfig(
    ReportEntityType entityType,
    List<String> columns,
    List<FilterCondition> filters,
    List<String> groupBy,
    AggregationSpec aggregation,
    String sortBy,
    SortOrder sortOrder,
    int limit,
    int offset) {}
