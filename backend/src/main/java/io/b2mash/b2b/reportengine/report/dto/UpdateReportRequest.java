package io.b2mash.b2b.reportengine.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.b2b.reportengine.report.ChartConfig;
import io.b2mash.b2b.reportengine.report.ReportAggregation;
import io.b2mash.b2b.reportengine.report.ReportVisibility;
import io.b2mash.b2b.reportengine.report.ReportVisualization;
import io.b2mash.b2b.reportengine.report.SortOrder;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Map;

/** Partial update. A null component means "leave unchanged". */
public record UpdateReportRequest(
    @Size(min = 1, max = 255) String name,
    String description,
    String entityType,
    List<String> columns,
    List<Map<String, Object>> filters,
    List<String> groupBy,
    List<@Valid ReportAggregation> aggregation,
    ReportVisualization visualization,
    ChartConfig chartConfig,
    @Size(max = 100) String sortBy,
    SortOrder sortOrder,
    ReportVisibility visibility,
    @JsonProperty("isTemplate") Boolean template,
    @Size(max = 50) String templateCategory) {}
