package io.b2mash.b2b.reportengine.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.b2b.reportengine.report.ChartConfig;
import io.b2mash.b2b.reportengine.report.ReportAggregation;
import io.b2mash.b2b.reportengine.report.ReportEntityType;
import io.b2mash.b2b.reportengine.report.ReportVisibility;
import io.b2mash.b2b.reportengine.report.ReportVisualization;
import io.b2mash.b2b.reportengine.report.SavedReport;
import io.b2mash.b2b.reportengine.report.SortOrder;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record SavedReportResponse(
    UUID id,
    String name,
    String description,
    ReportEntityType entityType,
    List<String> columns,
    List<Map<String, Object>> filters,
    List<String> groupBy,
    List<ReportAggregation> aggregation,
    ReportVisualization visualization,
    ChartConfig chartConfig,
    String sortBy,
    SortOrder sortOrder,
    @JsonProperty("isTemplate") boolean template,
    String templateCategory,
    ReportVisibility visibility,
    @JsonProperty("isFavorite") boolean favorite,
    Instant lastRunAt,
    Long lastRunDuration,
    Long lastRunRowCount,
    UUID scheduledExportId,
    UUID createdById,
    String createdByName,
    Instant createdAt,
    Instant updatedAt) {

  public static SavedReportResponse from(SavedReport r, String createdByName) {
    return new SavedReportResponse(
        r.getId(),
        r.getName(),
        r.getDescription(),
        r.getEntityType(),
        r.getColumns(),
        r.getFilters(),
        r.getGroupBy(),
        r.getAggregation(),
        r.getVisualization(),
        r.getChartConfig(),
        r.getSortBy(),
        r.getSortOrder(),
        r.isTemplate(),
        r.getTemplateCategory(),
        r.getVisibility(),
        r.isFavorite(),
        r.getLastRunAt(),
        r.getLastRunDuration(),
        r.getLastRunRowCount(),
        r.getScheduledExportId(),
        r.getCreatedById(),
        createdByName,
        r.getCreatedAt(),
        r.getUpdatedAt());
  }
}
