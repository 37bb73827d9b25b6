package io.b2mash.b2b.reportengine.ai;

import io.b2mash.b2b.reportengine.report.ReportEntityType;
import io.b2mash.b2b.reportengine.report.ReportVisualization;
import io.b2mash.b2b.reportengine.report.SortOrder;
import io.b2mash.b2b.reportengine.report.dto.CreateReportRequest;
import io.b2mash.b2b.reportengine.report.filter.FilterCondition;
import io.b2mash.b2b.reportengine.report.filter.FilterOperator;
import io.b2mash.b2b.reportengine.report.filter.FilterTreeFlattener;
import io.b2mash.b2b.reportengine.report.filter.FilterTreeParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Maps a parsed natural-language query onto an unsaved report definition. */
@Component
public class AiReportDraftMapper {

  private static final Logger log = LoggerFactory.getLogger(AiReportDraftMapper.class);

  static final int NAME_QUERY_LENGTH = 50;
  static final List<String> DEFAULT_COLUMNS = List.of("referenceNumber", "status", "createdAt");

  private static final Map<String, ReportEntityType> ENTITY_TYPES =
      Map.of(
          "CASE", ReportEntityType.CASES,
          "RIU", ReportEntityType.RIUS,
          "CAMPAIGN", ReportEntityType.CAMPAIGNS,
          "PERSON", ReportEntityType.PERSONS,
          "DISCLOSURE", ReportEntityType.DISCLOSURES,
          "INVESTIGATION", ReportEntityType.INVESTIGATIONS);

  private static final Map<String, ReportVisualization> VISUALIZATIONS =
      Map.of(
          "TABLE", ReportVisualization.TABLE,
          "BAR_CHART", ReportVisualization.BAR,
          "LINE_CHART", ReportVisualization.LINE,
          "PIE_CHART", ReportVisualization.PIE,
          "KPI", ReportVisualization.KPI,
          "FUNNEL", ReportVisualization.FUNNEL,
          "TEXT", ReportVisualization.TABLE);

  public CreateReportRequest toDraft(String query, AiQueryResult result) {
    var parsed = result.parsedQuery();

    ReportEntityType entityType = ReportEntityType.CASES;
    if (parsed != null && parsed.entityType() != null) {
      entityType =
          ENTITY_TYPES.getOrDefault(
              parsed.entityType().toUpperCase(Locale.ROOT), ReportEntityType.CASES);
    }

    List<String> columns =
        parsed != null && parsed.selectFields() != null && !parsed.selectFields().isEmpty()
            ? List.copyOf(parsed.selectFields())
            : DEFAULT_COLUMNS;

    List<String> groupBy =
        parsed != null && parsed.groupBy() != null
            ? parsed.groupBy().stream().map(AiQueryResult.FieldRef::field).toList()
            : null;

    String sortBy = null;
    SortOrder sortOrder = null;
    if (parsed != null && parsed.orderBy() != null && !parsed.orderBy().isEmpty()) {
      var first = parsed.orderBy().get(0);
      sortBy = first.field();
      sortOrder = toSortOrder(first.direction());
    }

    return new CreateReportRequest(
        draftName(query),
        result.interpretedQuery(),
        entityType.getKey(),
        columns,
        toFilterTree(parsed != null ? parsed.filters() : null),
        groupBy,
        null,
        VISUALIZATIONS.getOrDefault(
            result.visualizationType() != null
                ? result.visualizationType().toUpperCase(Locale.ROOT)
                : "",
            ReportVisualization.TABLE),
        null,
        sortBy,
        sortOrder,
        null,
        null,
        null);
  }

  static String draftName(String query) {
    if (query.length() <= NAME_QUERY_LENGTH) {
      return "Report: " + query;
    }
    return "Report: " + query.substring(0, NAME_QUERY_LENGTH) + "...";
  }

  /** Wraps the flat AI conditions in a single AND group; unknown operators are dropped. */
  private static List<Map<String, Object>> toFilterTree(List<Map<String, Object>> filters) {
    if (filters == null || filters.isEmpty()) {
      return List.of();
    }
    var conditions = new ArrayList<FilterCondition>();
    for (Map<String, Object> filter : filters) {
      if (filter == null || !FilterTreeParser.isCondition(filter)) {
        continue;
      }
      var operator = FilterOperator.fromKey(String.valueOf(filter.get("operator")));
      if (operator.isEmpty()) {
        log.warn(
            "Dropping AI filter with unsupported operator: field={}, operator={}",
            filter.get("field"),
            filter.get("operator"));
        continue;
      }
      conditions.add(
          new FilterCondition(
              String.valueOf(filter.get("field")),
              operator.get(),
              filter.get("value"),
              filter.get("valueTo")));
    }
    return FilterTreeFlattener.toStoredGroups(conditions);
  }

  private static SortOrder toSortOrder(String direction) {
    if (direction == null) {
      return null;
    }
    return "desc".equalsIgnoreCase(direction) ? SortOrder.DESC : SortOrder.ASC;
  }
}
