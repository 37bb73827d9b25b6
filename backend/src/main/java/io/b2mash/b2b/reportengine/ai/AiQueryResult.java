package io.b2mash.b2b.reportengine.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;

/**
 * Output of the natural-language query service. Only the parts a report draft needs are bound.
 *
 * @param data query results, passed through to the caller untouched
 * @param visualizationType e.g. TABLE, BAR_CHART, KPI
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AiQueryResult(
    ParsedQuery parsedQuery, Object data, String interpretedQuery, String visualizationType) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ParsedQuery(
      String entityType,
      List<String> selectFields,
      List<Map<String, Object>> filters,
      List<FieldRef> groupBy,
      List<OrderBy> orderBy) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record FieldRef(String field) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record OrderBy(String field, String direction) {}
}
