package io.b2mash.b2b.reportengine.report.filter;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Leaf of a filter tree, also the element type of the flat list handed to the executor.
 *
 * @param valueTo upper bound, only meaningful for {@link FilterOperator#BETWEEN}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FilterCondition(String field, FilterOperator operator, Object value, Object valueTo)
    implements FilterNode {

  public FilterCondition(String field, FilterOperator operator, Object value) {
    this(field, operator, value, null);
  }

  /** The stored JSON shape of this condition. */
  public Map<String, Object> toMap() {
    var map = new LinkedHashMap<String, Object>();
    map.put("field", field);
    map.put("operator", operator.getKey());
    map.put("value", value);
    if (valueTo != null) {
      map.put("valueTo", valueTo);
    }
    return map;
  }
}
