package io.b2mash.b2b.reportengine.report.filter;

import java.util.List;

/** Internal node of a filter tree. Groups nest to arbitrary depth. */
public record FilterGroup(FilterLogic logic, List<FilterNode> conditions) implements FilterNode {

  public FilterGroup {
    conditions = conditions != null ? List.copyOf(conditions) : List.of();
  }
}
