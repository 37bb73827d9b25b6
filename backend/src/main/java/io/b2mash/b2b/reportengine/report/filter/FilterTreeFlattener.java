package io.b2mash.b2b.reportengine.report.filter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Linearizes filter trees into the flat condition list the executor consumes.
 *
 * <p>Flattening is lossy: AND/OR grouping is discarded and the result is read as one conjunctive
 * list. Conditions appear in depth-first, left-to-right order.
 */
public final class FilterTreeFlattener {

  /** Flattens typed groups. */
  public static List<FilterCondition> flatten(List<FilterGroup> groups) {
    var result = new ArrayList<FilterCondition>();
    if (groups == null) {
      return result;
    }
    for (FilterGroup group : groups) {
      collect(group, result);
    }
    return result;
  }

  /** Parses then flattens stored or client-supplied JSON; malformed input yields what it can. */
  public static List<FilterCondition> flatten(Object rawGroups) {
    return flatten(FilterTreeParser.parseGroups(rawGroups));
  }

  /** Every field id referenced by a condition anywhere in the tree, in first-seen order. */
  public static Set<String> referencedFields(Object rawGroups) {
    var fields = new LinkedHashSet<String>();
    for (FilterCondition condition : flatten(rawGroups)) {
      fields.add(condition.field());
    }
    return fields;
  }

  /**
   * Reverse mapping for storage and display: wraps flat conditions in a single AND group. The
   * original grouping of a flattened tree cannot be recovered.
   */
  public static List<Map<String, Object>> toStoredGroups(List<FilterCondition> conditions) {
    if (conditions == null || conditions.isEmpty()) {
      return List.of();
    }
    var group = new LinkedHashMap<String, Object>();
    group.put("logic", FilterLogic.AND.name());
    group.put("conditions", conditions.stream().map(FilterCondition::toMap).toList());
    return List.of(group);
  }

  private static void collect(FilterGroup group, List<FilterCondition> out) {
    for (FilterNode node : group.conditions()) {
      if (node instanceof FilterCondition condition) {
        out.add(condition);
      } else if (node instanceof FilterGroup nested) {
        collect(nested, out);
      }
    }
  }

  private FilterTreeFlattener() {}
}
