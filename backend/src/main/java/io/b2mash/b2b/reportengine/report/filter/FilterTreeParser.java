package io.b2mash.b2b.reportengine.report.filter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds typed filter trees from the loosely-typed JSON stored on a report or sent by a client.
 *
 * <p>A map is a condition iff it has both {@code field} and {@code operator}; any other map is a
 * group. Malformed entries (non-lists, non-maps, conditions with an unknown operator) are skipped
 * rather than thrown on.
 */
public final class FilterTreeParser {

  private static final Logger log = LoggerFactory.getLogger(FilterTreeParser.class);

  /**
   * Parses the top-level list of groups. Top-level entries that are conditions rather than groups
   * contribute nothing.
   */
  public static List<FilterGroup> parseGroups(Object raw) {
    if (!(raw instanceof List<?> entries)) {
      return List.of();
    }
    var groups = new ArrayList<FilterGroup>();
    for (Object entry : entries) {
      if (entry instanceof Map<?, ?> map && !isCondition(map)) {
        groups.add(parseGroup(map));
      }
    }
    return groups;
  }

  /** Structural discriminator: a node with both {@code field} and {@code operator} keys. */
  public static boolean isCondition(Map<?, ?> node) {
    return node.containsKey("field") && node.containsKey("operator");
  }

  /**
   * Problems that make a stored tree unsafe to save: conditions without a field, unknown
   * operators, and {@code between} without {@code valueTo}. Empty when the tree is acceptable.
   */
  public static List<String> findProblems(Object raw) {
    var problems = new ArrayList<String>();
    if (raw == null) {
      return problems;
    }
    if (!(raw instanceof List<?> entries)) {
      problems.add("filters must be a list of groups");
      return problems;
    }
    for (Object entry : entries) {
      collectProblems(entry, problems);
    }
    return problems;
  }

  private static void collectProblems(Object node, List<String> problems) {
    if (!(node instanceof Map<?, ?> map)) {
      problems.add("filter node is not an object: " + node);
      return;
    }
    if (!isCondition(map)) {
      if (map.get("conditions") instanceof List<?> items) {
        for (Object item : items) {
          collectProblems(item, problems);
        }
      }
      return;
    }
    Object field = map.get("field");
    Object operatorKey = map.get("operator");
    if (!(field instanceof String name) || name.isBlank()) {
      problems.add("condition without a field");
    }
    var operator = FilterOperator.fromKey(operatorKey != null ? operatorKey.toString() : null);
    if (operator.isEmpty()) {
      problems.add("unknown operator '" + operatorKey + "' on field " + field);
    } else if (operator.get() == FilterOperator.BETWEEN && map.get("valueTo") == null) {
      problems.add("between on field " + field + " requires valueTo");
    }
  }

  /** Structural copy of a stored tree; nested maps and lists are copied, leaf values shared. */
  public static List<Map<String, Object>> deepCopy(List<Map<String, Object>> tree) {
    if (tree == null) {
      return null;
    }
    var copy = new ArrayList<Map<String, Object>>(tree.size());
    for (Map<String, Object> node : tree) {
      copy.add(copyMap(node));
    }
    return copy;
  }

  private static Map<String, Object> copyMap(Map<?, ?> source) {
    if (source == null) {
      return null;
    }
    var copy = new LinkedHashMap<String, Object>();
    source.forEach((key, value) -> copy.put(String.valueOf(key), copyValue(value)));
    return copy;
  }

  private static Object copyValue(Object value) {
    if (value instanceof Map<?, ?> map) {
      return copyMap(map);
    }
    if (value instanceof List<?> list) {
      var copy = new ArrayList<Object>(list.size());
      for (Object item : list) {
        copy.add(copyValue(item));
      }
      return copy;
    }
    return value;
  }

  private static FilterGroup parseGroup(Map<?, ?> map) {
    var children = new ArrayList<FilterNode>();
    if (map.get("conditions") instanceof List<?> items) {
      for (Object item : items) {
        if (!(item instanceof Map<?, ?> node)) {
          continue;
        }
        if (isCondition(node)) {
          FilterCondition condition = parseCondition(node);
          if (condition != null) {
            children.add(condition);
          }
        } else {
          children.add(parseGroup(node));
        }
      }
    }
    return new FilterGroup(parseLogic(map.get("logic")), children);
  }

  private static FilterCondition parseCondition(Map<?, ?> node) {
    String field = node.get("field") != null ? String.valueOf(node.get("field")) : null;
    String operatorKey = node.get("operator") != null ? String.valueOf(node.get("operator")) : null;
    var operator = FilterOperator.fromKey(operatorKey);
    if (field == null || operator.isEmpty()) {
      log.warn("Skipping malformed filter condition: field={}, operator={}", field, operatorKey);
      return null;
    }
    return new FilterCondition(field, operator.get(), node.get("value"), node.get("valueTo"));
  }

  private static FilterLogic parseLogic(Object raw) {
    if (raw instanceof String logic && "OR".equals(logic.toUpperCase(Locale.ROOT))) {
      return FilterLogic.OR;
    }
    return FilterLogic.AND;
  }

  private FilterTreeParser() {}
}
