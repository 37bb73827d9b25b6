package io.b2mash.b2b.reportengine.report.filter;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FilterTreeFlattenerTest {

  @Test
  void flatten_walksNestedGroupsDepthFirstAndDropsLogic() {
    var tree =
        List.of(
            Map.of(
                "logic",
                "AND",
                "conditions",
                List.of(
                    Map.of("field", "status", "operator", "eq", "value", "NEW"),
                    Map.of(
                        "logic",
                        "OR",
                        "conditions",
                        List.of(
                            Map.of("field", "severity", "operator", "eq", "value", "HIGH"),
                            Map.of("field", "severity", "operator", "eq", "value", "CRITICAL"))))));

    var flat = FilterTreeFlattener.flatten(tree);

    assertThat(flat)
        .containsExactly(
            new FilterCondition("status", FilterOperator.EQ, "NEW"),
            new FilterCondition("severity", FilterOperator.EQ, "HIGH"),
            new FilterCondition("severity", FilterOperator.EQ, "CRITICAL"));
  }

  @Test
  void flatten_nullAndEmptyGroupsYieldNothing() {
    assertThat(FilterTreeFlattener.flatten((Object) null)).isEmpty();
    assertThat(FilterTreeFlattener.flatten((List<FilterGroup>) null)).isEmpty();
    assertThat(FilterTreeFlattener.flatten(List.of(Map.of()))).isEmpty();
  }

  @Test
  void flatten_dropsTopLevelConditionsAndUnknownOperators() {
    var tree =
        List.of(
            Map.of("field", "status", "operator", "eq", "value", "NEW"),
            Map.of(
                "logic",
                "AND",
                "conditions",
                List.of(
                    Map.of("field", "status", "operator", "like", "value", "N%"),
                    Map.of("field", "severity", "operator", "in", "value", List.of("HIGH")))));

    var flat = FilterTreeFlattener.flatten(tree);

    assertThat(flat)
        .containsExactly(new FilterCondition("severity", FilterOperator.IN, List.of("HIGH")));
  }

  @Test
  void flatten_keepsBetweenUpperBound() {
    var tree =
        List.of(
            Map.of(
                "conditions",
                List.of(
                    Map.of(
                        "field",
                        "createdAt",
                        "operator",
                        "between",
                        "value",
                        "2024-01-01",
                        "valueTo",
                        "2024-02-01"))));

    var flat = FilterTreeFlattener.flatten(tree);

    assertThat(flat)
        .containsExactly(
            new FilterCondition("createdAt", FilterOperator.BETWEEN, "2024-01-01", "2024-02-01"));
  }

  @Test
  void referencedFields_collectsEachFieldOnceInOrder() {
    var tree =
        List.of(
            Map.of(
                "logic",
                "OR",
                "conditions",
                List.of(
                    Map.of("field", "severity", "operator", "eq", "value", "HIGH"),
                    Map.of("field", "status", "operator", "neq", "value", "CLOSED"),
                    Map.of("field", "severity", "operator", "isNotNull"))));

    assertThat(FilterTreeFlattener.referencedFields(tree)).containsExactly("severity", "status");
  }

  @Test
  void toStoredGroups_wrapsConditionsInSingleAndGroup() {
    var stored =
        FilterTreeFlattener.toStoredGroups(
            List.of(
                new FilterCondition("status", FilterOperator.EQ, "NEW"),
                new FilterCondition("createdAt", FilterOperator.BETWEEN, "a", "b")));

    assertThat(stored).hasSize(1);
    assertThat(stored.get(0)).containsEntry("logic", "AND");
    assertThat(FilterTreeFlattener.flatten(stored))
        .containsExactly(
            new FilterCondition("status", FilterOperator.EQ, "NEW"),
            new FilterCondition("createdAt", FilterOperator.BETWEEN, "a", "b"));
  }

  @Test
  void toStoredGroups_emptyConditionsStoreNoGroup() {
    assertThat(FilterTreeFlattener.toStoredGroups(List.of())).isEmpty();
    assertThat(FilterTreeFlattener.toStoredGroups(null)).isEmpty();
  }
}
