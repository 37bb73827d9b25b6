package io.b2mash.b2b.reportengine.report;

import io.b2mash.b2b.reportengine.exception.InvalidStateException;
import io.b2mash.b2b.reportengine.report.field.ReportFieldDefinition;
import io.b2mash.b2b.reportengine.report.field.ReportFieldRegistry;
import io.b2mash.b2b.reportengine.report.filter.FilterTreeFlattener;
import io.b2mash.b2b.reportengine.report.filter.FilterTreeParser;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Checks a report definition before it is persisted: entity type, filter tree shape, every field
 * reference against the catalog, and aggregations against aggregatable fields.
 */
@Component
public class ReportDefinitionValidator {

  private final ReportFieldRegistry fieldRegistry;

  public ReportDefinitionValidator(ReportFieldRegistry fieldRegistry) {
    this.fieldRegistry = fieldRegistry;
  }

  public ReportEntityType requireEntityType(String key) {
    return ReportEntityType.fromKey(key)
        .orElseThrow(
            () ->
                new InvalidStateException(
                    "Invalid entity type",
                    "Unknown entity type '"
                        + key
                        + "'. Supported: "
                        + fieldRegistry.getSupportedEntityTypes()));
  }

  public void validate(
      ReportEntityType entityType,
      String orgId,
      List<String> columns,
      List<Map<String, Object>> filters,
      List<String> groupBy,
      String sortBy,
      List<ReportAggregation> aggregation) {
    var problems = FilterTreeParser.findProblems(filters);
    if (!problems.isEmpty()) {
      throw new InvalidStateException("Invalid report filters", String.join("; ", problems));
    }

    var referenced = new LinkedHashSet<String>();
    if (columns != null) {
      referenced.addAll(columns);
    }
    if (groupBy != null) {
      referenced.addAll(groupBy);
    }
    if (sortBy != null) {
      referenced.add(sortBy);
    }
    if (aggregation != null) {
      aggregation.forEach(a -> referenced.add(a.field()));
    }
    referenced.addAll(FilterTreeFlattener.referencedFields(filters));

    var result = fieldRegistry.validateFields(entityType.getKey(), orgId, referenced);
    if (!result.valid()) {
      throw InvalidStateException.invalidFields(entityType.getKey(), result.invalidFields());
    }

    if (aggregation != null) {
      validateAggregations(entityType, orgId, aggregation);
    }
  }

  private void validateAggregations(
      ReportEntityType entityType, String orgId, List<ReportAggregation> aggregation) {
    var rejected = new ArrayList<String>();
    for (ReportAggregation agg : aggregation) {
      if (agg.function() == AggregationFunction.COUNT) {
        continue;
      }
      boolean aggregatable =
          fieldRegistry
              .getFieldById(entityType.getKey(), orgId, agg.field())
              .map(ReportFieldDefinition::aggregatable)
              .orElse(false);
      if (!aggregatable) {
        rejected.add(agg.function() + "(" + agg.field() + ")");
      }
    }
    if (!rejected.isEmpty()) {
      throw new InvalidStateException(
          "Invalid aggregation", "Fields are not aggregatable: " + String.join(", ", rejected));
    }
  }
}
