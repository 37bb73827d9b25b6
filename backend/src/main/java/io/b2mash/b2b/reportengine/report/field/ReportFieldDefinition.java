package io.b2mash.b2b.reportengine.report.field;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * One reportable attribute of an entity type.
 *
 * @param id stable key used in column lists, filters, grouping and sorting
 * @param label display name
 * @param type data type
 * @param group presentation bucket in the report designer
 * @param sourcePath dotted path into the underlying record, may traverse a relation
 * @param filterable usable in filter conditions
 * @param sortable usable as sort key
 * @param groupable usable in group-by
 * @param aggregatable accepts SUM/AVG/MIN/MAX
 * @param enumValues allowed values for enum fields; null otherwise
 * @param computed true for derived values that are not stored attributes; null when not derived
 * @param customProperty true for tenant-defined custom properties; null for static fields
 * @param joinPath relation traversed to resolve {@code sourcePath}; null for direct attributes
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportFieldDefinition(
    String id,
    String label,
    ReportFieldType type,
    String group,
    String sourcePath,
    boolean filterable,
    boolean sortable,
    boolean groupable,
    boolean aggregatable,
    List<String> enumValues,
    @JsonProperty("isComputed") Boolean computed,
    @JsonProperty("isCustomProperty") Boolean customProperty,
    String joinPath) {

  public boolean isCustomProperty() {
    return Boolean.TRUE.equals(customProperty);
  }
}
