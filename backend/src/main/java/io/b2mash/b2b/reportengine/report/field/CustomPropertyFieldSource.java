package io.b2mash.b2b.reportengine.report.field;

import io.b2mash.b2b.reportengine.customproperty.CustomPropertyDataType;
import io.b2mash.b2b.reportengine.customproperty.CustomPropertyDefinition;
import io.b2mash.b2b.reportengine.customproperty.CustomPropertyService;
import io.b2mash.b2b.reportengine.report.ReportEntityType;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Fields derived from the organization's active custom properties. Re-derived on every call; any
 * failure degrades to an empty list so the static catalog is still served.
 */
@Component
@Order(2)
public class CustomPropertyFieldSource implements FieldSource {

  private static final Logger log = LoggerFactory.getLogger(CustomPropertyFieldSource.class);

  static final String FIELD_ID_PREFIX = "custom_";
  static final String DEFAULT_GROUP = "Custom Properties";

  private final CustomPropertyService customPropertyService;

  public CustomPropertyFieldSource(CustomPropertyService customPropertyService) {
    this.customPropertyService = customPropertyService;
  }

  @Override
  public List<ReportFieldDefinition> listFields(ReportEntityType entityType, String orgId) {
    var propertyType = entityType.customPropertyType();
    if (propertyType.isEmpty()) {
      return List.of();
    }
    try {
      return customPropertyService.findActiveDefinitions(orgId, propertyType.get()).stream()
          .map(CustomPropertyFieldSource::toField)
          .toList();
    } catch (RuntimeException e) {
      log.error(
          "Error fetching custom properties for entityType={}, orgId={}: {}",
          entityType.getKey(),
          orgId,
          e.getMessage(),
          e);
      return List.of();
    }
  }

  static ReportFieldDefinition toField(CustomPropertyDefinition property) {
    CustomPropertyDataType dataType = property.getDataType();
    return new ReportFieldDefinition(
        FIELD_ID_PREFIX + property.getKey(),
        property.getName(),
        fieldType(dataType),
        property.getGroupName() != null ? property.getGroupName() : DEFAULT_GROUP,
        "customFields." + property.getKey(),
        true,
        dataType != CustomPropertyDataType.MULTI_SELECT,
        dataType == CustomPropertyDataType.SELECT || dataType == CustomPropertyDataType.BOOLEAN,
        dataType == CustomPropertyDataType.NUMBER,
        enumValues(property.getOptions()),
        null,
        Boolean.TRUE,
        null);
  }

  private static ReportFieldType fieldType(CustomPropertyDataType dataType) {
    return switch (dataType) {
      case NUMBER -> ReportFieldType.NUMBER;
      case DATE -> ReportFieldType.DATE;
      case DATETIME -> ReportFieldType.DATETIME;
      case SELECT, MULTI_SELECT -> ReportFieldType.ENUM;
      case BOOLEAN -> ReportFieldType.BOOLEAN;
      case TEXT, URL, EMAIL, PHONE -> ReportFieldType.STRING;
    };
  }

  /** Reads {@code options.options[]}, where each entry is either {@code {value}} or a string. */
  private static List<String> enumValues(Map<String, Object> options) {
    if (options == null || !(options.get("options") instanceof List<?> entries)) {
      return null;
    }
    var values = new ArrayList<String>();
    for (Object entry : entries) {
      if (entry instanceof Map<?, ?> map && map.get("value") != null) {
        values.add(String.valueOf(map.get("value")));
      } else if (entry != null) {
        values.add(String.valueOf(entry));
      }
    }
    return List.copyOf(values);
  }
}
