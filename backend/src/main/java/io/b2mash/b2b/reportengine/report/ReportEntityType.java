package io.b2mash.b2b.reportengine.report;

import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.b2b.reportengine.customproperty.CustomPropertyEntityType;
import java.util.Arrays;
import java.util.Optional;

/** The record kinds a report can be defined over. */
public enum ReportEntityType {
  CASES("cases", CustomPropertyEntityType.CASE),
  RIUS("rius", CustomPropertyEntityType.RIU),
  PERSONS("persons", CustomPropertyEntityType.PERSON),
  CAMPAIGNS("campaigns", null),
  POLICIES("policies", null),
  DISCLOSURES("disclosures", null),
  INVESTIGATIONS("investigations", CustomPropertyEntityType.INVESTIGATION);

  private final String key;
  private final CustomPropertyEntityType customPropertyType;

  ReportEntityType(String key, CustomPropertyEntityType customPropertyType) {
    this.key = key;
    this.customPropertyType = customPropertyType;
  }

  @JsonValue
  public String getKey() {
    return key;
  }

  /** The custom-property domain for this entity type, if tenants can extend it. */
  public Optional<CustomPropertyEntityType> customPropertyType() {
    return Optional.ofNullable(customPropertyType);
  }

  public static Optional<ReportEntityType> fromKey(String key) {
    if (key == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(t -> t.key.equals(key)).findFirst();
  }
}
