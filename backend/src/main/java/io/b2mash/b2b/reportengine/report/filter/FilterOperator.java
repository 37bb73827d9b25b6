package io.b2mash.b2b.reportengine.report.filter;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

public enum FilterOperator {
  EQ("eq"),
  NEQ("neq"),
  GT("gt"),
  GTE("gte"),
  LT("lt"),
  LTE("lte"),
  CONTAINS("contains"),
  STARTS_WITH("startsWith"),
  ENDS_WITH("endsWith"),
  IN("in"),
  NOT_IN("notIn"),
  IS_NULL("isNull"),
  IS_NOT_NULL("isNotNull"),
  BETWEEN("between");

  private final String key;

  FilterOperator(String key) {
    this.key = key;
  }

  @JsonValue
  public String getKey() {
    return key;
  }

  public static Optional<FilterOperator> fromKey(String key) {
    return Arrays.stream(values()).filter(op -> op.key.equals(key)).findFirst();
  }
}
