package io.b2mash.b2b.reportengine.report.field;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Data type of a reportable field, as the designer and the executor see it. */
public enum ReportFieldType {
  STRING,
  NUMBER,
  DATE,
  DATETIME,
  BOOLEAN,
  ENUM,
  UUID;

  @JsonValue
  public String getKey() {
    return name().toLowerCase(Locale.ROOT);
  }
}
