package io.b2mash.b2b.reportengine.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum SortOrder {
  ASC,
  DESC;

  @JsonValue
  public String getKey() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static SortOrder fromKey(String key) {
    return valueOf(key.toUpperCase(Locale.ROOT));
  }
}
