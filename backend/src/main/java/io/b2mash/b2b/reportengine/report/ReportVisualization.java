package io.b2mash.b2b.reportengine.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

public enum ReportVisualization {
  TABLE("table"),
  BAR("bar"),
  LINE("line"),
  PIE("pie"),
  KPI("kpi"),
  FUNNEL("funnel"),
  STACKED_BAR("stacked_bar");

  private final String key;

  ReportVisualization(String key) {
    this.key = key;
  }

  @JsonValue
  public String getKey() {
    return key;
  }

  @JsonCreator
  public static ReportVisualization fromKey(String key) {
    return Arrays.stream(values())
        .filter(v -> v.key.equalsIgnoreCase(key) || v.name().equalsIgnoreCase(key))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown visualization: " + key));
  }
}
