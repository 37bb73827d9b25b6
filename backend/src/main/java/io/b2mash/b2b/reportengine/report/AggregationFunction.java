package io.b2mash.b2b.reportengine.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;

/** Aggregate functions; stored and sent to the executor in upper case. */
public enum AggregationFunction {
  COUNT,
  SUM,
  AVG,
  MIN,
  MAX;

  @JsonCreator
  public static AggregationFunction fromValue(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
