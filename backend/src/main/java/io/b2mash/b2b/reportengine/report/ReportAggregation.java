package io.b2mash.b2b.reportengine.report;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * One aggregation entry on a saved report.
 *
 * @param field field id to aggregate
 * @param function aggregate function
 * @param alias optional result column name
 */
public record ReportAggregation(
    @NotBlank String field, @NotNull AggregationFunction function, String alias) {}
