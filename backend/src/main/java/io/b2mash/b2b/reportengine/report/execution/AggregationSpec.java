package io.b2mash.b2b.reportengine.report.execution;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.b2mash.b2b.reportengine.report.AggregationFunction;

/** The single aggregation an execution applies. {@code field} may be null for COUNT. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AggregationSpec(AggregationFunction function, String field) {}
