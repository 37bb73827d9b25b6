package io.b2mash.b2b.reportengine.report;

import java.util.Map;

/** Rendering hints for chart visualizations. All fields are optional. */
public record ChartConfig(
    String xAxisField,
    String yAxisField,
    String seriesField,
    Map<String, String> colors,
    Boolean showDataLabels,
    Boolean showLegend,
    Boolean stacked,
    String comparisonPeriod,
    String funnelMetric) {}
