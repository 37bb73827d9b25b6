package io.b2mash.b2b.reportengine.report.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.reportengine.config.ReportingConfig.ReportingProperties;
import io.b2mash.b2b.reportengine.exception.InvalidStateException;
import io.b2mash.b2b.reportengine.report.AggregationFunction;
import io.b2mash.b2b.reportengine.report.ReportAggregation;
import io.b2mash.b2b.reportengine.report.filter.FilterCondition;
import io.b2mash.b2b.reportengine.report.filter.FilterOperator;
import io.b2mash.b2b.reportengine.testutil.TestReportFactory;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ReportConfigBuilderTest {

  private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");
  private static final String ORG_ID = "org_config";

  private final ReportConfigBuilder builder =
      new ReportConfigBuilder(
          new ReportingProperties(
              new ReportingProperties.Paging(20, 100), new ReportingProperties.Run(1000)),
          Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void build_appendsDateRangeAfterStoredFilters() {
    var report = TestReportFactory.casesReport(ORG_ID, "Open cases", UUID.randomUUID());

    var config =
        builder.build(report, new RunReportRequest(null, "2024-01-01", "2024-02-01", null, null));

    assertThat(config.filters())
        .containsExactly(
            new FilterCondition("status", FilterOperator.EQ, "NEW"),
            new FilterCondition(
                "createdAt",
                FilterOperator.BETWEEN,
                Instant.parse("2024-01-01T00:00:00Z"),
                Instant.parse("2024-02-01T00:00:00Z")));
    assertThat(config.limit()).isEqualTo(1000);
    assertThat(config.offset()).isZero();
  }

  @Test
  void build_overrideFiltersReplaceStoredTree() {
    var report = TestReportFactory.casesReport(ORG_ID, "Open cases", UUID.randomUUID());
    var overrides =
        new RunReportRequest(
            List.of(TestReportFactory.statusGroup("CLOSED")), null, null, 50, 100);

    var config = builder.build(report, overrides);

    assertThat(config.filters())
        .containsExactly(new FilterCondition("status", FilterOperator.EQ, "CLOSED"));
    assertThat(config.limit()).isEqualTo(50);
    assertThat(config.offset()).isEqualTo(100);
  }

  @Test
  void build_emptyOverrideFiltersClearStoredTree() {
    var report = TestReportFactory.casesReport(ORG_ID, "Open cases", UUID.randomUUID());

    var config = builder.build(report, new RunReportRequest(List.of(), null, null, null, null));

    assertThat(config.filters()).isEmpty();
  }

  @Test
  void build_openEndedRangeDefaultsToEpochAndNow() {
    var report = TestReportFactory.casesReport(ORG_ID, "Open cases", UUID.randomUUID());

    var fromOnly =
        builder.build(
            report, new RunReportRequest(null, "2024-03-01T10:00:00+02:00", null, 0, null));
    var toOnly = builder.build(report, new RunReportRequest(null, null, "2024-04-01", null, null));

    assertThat(fromOnly.filters().get(1).value())
        .isEqualTo(Instant.parse("2024-03-01T08:00:00Z"));
    assertThat(fromOnly.filters().get(1).valueTo()).isEqualTo(NOW);
    assertThat(fromOnly.limit()).isEqualTo(1000);
    assertThat(toOnly.filters().get(1).value()).isEqualTo(Instant.EPOCH);
  }

  @Test
  void build_withoutOverridesUsesStoredDefinition() {
    var report = TestReportFactory.casesReport(ORG_ID, "Open cases", UUID.randomUUID());
    report.summarize(
        List.of("severity"),
        List.of(
            new ReportAggregation("daysOpen", AggregationFunction.AVG, "avgAge"),
            new ReportAggregation("id", AggregationFunction.COUNT, null)));

    var config = builder.build(report, null);

    assertThat(config.entityType().getKey()).isEqualTo("cases");
    assertThat(config.columns()).containsExactly("referenceNumber", "status", "severity");
    assertThat(config.filters()).hasSize(1);
    assertThat(config.groupBy()).containsExactly("severity");
    assertThat(config.aggregation())
        .isEqualTo(new AggregationSpec(AggregationFunction.AVG, "daysOpen"));
  }

  @Test
  void build_unparseableBoundIsRejected() {
    var report = TestReportFactory.casesReport(ORG_ID, "Open cases", UUID.randomUUID());

    var overrides = new RunReportRequest(null, "last week", null, null, null);

    assertThatThrownBy(() -> builder.build(report, overrides))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            e -> assertThat(e.getBody().getTitle()).isEqualTo("Invalid date range"));
  }
}
