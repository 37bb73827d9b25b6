package io.b2mash.b2b.reportengine.report.template;

import io.b2mash.b2b.reportengine.multitenancy.RequestScopes;
import io.b2mash.b2b.reportengine.report.AggregationFunction;
import io.b2mash.b2b.reportengine.report.ReportAggregation;
import io.b2mash.b2b.reportengine.report.ReportEntityType;
import io.b2mash.b2b.reportengine.report.ReportVisibility;
import io.b2mash.b2b.reportengine.report.ReportVisualization;
import io.b2mash.b2b.reportengine.report.SavedReport;
import io.b2mash.b2b.reportengine.report.SavedReportRepository;
import io.b2mash.b2b.reportengine.report.SortOrder;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Installs the standard template reports for an organization. Idempotent: a template whose name
 * already exists in the organization is skipped, so re-running only adds templates introduced
 * since the last run.
 */
@Service
public class ReportTemplatePackSeeder {

  private static final Logger log = LoggerFactory.getLogger(ReportTemplatePackSeeder.class);

  /** Owner recorded on seeded templates. */
  static final UUID SYSTEM_CREATOR_ID = new UUID(0L, 0L);

  record TemplateSpec(
      String name,
      String description,
      String category,
      ReportEntityType entityType,
      List<String> columns,
      List<Map<String, Object>> filters,
      List<String> groupBy,
      List<ReportAggregation> aggregation,
      ReportVisualization visualization,
      String sortBy,
      SortOrder sortOrder) {}

  static final List<TemplateSpec> TEMPLATES =
      List.of(
          new TemplateSpec(
              "Open Cases by Severity",
              "Unresolved cases grouped by severity",
              "compliance",
              ReportEntityType.CASES,
              List.of("referenceNumber", "status", "severity", "caseType", "createdAt"),
              List.of(
                  Map.of(
                      "logic",
                      "AND",
                      "conditions",
                      List.of(Map.of("field", "status", "operator", "neq", "value", "CLOSED")))),
              List.of("severity"),
              List.of(new ReportAggregation("id", AggregationFunction.COUNT, "caseCount")),
              ReportVisualization.BAR,
              "createdAt",
              SortOrder.DESC),
          new TemplateSpec(
              "Cases by Category",
              "Case volume per primary category",
              "compliance",
              ReportEntityType.CASES,
              List.of("referenceNumber", "primaryCategoryName", "status", "createdAt"),
              List.of(),
              List.of("primaryCategoryName"),
              List.of(new ReportAggregation("id", AggregationFunction.COUNT, "caseCount")),
              ReportVisualization.PIE,
              null,
              null),
          new TemplateSpec(
              "Intake Volume by Channel",
              "Reports received per intake channel",
              "operations",
              ReportEntityType.RIUS,
              List.of("referenceNumber", "type", "sourceChannel", "createdAt"),
              List.of(),
              List.of("sourceChannel"),
              List.of(new ReportAggregation("id", AggregationFunction.COUNT, "intakeCount")),
              ReportVisualization.BAR,
              null,
              null),
          new TemplateSpec(
              "Investigation SLA Status",
              "Open investigations by SLA status",
              "operations",
              ReportEntityType.INVESTIGATIONS,
              List.of("investigationNumber", "status", "slaStatus", "dueDate"),
              List.of(
                  Map.of(
                      "logic",
                      "AND",
                      "conditions",
                      List.of(Map.of("field", "status", "operator", "neq", "value", "CLOSED")))),
              List.of("slaStatus"),
              List.of(new ReportAggregation("id", AggregationFunction.COUNT, "investigationCount")),
              ReportVisualization.PIE,
              "dueDate",
              SortOrder.ASC),
          new TemplateSpec(
              "Average Case Age",
              "Mean days open across all cases",
              "executive",
              ReportEntityType.CASES,
              List.of("referenceNumber", "status", "daysOpen"),
              List.of(),
              null,
              List.of(new ReportAggregation("daysOpen", AggregationFunction.AVG, "avgDaysOpen")),
              ReportVisualization.KPI,
              null,
              null),
          new TemplateSpec(
              "Campaign Completion",
              "Attestation campaign progress",
              "executive",
              ReportEntityType.CAMPAIGNS,
              List.of("name", "status", "completionPercentage", "dueDate"),
              List.of(),
              null,
              null,
              ReportVisualization.TABLE,
              "completionPercentage",
              SortOrder.DESC));

  private final SavedReportRepository savedReportRepository;
  private final TransactionTemplate transactionTemplate;

  public ReportTemplatePackSeeder(
      SavedReportRepository savedReportRepository, TransactionTemplate transactionTemplate) {
    this.savedReportRepository = savedReportRepository;
    this.transactionTemplate = transactionTemplate;
  }

  /** Returns the number of templates created. */
  public int seedForOrganization(String orgId) {
    int[] created = new int[1];
    RequestScopes.runInOrganization(
        orgId, () -> transactionTemplate.executeWithoutResult(tx -> created[0] = doSeed(orgId)));
    return created[0];
  }

  private int doSeed(String orgId) {
    int created = 0;
    for (TemplateSpec spec : TEMPLATES) {
      if (savedReportRepository.existsByOrganizationIdAndTemplateTrueAndName(orgId, spec.name())) {
        continue;
      }
      savedReportRepository.save(toReport(orgId, spec));
      created++;
    }
    log.info(
        "Seeded report templates: orgId={}, created={}, total={}",
        orgId,
        created,
        TEMPLATES.size());
    return created;
  }

  private static SavedReport toReport(String orgId, TemplateSpec spec) {
    var report =
        new SavedReport(
            orgId,
            spec.name(),
            spec.entityType(),
            spec.columns(),
            spec.filters(),
            SYSTEM_CREATOR_ID);
    report.rename(spec.name(), spec.description());
    report.summarize(spec.groupBy(), spec.aggregation());
    report.present(spec.visualization(), null, spec.sortBy(), spec.sortOrder());
    report.changeVisibility(ReportVisibility.EVERYONE);
    report.markTemplate(true, spec.category());
    return report;
  }
}
