package io.b2mash.b2b.reportengine.report.field;

import static io.b2mash.b2b.reportengine.report.field.ReportFieldType.BOOLEAN;
import static io.b2mash.b2b.reportengine.report.field.ReportFieldType.DATE;
import static io.b2mash.b2b.reportengine.report.field.ReportFieldType.DATETIME;
import static io.b2mash.b2b.reportengine.report.field.ReportFieldType.ENUM;
import static io.b2mash.b2b.reportengine.report.field.ReportFieldType.NUMBER;
import static io.b2mash.b2b.reportengine.report.field.ReportFieldType.STRING;
import static io.b2mash.b2b.reportengine.report.field.ReportFieldType.UUID;

import io.b2mash.b2b.reportengine.report.ReportEntityType;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Compiled-in field table, one ordered list per entity type. Built once at class load and never
 * mutated.
 *
 * <p>Capability flags are written as a string: {@code F} filterable, {@code S} sortable, {@code G}
 * groupable, {@code A} aggregatable.
 */
final class StaticFieldCatalog {

  private static final Map<ReportEntityType, List<ReportFieldDefinition>> FIELDS = build();

  static List<ReportFieldDefinition> fieldsFor(ReportEntityType entityType) {
    return FIELDS.getOrDefault(entityType, List.of());
  }

  private static Map<ReportEntityType, List<ReportFieldDefinition>> build() {
    var fields = new EnumMap<ReportEntityType, List<ReportFieldDefinition>>(ReportEntityType.class);
    fields.put(ReportEntityType.CASES, cases());
    fields.put(ReportEntityType.RIUS, rius());
    fields.put(ReportEntityType.PERSONS, persons());
    fields.put(ReportEntityType.CAMPAIGNS, campaigns());
    fields.put(ReportEntityType.POLICIES, policies());
    fields.put(ReportEntityType.DISCLOSURES, disclosures());
    fields.put(ReportEntityType.INVESTIGATIONS, investigations());
    return Collections.unmodifiableMap(fields);
  }

  private static List<ReportFieldDefinition> cases() {
    return concat(
        group(
            "Case Details",
            f("id", "Case ID", UUID, "id", "FS"),
            f("referenceNumber", "Reference Number", STRING, "referenceNumber", "FS"),
            f("status", "Status", ENUM, "status", "FSG")
                .values("NEW", "IN_PROGRESS", "PENDING", "CLOSED", "MERGED"),
            f("outcome", "Outcome", ENUM, "outcome", "FSG")
                .values(
                    "SUBSTANTIATED", "UNSUBSTANTIATED", "INCONCLUSIVE", "NO_ACTION_REQUIRED",
                    "REFERRED"),
            f("pipelineStage", "Pipeline Stage", STRING, "pipelineStage", "FSG"),
            f("severity", "Severity", ENUM, "severity", "FSG")
                .values("LOW", "MEDIUM", "HIGH", "CRITICAL"),
            f("caseType", "Case Type", ENUM, "caseType", "FSG")
                .values("REPORT", "REQUEST_INFO", "QUESTION", "COMPLIMENT", "FOLLOW_UP"),
            f("sourceChannel", "Source Channel", ENUM, "sourceChannel", "FSG")
                .values("PHONE", "WEB_FORM", "EMAIL", "CHATBOT", "PROXY", "IMPORTED"),
            f("tags", "Tags", STRING, "tags", "F")),
        group(
            "Classification",
            f("primaryCategoryId", "Primary Category ID", UUID, "primaryCategoryId", "FG"),
            f("primaryCategoryName", "Primary Category", STRING, "primaryCategory.name", "FSG")
                .joinedVia("primaryCategory"),
            f("secondaryCategoryId", "Secondary Category ID", UUID, "secondaryCategoryId", "FG"),
            f(
                "secondaryCategoryName",
                "Secondary Category",
                STRING,
                "secondaryCategory.name",
                "FSG")
                .joinedVia("secondaryCategory")),
        group(
            "Assignment",
            f("createdById", "Created By ID", UUID, "createdById", "FG"),
            f("createdByName", "Created By", STRING, "createdBy.firstName", "FSG")
                .joinedVia("createdBy"),
            f("intakeOperatorId", "Intake Operator ID", UUID, "intakeOperatorId", "FG"),
            f("intakeOperatorName", "Intake Operator", STRING, "intakeOperator.firstName", "FSG")
                .joinedVia("intakeOperator")),
        group(
            "Reporter",
            f("reporterType", "Reporter Type", ENUM, "reporterType", "FSG")
                .values("ANONYMOUS", "CONFIDENTIAL", "IDENTIFIED"),
            f("reporterAnonymous", "Is Anonymous", BOOLEAN, "reporterAnonymous", "FSG"),
            f("reporterRelationship", "Reporter Relationship", ENUM, "reporterRelationship", "FSG")
                .values(
                    "EMPLOYEE", "FORMER_EMPLOYEE", "CONTRACTOR", "VENDOR", "CUSTOMER", "OTHER")),
        group(
            "Location",
            f("locationCity", "City", STRING, "locationCity", "FSG"),
            f("locationState", "State/Province", STRING, "locationState", "FSG"),
            f("locationCountry", "Country", STRING, "locationCountry", "FSG")),
        group(
            "Timestamps",
            f("createdAt", "Created At", DATETIME, "createdAt", "FSG"),
            f("updatedAt", "Updated At", DATETIME, "updatedAt", "FS"),
            f("intakeTimestamp", "Intake Time", DATETIME, "intakeTimestamp", "FSG"),
            f("outcomeAt", "Outcome At", DATETIME, "outcomeAt", "FSG"),
            f("releasedAt", "Released At", DATETIME, "releasedAt", "FSG")),
        group(
            "Metrics",
            f("daysOpen", "Days Open", NUMBER, "daysOpen", "FSA").computed()),
        group(
            "AI",
            f("aiSummary", "AI Summary", STRING, "aiSummary", ""),
            f("aiConfidenceScore", "AI Confidence", NUMBER, "aiConfidenceScore", "FSA")));
  }

  private static List<ReportFieldDefinition> rius() {
    return concat(
        group(
            "RIU Details",
            f("id", "RIU ID", UUID, "id", "FS"),
            f("referenceNumber", "Reference Number", STRING, "referenceNumber", "FS"),
            f("type", "RIU Type", ENUM, "type", "FSG")
                .values(
                    "HOTLINE_REPORT", "WEB_FORM_SUBMISSION", "DISCLOSURE_RESPONSE", "EMAIL_INTAKE",
                    "CHATBOT_TRANSCRIPT"),
            f("status", "Status", ENUM, "status", "FSG")
                .values("PENDING_QA", "IN_QA", "RELEASED", "REJECTED"),
            f("severity", "Severity", ENUM, "severity", "FSG")
                .values("LOW", "MEDIUM", "HIGH", "CRITICAL")),
        group(
            "Source",
            f("sourceChannel", "Source Channel", ENUM, "sourceChannel", "FSG")
                .values("PHONE", "WEB_FORM", "EMAIL", "CHATBOT", "PROXY"),
            f("campaignId", "Campaign ID", UUID, "campaignId", "FG")),
        group(
            "Classification",
            f("categoryId", "Category ID", UUID, "categoryId", "FG"),
            f("categoryName", "Category", STRING, "category.name", "FSG").joinedVia("category")),
        group(
            "Reporter",
            f("reporterType", "Reporter Type", ENUM, "reporterType", "FSG")
                .values("ANONYMOUS", "CONFIDENTIAL", "IDENTIFIED")),
        group(
            "Location",
            f("locationCity", "City", STRING, "locationCity", "FSG"),
            f("locationState", "State/Province", STRING, "locationState", "FSG"),
            f("locationCountry", "Country", STRING, "locationCountry", "FSG")),
        group(
            "Timestamps",
            f("createdAt", "Created At", DATETIME, "createdAt", "FSG")),
        group(
            "AI",
            f("aiSummary", "AI Summary", STRING, "aiSummary", ""),
            f("aiRiskScore", "AI Risk Score", NUMBER, "aiRiskScore", "FSA"),
            f("aiLanguageDetected", "Language Detected", STRING, "aiLanguageDetected", "FSG")));
  }

  private static List<ReportFieldDefinition> persons() {
    return concat(
        group(
            "Person Details",
            f("id", "Person ID", UUID, "id", "FS"),
            f("type", "Person Type", ENUM, "type", "FSG")
                .values("EMPLOYEE", "SUBJECT", "WITNESS", "EXTERNAL_CONTACT", "UNKNOWN"),
            f("source", "Source", ENUM, "source", "FSG")
                .values("HRIS", "MANUAL", "INTAKE", "DISCLOSURE"),
            f("status", "Status", ENUM, "status", "FSG")
                .values("ACTIVE", "INACTIVE", "TERMINATED", "MERGED")),
        group(
            "Employment",
            f("employeeId", "Employee ID", STRING, "employeeId", "FS"),
            f("jobTitle", "Job Title", STRING, "jobTitle", "FSG"),
            f("employmentStatus", "Employment Status", STRING, "employmentStatus", "FSG")),
        group(
            "Organization",
            f("businessUnitId", "Business Unit ID", UUID, "businessUnitId", "FG"),
            f("businessUnitName", "Business Unit", STRING, "businessUnitName", "FSG"),
            f("locationId", "Location ID", UUID, "locationId", "FG"),
            f("locationName", "Location", STRING, "locationName", "FSG"),
            f("managerId", "Manager ID", UUID, "managerId", "FG"),
            f("managerName", "Manager", STRING, "managerName", "FSG")),
        group(
            "Timestamps",
            f("createdAt", "Created At", DATETIME, "createdAt", "FSG"),
            f("updatedAt", "Updated At", DATETIME, "updatedAt", "FS")));
  }

  private static List<ReportFieldDefinition> campaigns() {
    return concat(
        group(
            "Campaign Details",
            f("id", "Campaign ID", UUID, "id", "FS"),
            f("name", "Name", STRING, "name", "FS"),
            f("type", "Campaign Type", ENUM, "type", "FSG")
                .values("DISCLOSURE", "ATTESTATION", "SURVEY"),
            f("status", "Status", ENUM, "status", "FSG")
                .values("DRAFT", "SCHEDULED", "ACTIVE", "PAUSED", "COMPLETED", "CANCELLED"),
            f("version", "Version", NUMBER, "version", "FS")),
        group(
            "Schedule",
            f("launchAt", "Scheduled Launch", DATETIME, "launchAt", "FSG"),
            f("launchedAt", "Actual Launch", DATETIME, "launchedAt", "FSG"),
            f("dueDate", "Due Date", DATETIME, "dueDate", "FSG"),
            f("expiresAt", "Expiration", DATETIME, "expiresAt", "FS")),
        group(
            "Audience",
            f("audienceMode", "Audience Mode", ENUM, "audienceMode", "FSG")
                .values("ALL", "SEGMENT", "MANUAL"),
            f("totalAssignments", "Total Assignments", NUMBER, "totalAssignments", "FSA")),
        group(
            "Progress",
            f("completedAssignments", "Completed", NUMBER, "completedAssignments", "FSA"),
            f("overdueAssignments", "Overdue", NUMBER, "overdueAssignments", "FSA"),
            f("completionPercentage", "Completion %", NUMBER, "completionPercentage", "FSA")),
        group(
            "Timestamps",
            f("createdAt", "Created At", DATETIME, "createdAt", "FSG"),
            f("updatedAt", "Updated At", DATETIME, "updatedAt", "FS")));
  }

  private static List<ReportFieldDefinition> policies() {
    return concat(
        group(
            "Policy Details",
            f("id", "Policy ID", UUID, "id", "FS"),
            f("title", "Title", STRING, "title", "FS"),
            f("slug", "Slug", STRING, "slug", "FS"),
            f("policyType", "Policy Type", ENUM, "policyType", "FSG")
                .values("POLICY", "PROCEDURE", "GUIDELINE", "STANDARD"),
            f("category", "Category", STRING, "category", "FSG"),
            f("status", "Status", ENUM, "status", "FSG")
                .values("DRAFT", "PENDING_REVIEW", "APPROVED", "PUBLISHED", "RETIRED")),
        group(
            "Version",
            f("currentVersion", "Current Version", NUMBER, "currentVersion", "FS")),
        group(
            "Ownership",
            f("ownerId", "Owner ID", UUID, "ownerId", "FG"),
            f("ownerName", "Owner", STRING, "owner.firstName", "FSG").joinedVia("owner")),
        group(
            "Dates",
            f("effectiveDate", "Effective Date", DATE, "effectiveDate", "FSG"),
            f("reviewDate", "Review Date", DATE, "reviewDate", "FSG"),
            f("retiredAt", "Retired At", DATETIME, "retiredAt", "FS")),
        group(
            "Timestamps",
            f("createdAt", "Created At", DATETIME, "createdAt", "FSG"),
            f("updatedAt", "Updated At", DATETIME, "updatedAt", "FS")));
  }

  private static List<ReportFieldDefinition> disclosures() {
    return concat(
        group(
            "Disclosure Details",
            f("id", "Disclosure ID", UUID, "id", "FS"),
            f("disclosureType", "Disclosure Type", ENUM, "disclosureType", "FSG")
                .values(
                    "CONFLICT_OF_INTEREST", "GIFT", "ENTERTAINMENT", "OUTSIDE_ACTIVITY",
                    "FINANCIAL_INTEREST"),
            f("status", "Status", ENUM, "status", "FSG")
                .values(
                    "DRAFT", "SUBMITTED", "UNDER_REVIEW", "APPROVED", "REJECTED",
                    "REQUIRES_ACTION")),
        group(
            "Review",
            f("riskLevel", "Risk Level", ENUM, "riskLevel", "FSG").values("LOW", "MEDIUM", "HIGH"),
            f("reviewedAt", "Reviewed At", DATETIME, "reviewedAt", "FSG")),
        group(
            "Submitter",
            f(
                "submittedByEmployeeId",
                "Submitter Employee ID",
                UUID,
                "submittedByEmployeeId",
                "FG")),
        group(
            "Timestamps",
            f("submittedAt", "Submitted At", DATETIME, "submittedAt", "FSG"),
            f("createdAt", "Created At", DATETIME, "createdAt", "FSG"),
            f("updatedAt", "Updated At", DATETIME, "updatedAt", "FS")));
  }

  private static List<ReportFieldDefinition> investigations() {
    return concat(
        group(
            "Investigation Details",
            f("id", "Investigation ID", UUID, "id", "FS"),
            f("investigationNumber", "Investigation #", NUMBER, "investigationNumber", "FS"),
            f("caseId", "Case ID", UUID, "caseId", "FG"),
            f("investigationType", "Investigation Type", ENUM, "investigationType", "FSG")
                .values("FULL", "PRELIMINARY", "EXPEDITED", "FOLLOW_UP"),
            f("status", "Status", ENUM, "status", "FSG")
                .values(
                    "NEW", "IN_PROGRESS", "PENDING_REVIEW", "ON_HOLD", "COMPLETED", "CANCELLED"),
            f("outcome", "Outcome", ENUM, "outcome", "FSG")
                .values(
                    "SUBSTANTIATED", "UNSUBSTANTIATED", "INCONCLUSIVE", "PARTIALLY_SUBSTANTIATED",
                    "REFERRED")),
        group(
            "Assignment",
            f(
                "primaryInvestigatorId",
                "Primary Investigator ID",
                UUID,
                "primaryInvestigatorId",
                "FG"),
            f(
                "primaryInvestigatorName",
                "Primary Investigator",
                STRING,
                "primaryInvestigator.firstName",
                "FSG")
                .joinedVia("primaryInvestigator"),
            f("department", "Department", ENUM, "department", "FSG")
                .values("COMPLIANCE", "HR", "LEGAL", "INTERNAL_AUDIT", "SECURITY", "OTHER")),
        group(
            "Timeline",
            f("dueDate", "Due Date", DATE, "dueDate", "FSG"),
            f("slaStatus", "SLA Status", ENUM, "slaStatus", "FSG")
                .values("ON_TRACK", "AT_RISK", "OVERDUE"),
            f("closedAt", "Closed At", DATETIME, "closedAt", "FSG")),
        group(
            "Timestamps",
            f("createdAt", "Created At", DATETIME, "createdAt", "FSG"),
            f("updatedAt", "Updated At", DATETIME, "updatedAt", "FS")));
  }

  // --- table DSL ---

  private static final class Spec {
    private final String id;
    private final String label;
    private final ReportFieldType type;
    private final String sourcePath;
    private final String flags;
    private List<String> enumValues;
    private Boolean computed;
    private String joinPath;

    private Spec(String id, String label, ReportFieldType type, String sourcePath, String flags) {
      this.id = id;
      this.label = label;
      this.type = type;
      this.sourcePath = sourcePath;
      this.flags = flags;
    }

    Spec values(String... values) {
      this.enumValues = List.of(values);
      return this;
    }

    Spec computed() {
      this.computed = Boolean.TRUE;
      return this;
    }

    Spec joinedVia(String joinPath) {
      this.joinPath = joinPath;
      return this;
    }

    ReportFieldDefinition inGroup(String group) {
      return new ReportFieldDefinition(
          id,
          label,
          type,
          group,
          sourcePath,
          flags.indexOf('F') >= 0,
          flags.indexOf('S') >= 0,
          flags.indexOf('G') >= 0,
          flags.indexOf('A') >= 0,
          enumValues,
          computed,
          null,
          joinPath);
    }
  }

  private static Spec f(
      String id, String label, ReportFieldType type, String sourcePath, String flags) {
    return new Spec(id, label, type, sourcePath, flags);
  }

  private static List<ReportFieldDefinition> group(String name, Spec... specs) {
    return Arrays.stream(specs).map(spec -> spec.inGroup(name)).toList();
  }

  @SafeVarargs
  private static List<ReportFieldDefinition> concat(List<ReportFieldDefinition>... groups) {
    return Arrays.stream(groups).flatMap(List::stream).toList();
  }

  private StaticFieldCatalog() {}
}
