package io.b2mash.b2b.reportengine.report;

import io.b2mash.b2b.reportengine.audit.AuditEventBuilder;
import io.b2mash.b2b.reportengine.audit.AuditService;
import io.b2mash.b2b.reportengine.config.ReportingConfig.ReportingProperties;
import io.b2mash.b2b.reportengine.exception.ForbiddenException;
import io.b2mash.b2b.reportengine.exception.ResourceNotFoundException;
import io.b2mash.b2b.reportengine.member.MemberNameResolver;
import io.b2mash.b2b.reportengine.multitenancy.RequestScopes;
import io.b2mash.b2b.reportengine.report.dto.CreateReportRequest;
import io.b2mash.b2b.reportengine.report.dto.ExportJobResponse;
import io.b2mash.b2b.reportengine.report.dto.FavoriteResponse;
import io.b2mash.b2b.reportengine.report.dto.ReportPageResponse;
import io.b2mash.b2b.reportengine.report.dto.SavedReportResponse;
import io.b2mash.b2b.reportengine.report.dto.UpdateReportRequest;
import io.b2mash.b2b.reportengine.report.filter.FilterTreeParser;
import io.b2mash.b2b.reportengine.security.Roles;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Lifecycle of saved report definitions. Every lookup is scoped to the bound organization, so a
 * report owned by another tenant is indistinguishable from a missing one.
 */
@Service
public class SavedReportService {

  private static final Logger log = LoggerFactory.getLogger(SavedReportService.class);

  private static final String ENTITY_TYPE = "saved_report";

  private final SavedReportRepository savedReportRepository;
  private final ReportDefinitionValidator validator;
  private final AuditService auditService;
  private final MemberNameResolver memberNameResolver;
  private final ReportingProperties reportingProperties;

  public SavedReportService(
      SavedReportRepository savedReportRepository,
      ReportDefinitionValidator validator,
      AuditService auditService,
      MemberNameResolver memberNameResolver,
      ReportingProperties reportingProperties) {
    this.savedReportRepository = savedReportRepository;
    this.validator = validator;
    this.auditService = auditService;
    this.memberNameResolver = memberNameResolver;
    this.reportingProperties = reportingProperties;
  }

  @Transactional
  public SavedReportResponse create(CreateReportRequest req) {
    String orgId = RequestScopes.requireOrgId();
    UUID memberId = RequestScopes.requireMemberId();

    ReportEntityType entityType = validator.requireEntityType(req.entityType());
    validator.validate(
        entityType,
        orgId,
        req.columns(),
        req.filters(),
        req.groupBy(),
        req.sortBy(),
        req.aggregation());

    var report =
        new SavedReport(orgId, req.name(), entityType, req.columns(), req.filters(), memberId);
    report.rename(req.name(), req.description());
    report.summarize(req.groupBy(), req.aggregation());
    report.present(req.visualization(), req.chartConfig(), req.sortBy(), req.sortOrder());
    report.changeVisibility(req.visibility());
    report.markTemplate(Boolean.TRUE.equals(req.template()), req.templateCategory());

    report = savedReportRepository.save(report);

    log.info(
        "Created report: id={}, name={}, entityType={}, visibility={}",
        report.getId(),
        report.getName(),
        entityType.getKey(),
        report.getVisibility());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("report.created")
            .entityType(ENTITY_TYPE)
            .entityId(report.getId())
            .details(
                Map.of(
                    "name", report.getName(),
                    "entityType", entityType.getKey(),
                    "visibility", report.getVisibility().name()))
            .build());

    return toResponse(report);
  }

  /**
   * Paged list of reports the caller may see.
   *
   * @param page 1-based page number
   * @see SavedReportSpecifications#listable
   */
  @Transactional(readOnly = true)
  public ReportPageResponse list(
      ReportVisibility visibility, Boolean template, String search, int page, int pageSize) {
    String orgId = RequestScopes.requireOrgId();
    UUID memberId = RequestScopes.requireMemberId();

    int size = clampPageSize(pageSize);
    int pageNumber = Math.max(page, 1);
    var pageable =
        PageRequest.of(pageNumber - 1, size, Sort.by(Sort.Direction.DESC, "updatedAt"));

    var result =
        savedReportRepository.findAll(
            SavedReportSpecifications.listable(orgId, memberId, visibility, template, search),
            pageable);

    var names =
        memberNameResolver.resolveNames(
            result.getContent().stream()
                .map(SavedReport::getCreatedById)
                .collect(Collectors.toSet()));
    var data =
        result.getContent().stream()
            .map(r -> SavedReportResponse.from(r, names.get(r.getCreatedById())))
            .toList();
    return new ReportPageResponse(data, result.getTotalElements(), pageNumber, size);
  }

  @Transactional(readOnly = true)
  public SavedReportResponse get(UUID id) {
    return toResponse(requireReport(id));
  }

  @Transactional(readOnly = true)
  public List<SavedReportResponse> templates() {
    String orgId = RequestScopes.requireOrgId();
    return savedReportRepository.findTemplates(orgId).stream().map(this::toResponse).toList();
  }

  @Transactional
  public SavedReportResponse update(UUID id, UpdateReportRequest req) {
    var report = requireReport(id);
    requireOwnerOrAdmin(report, "update");

    ReportEntityType entityType =
        req.entityType() != null
            ? validator.requireEntityType(req.entityType())
            : report.getEntityType();
    var columns = req.columns() != null ? req.columns() : report.getColumns();
    var filters = req.filters() != null ? req.filters() : report.getFilters();
    var groupBy = req.groupBy() != null ? req.groupBy() : report.getGroupBy();
    var aggregation = req.aggregation() != null ? req.aggregation() : report.getAggregation();
    var sortBy = req.sortBy() != null ? req.sortBy() : report.getSortBy();
    validator.validate(
        entityType, report.getOrganizationId(), columns, filters, groupBy, sortBy, aggregation);

    var changes = new LinkedHashMap<String, Object>();
    track(changes, "name", report.getName(), req.name());
    track(changes, "description", report.getDescription(), req.description());
    track(
        changes,
        "entityType",
        report.getEntityType(),
        req.entityType() != null ? entityType : null);
    track(changes, "columns", report.getColumns(), req.columns());
    track(changes, "filters", report.getFilters(), req.filters());
    track(changes, "groupBy", report.getGroupBy(), req.groupBy());
    track(changes, "aggregation", report.getAggregation(), req.aggregation());
    track(changes, "visualization", report.getVisualization(), req.visualization());
    track(changes, "chartConfig", report.getChartConfig(), req.chartConfig());
    track(changes, "sortBy", report.getSortBy(), req.sortBy());
    track(changes, "sortOrder", report.getSortOrder(), req.sortOrder());
    track(changes, "visibility", report.getVisibility(), req.visibility());
    track(changes, "isTemplate", report.isTemplate(), req.template());
    track(changes, "templateCategory", report.getTemplateCategory(), req.templateCategory());

    report.rename(
        req.name() != null ? req.name() : report.getName(),
        req.description() != null ? req.description() : report.getDescription());
    report.reshape(entityType, columns, filters);
    report.summarize(groupBy, aggregation);
    report.present(
        req.visualization() != null ? req.visualization() : report.getVisualization(),
        req.chartConfig() != null ? req.chartConfig() : report.getChartConfig(),
        sortBy,
        req.sortOrder() != null ? req.sortOrder() : report.getSortOrder());
    if (req.visibility() != null) {
      report.changeVisibility(req.visibility());
    }
    if (req.template() != null || req.templateCategory() != null) {
      report.markTemplate(
          req.template() != null ? req.template() : report.isTemplate(),
          req.templateCategory() != null ? req.templateCategory() : report.getTemplateCategory());
    }

    report = savedReportRepository.save(report);

    log.info(
        "Updated report: id={}, name={}, changedFields={}",
        report.getId(),
        report.getName(),
        changes.keySet());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("report.updated")
            .entityType(ENTITY_TYPE)
            .entityId(report.getId())
            .details(Map.of("name", report.getName(), "changes", changes))
            .build());

    return toResponse(report);
  }

  /** Deletes the report. A bound schedule is left for the caller to remove. */
  @Transactional
  public void delete(UUID id) {
    var report = requireReport(id);
    requireOwnerOrAdmin(report, "delete");

    savedReportRepository.delete(report);

    log.info("Deleted report: id={}, name={}", report.getId(), report.getName());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("report.deleted")
            .entityType(ENTITY_TYPE)
            .entityId(report.getId())
            .details(
                Map.of("name", report.getName(), "entityType", report.getEntityType().getKey()))
            .build());
  }

  /**
   * Copies a report into a new private, non-template, non-favorite report owned by the caller.
   * Configuration is deep-copied.
   */
  @Transactional
  public SavedReportResponse duplicate(UUID id) {
    var source = requireReport(id);
    UUID memberId = RequestScopes.requireMemberId();

    var copy =
        new SavedReport(
            source.getOrganizationId(),
            source.getName() + " (Copy)",
            source.getEntityType(),
            source.getColumns(),
            FilterTreeParser.deepCopy(source.getFilters()),
            memberId);
    copy.rename(copy.getName(), source.getDescription());
    copy.summarize(source.getGroupBy(), source.getAggregation());
    copy.present(
        source.getVisualization(),
        copyChartConfig(source.getChartConfig()),
        source.getSortBy(),
        source.getSortOrder());

    copy = savedReportRepository.save(copy);

    log.info(
        "Duplicated report: id={}, originalReportId={}, name={}",
        copy.getId(),
        source.getId(),
        copy.getName());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("report.duplicated")
            .entityType(ENTITY_TYPE)
            .entityId(copy.getId())
            .details(Map.of("name", copy.getName(), "originalReportId", source.getId()))
            .build());

    return toResponse(copy);
  }

  /** Flips the favorite flag. Concurrent toggles are last-writer-wins. */
  @Transactional
  public FavoriteResponse toggleFavorite(UUID id) {
    var report = requireReport(id);
    boolean favorite = report.toggleFavorite();
    savedReportRepository.save(report);
    log.debug("Toggled report favorite: id={}, isFavorite={}", id, favorite);
    return new FavoriteResponse(favorite);
  }

  /** Placeholder export job; rendering is handled by the scheduled export pipeline. */
  @Transactional(readOnly = true)
  public ExportJobResponse requestExport(UUID id) {
    var report = requireReport(id);
    String jobId = "export-" + report.getId() + "-" + Instant.now().toEpochMilli();
    log.info("Queued report export: id={}, jobId={}", report.getId(), jobId);
    return new ExportJobResponse("PENDING", jobId);
  }

  /** Binds an external schedule to the report. */
  @Transactional
  public void linkSchedule(UUID reportId, UUID scheduledExportId) {
    var report = requireReport(reportId);
    report.linkSchedule(scheduledExportId);
    savedReportRepository.save(report);

    log.info("Linked schedule to report: id={}, scheduledExportId={}", reportId, scheduledExportId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("report.schedule_linked")
            .entityType(ENTITY_TYPE)
            .entityId(reportId)
            .details(Map.of("scheduledExportId", scheduledExportId))
            .build());
  }

  @Transactional
  public void unlinkSchedule(UUID reportId) {
    var report = requireReport(reportId);
    UUID previous = report.getScheduledExportId();
    report.unlinkSchedule();
    savedReportRepository.save(report);

    log.info("Unlinked schedule from report: id={}, scheduledExportId={}", reportId, previous);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("report.schedule_unlinked")
            .entityType(ENTITY_TYPE)
            .entityId(reportId)
            .details(Map.of("scheduledExportId", String.valueOf(previous)))
            .build());
  }

  /** Tenant-scoped lookup shared with the run and schedule services. */
  public SavedReport requireReport(UUID id) {
    String orgId = RequestScopes.requireOrgId();
    return savedReportRepository
        .findByIdAndOrganizationId(id, orgId)
        .orElseThrow(() -> new ResourceNotFoundException("Report", id));
  }

  private void requireOwnerOrAdmin(SavedReport report, String action) {
    UUID memberId = RequestScopes.requireMemberId();
    if (report.isOwnedBy(memberId) || Roles.SYSTEM_ADMIN.equals(RequestScopes.getOrgRole())) {
      return;
    }
    log.warn(
        "Refused report {}: id={}, memberId={}, role={}",
        action,
        report.getId(),
        memberId,
        RequestScopes.getOrgRole());
    throw new ForbiddenException(
        "Report " + action + " denied",
        "Only the creator or a system administrator can " + action + " this report");
  }

  private int clampPageSize(int requested) {
    var paging = reportingProperties.list();
    if (requested <= 0) {
      return paging.defaultPageSize();
    }
    return Math.min(requested, paging.maxPageSize());
  }

  private SavedReportResponse toResponse(SavedReport report) {
    return SavedReportResponse.from(
        report, memberNameResolver.resolveNameOrNull(report.getCreatedById()));
  }

  private static void track(
      Map<String, Object> changes, String field, Object oldValue, Object newValue) {
    if (newValue == null || Objects.equals(oldValue, newValue)) {
      return;
    }
    var change = new LinkedHashMap<String, Object>();
    change.put("old", oldValue);
    change.put("new", newValue);
    changes.put(field, change);
  }

  private static ChartConfig copyChartConfig(ChartConfig config) {
    if (config == null) {
      return null;
    }
    return new ChartConfig(
        config.xAxisField(),
        config.yAxisField(),
        config.seriesField(),
        config.colors() != null ? new LinkedHashMap<>(config.colors()) : null,
        config.showDataLabels(),
        config.showLegend(),
        config.stacked(),
        config.comparisonPeriod(),
        config.funnelMetric());
  }
}
