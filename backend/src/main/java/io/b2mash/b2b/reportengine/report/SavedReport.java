package io.b2mash.b2b.reportengine.report;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A saved report definition. The filter tree is kept in the loosely-typed shape it was authored in
 * and only parsed when the report is validated or run.
 */
@Entity
@Table(name = "saved_reports")
public class SavedReport {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, updatable = false, length = 255)
  private String organizationId;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "entity_type", nullable = false, length = 30)
  private ReportEntityType entityType;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "columns", columnDefinition = "jsonb", nullable = false)
  private List<String> columns = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "filters", columnDefinition = "jsonb", nullable = false)
  private List<Map<String, Object>> filters = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "group_by", columnDefinition = "jsonb")
  private List<String> groupBy;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "aggregation", columnDefinition = "jsonb")
  private List<ReportAggregation> aggregation;

  @Enumerated(EnumType.STRING)
  @Column(name = "visualization", nullable = false, length = 20)
  private ReportVisualization visualization;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "chart_config", columnDefinition = "jsonb")
  private ChartConfig chartConfig;

  @Column(name = "sort_by", length = 100)
  private String sortBy;

  @Enumerated(EnumType.STRING)
  @Column(name = "sort_order", length = 4)
  private SortOrder sortOrder;

  @Column(name = "is_template", nullable = false)
  private boolean template;

  @Column(name = "template_category", length = 50)
  private String templateCategory;

  @Enumerated(EnumType.STRING)
  @Column(name = "visibility", nullable = false, length = 20)
  private ReportVisibility visibility;

  @Column(name = "is_favorite", nullable = false)
  private boolean favorite;

  @Column(name = "last_run_at")
  private Instant lastRunAt;

  @Column(name = "last_run_duration")
  private Long lastRunDuration;

  @Column(name = "last_run_row_count")
  private Long lastRunRowCount;

  @Column(name = "scheduled_export_id")
  private UUID scheduledExportId;

  @Column(name = "created_by_id", nullable = false, updatable = false)
  private UUID createdById;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected SavedReport() {}

  public SavedReport(
      String organizationId,
      String name,
      ReportEntityType entityType,
      List<String> columns,
      List<Map<String, Object>> filters,
      UUID createdById) {
    this.organizationId = organizationId;
    this.name = name;
    this.entityType = entityType;
    this.columns = columns != null ? new ArrayList<>(columns) : new ArrayList<>();
    this.filters = filters != null ? new ArrayList<>(filters) : new ArrayList<>();
    this.createdById = createdById;
    this.visibility = ReportVisibility.PRIVATE;
    this.visualization = ReportVisualization.TABLE;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  // --- Mutations ---

  public void rename(String name, String description) {
    this.name = name;
    this.description = description;
    this.updatedAt = Instant.now();
  }

  /** Replaces the data-source shape. Caller validates field references first. */
  public void reshape(
      ReportEntityType entityType, List<String> columns, List<Map<String, Object>> filters) {
    this.entityType = entityType;
    this.columns = columns != null ? new ArrayList<>(columns) : new ArrayList<>();
    this.filters = filters != null ? new ArrayList<>(filters) : new ArrayList<>();
    this.updatedAt = Instant.now();
  }

  public void summarize(List<String> groupBy, List<ReportAggregation> aggregation) {
    this.groupBy = groupBy != null ? new ArrayList<>(groupBy) : null;
    this.aggregation = aggregation != null ? new ArrayList<>(aggregation) : null;
    this.updatedAt = Instant.now();
  }

  public void present(
      ReportVisualization visualization,
      ChartConfig chartConfig,
      String sortBy,
      SortOrder sortOrder) {
    this.visualization = visualization != null ? visualization : ReportVisualization.TABLE;
    this.chartConfig = chartConfig;
    this.sortBy = sortBy;
    this.sortOrder = sortOrder;
    this.updatedAt = Instant.now();
  }

  public void changeVisibility(ReportVisibility visibility) {
    this.visibility = visibility != null ? visibility : ReportVisibility.PRIVATE;
    this.updatedAt = Instant.now();
  }

  public void markTemplate(boolean template, String templateCategory) {
    this.template = template;
    this.templateCategory = templateCategory;
    this.updatedAt = Instant.now();
  }

  /** Flips the favorite flag and returns the new value. */
  public boolean toggleFavorite() {
    this.favorite = !this.favorite;
    this.updatedAt = Instant.now();
    return this.favorite;
  }

  public void linkSchedule(UUID scheduledExportId) {
    this.scheduledExportId = scheduledExportId;
    this.updatedAt = Instant.now();
  }

  public void unlinkSchedule() {
    this.scheduledExportId = null;
    this.updatedAt = Instant.now();
  }

  public boolean isOwnedBy(UUID memberId) {
    return createdById.equals(memberId);
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public String getOrganizationId() {
    return organizationId;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public ReportEntityType getEntityType() {
    return entityType;
  }

  public List<String> getColumns() {
    return columns;
  }

  public List<Map<String, Object>> getFilters() {
    return filters;
  }

  public List<String> getGroupBy() {
    return groupBy;
  }

  public List<ReportAggregation> getAggregation() {
    return aggregation;
  }

  public ReportVisualization getVisualization() {
    return visualization;
  }

  public ChartConfig getChartConfig() {
    return chartConfig;
  }

  public String getSortBy() {
    return sortBy;
  }

  public SortOrder getSortOrder() {
    return sortOrder;
  }

  public boolean isTemplate() {
    return template;
  }

  public String getTemplateCategory() {
    return templateCategory;
  }

  public ReportVisibility getVisibility() {
    return visibility;
  }

  public boolean isFavorite() {
    return favorite;
  }

  public Instant getLastRunAt() {
    return lastRunAt;
  }

  public Long getLastRunDuration() {
    return lastRunDuration;
  }

  public Long getLastRunRowCount() {
    return lastRunRowCount;
  }

  public UUID getScheduledExportId() {
    return scheduledExportId;
  }

  public UUID getCreatedById() {
    return createdById;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
