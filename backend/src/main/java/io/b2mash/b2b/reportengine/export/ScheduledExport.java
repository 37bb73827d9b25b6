package io.b2mash.b2b.reportengine.export;

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
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** A recurring export delivered by email. Inactive schedules have no next run. */
@Entity
@Table(name = "scheduled_exports")
public class ScheduledExport {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, updatable = false, length = 255)
  private String organizationId;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "report_id")
  private UUID reportId;

  @Enumerated(EnumType.STRING)
  @Column(name = "schedule_type", nullable = false, length = 20)
  private ScheduleType scheduleType;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "schedule_config", columnDefinition = "jsonb", nullable = false)
  private ScheduleConfig scheduleConfig;

  @Column(name = "timezone", nullable = false, length = 64)
  private String timezone;

  @Enumerated(EnumType.STRING)
  @Column(name = "format", nullable = false, length = 10)
  private ExportFormat format;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "recipients", columnDefinition = "jsonb", nullable = false)
  private List<String> recipients = new ArrayList<>();

  @Column(name = "is_active", nullable = false)
  private boolean active;

  @Column(name = "last_run_at")
  private Instant lastRunAt;

  @Column(name = "next_run_at")
  private Instant nextRunAt;

  @Column(name = "created_by_id", nullable = false, updatable = false)
  private UUID createdById;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ScheduledExport() {}

  public ScheduledExport(
      String organizationId,
      String name,
      UUID reportId,
      ScheduleType scheduleType,
      ScheduleConfig scheduleConfig,
      String timezone,
      ExportFormat format,
      List<String> recipients,
      UUID createdById) {
    this.organizationId = organizationId;
    this.name = name;
    this.reportId = reportId;
    this.scheduleType = scheduleType;
    this.scheduleConfig = scheduleConfig;
    this.timezone = timezone;
    this.format = format;
    this.recipients = recipients != null ? new ArrayList<>(recipients) : new ArrayList<>();
    this.createdById = createdById;
    this.active = true;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void reschedule(
      ScheduleType scheduleType,
      ScheduleConfig scheduleConfig,
      String timezone,
      Instant nextRunAt) {
    this.scheduleType = scheduleType;
    this.scheduleConfig = scheduleConfig;
    this.timezone = timezone;
    this.nextRunAt = active ? nextRunAt : null;
    this.updatedAt = Instant.now();
  }

  public void redeliver(String name, ExportFormat format, List<String> recipients) {
    this.name = name;
    this.format = format;
    this.recipients = recipients != null ? new ArrayList<>(recipients) : new ArrayList<>();
    this.updatedAt = Instant.now();
  }

  public void pause() {
    this.active = false;
    this.nextRunAt = null;
    this.updatedAt = Instant.now();
  }

  public void resume(Instant nextRunAt) {
    this.active = true;
    this.nextRunAt = nextRunAt;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getOrganizationId() {
    return organizationId;
  }

  public String getName() {
    return name;
  }

  public UUID getReportId() {
    return reportId;
  }

  public ScheduleType getScheduleType() {
    return scheduleType;
  }

  public ScheduleConfig getScheduleConfig() {
    return scheduleConfig;
  }

  public String getTimezone() {
    return timezone;
  }

  public ExportFormat getFormat() {
    return format;
  }

  public List<String> getRecipients() {
    return recipients;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getLastRunAt() {
    return lastRunAt;
  }

  public Instant getNextRunAt() {
    return nextRunAt;
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
