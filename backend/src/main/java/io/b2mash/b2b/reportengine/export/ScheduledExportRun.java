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
import java.util.UUID;

/** One requested or completed delivery of a scheduled export. */
@Entity
@Table(name = "scheduled_export_runs")
public class ScheduledExportRun {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, updatable = false, length = 255)
  private String organizationId;

  @Column(name = "scheduled_export_id", nullable = false, updatable = false)
  private UUID scheduledExportId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ExportRunStatus status;

  @Column(name = "requested_by_id")
  private UUID requestedById;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ScheduledExportRun() {}

  public ScheduledExportRun(String organizationId, UUID scheduledExportId, UUID requestedById) {
    this.organizationId = organizationId;
    this.scheduledExportId = scheduledExportId;
    this.requestedById = requestedById;
    this.status = ExportRunStatus.PENDING;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getOrganizationId() {
    return organizationId;
  }

  public UUID getScheduledExportId() {
    return scheduledExportId;
  }

  public ExportRunStatus getStatus() {
    return status;
  }

  public UUID getRequestedById() {
    return requestedById;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
