package io.b2mash.b2b.reportengine.report;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/**
 * Every query here is scoped by organization id. Paged list queries go through {@link
 * SavedReportSpecifications}.
 */
public interface SavedReportRepository
    extends JpaRepository<SavedReport, UUID>, JpaSpecificationExecutor<SavedReport> {

  Optional<SavedReport> findByIdAndOrganizationId(UUID id, String organizationId);

  @Query(
      """
      SELECT r FROM SavedReport r
      WHERE r.organizationId = :orgId AND r.template = true
      ORDER BY r.templateCategory ASC NULLS LAST, r.name ASC
      """)
  List<SavedReport> findTemplates(@Param("orgId") String orgId);

  boolean existsByOrganizationIdAndTemplateTrueAndName(String organizationId, String name);

  /** Last-writer-wins update of run statistics. Returns the number of rows touched. */
  @Modifying(clearAutomatically = true)
  @Transactional
  @Query(
      """
      UPDATE SavedReport r
      SET r.lastRunAt = :ranAt, r.lastRunDuration = :durationMs, r.lastRunRowCount = :rowCount
      WHERE r.id = :id AND r.organizationId = :orgId
      """)
  int recordRun(
      @Param("id") UUID id,
      @Param("orgId") String orgId,
      @Param("ranAt") Instant ranAt,
      @Param("durationMs") long durationMs,
      @Param("rowCount") long rowCount);
}
