package io.b2mash.b2b.reportengine.export;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ScheduledExportRunRepository extends JpaRepository<ScheduledExportRun, UUID> {

  @Modifying
  @Query("DELETE FROM ScheduledExportRun r WHERE r.scheduledExportId = :scheduledExportId")
  void deleteByScheduledExportId(@Param("scheduledExportId") UUID scheduledExportId);
}
