package io.b2mash.b2b.reportengine.export;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ScheduledExportRepository extends JpaRepository<ScheduledExport, UUID> {

  Optional<ScheduledExport> findByIdAndOrganizationId(UUID id, String organizationId);
}
