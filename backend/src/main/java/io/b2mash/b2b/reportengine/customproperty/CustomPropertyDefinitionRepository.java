package io.b2mash.b2b.reportengine.customproperty;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CustomPropertyDefinitionRepository
    extends JpaRepository<CustomPropertyDefinition, UUID> {

  /** Active definitions for one entity type, ordered by group name (nulls last) then position. */
  @Query(
      """
      SELECT d FROM CustomPropertyDefinition d
      WHERE d.organizationId = :orgId
        AND d.entityType = :entityType
        AND d.active = true
      ORDER BY d.groupName ASC NULLS LAST, d.displayOrder ASC
      """)
  List<CustomPropertyDefinition> findActiveDefinitions(
      @Param("orgId") String orgId, @Param("entityType") CustomPropertyEntityType entityType);
}
