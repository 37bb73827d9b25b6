package io.b2mash.b2b.reportengine.customproperty;

import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CustomPropertyService {

  private final CustomPropertyDefinitionRepository definitionRepository;

  public CustomPropertyService(CustomPropertyDefinitionRepository definitionRepository) {
    this.definitionRepository = definitionRepository;
  }

  @Transactional(readOnly = true)
  public List<CustomPropertyDefinition> findActiveDefinitions(
      String orgId, CustomPropertyEntityType entityType) {
    return definitionRepository.findActiveDefinitions(orgId, entityType);
  }
}
