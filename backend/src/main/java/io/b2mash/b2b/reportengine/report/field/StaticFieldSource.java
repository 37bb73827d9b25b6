package io.b2mash.b2b.reportengine.report.field;

import io.b2mash.b2b.reportengine.report.ReportEntityType;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Compiled-in fields; identical for every organization. */
@Component
@Order(1)
public class StaticFieldSource implements FieldSource {

  @Override
  public List<ReportFieldDefinition> listFields(ReportEntityType entityType, String orgId) {
    return StaticFieldCatalog.fieldsFor(entityType);
  }
}
