package io.b2mash.b2b.reportengine.report.field;

import io.b2mash.b2b.reportengine.report.ReportEntityType;
import java.util.List;

/** A provider of reportable fields, composed by {@link ReportFieldRegistry}. */
public interface FieldSource {

  /**
   * Lists the fields this source contributes for the entity type within one organization. Must not
   * throw for missing or partial tenant configuration.
   */
  List<ReportFieldDefinition> listFields(ReportEntityType entityType, String orgId);
}
