package io.b2mash.b2b.reportengine.report.field;

import java.util.List;

/** Fields sharing a presentation bucket in the report designer. */
public record FieldGroup(String groupName, List<ReportFieldDefinition> fields) {}
