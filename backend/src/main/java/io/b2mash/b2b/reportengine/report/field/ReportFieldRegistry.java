package io.b2mash.b2b.reportengine.report.field;

import io.b2mash.b2b.reportengine.report.ReportEntityType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Catalog of reportable fields per entity type: compiled-in fields followed by the organization's
 * custom properties. Advisory metadata for the designer and the only gate on field references when
 * a report is saved.
 */
@Service
public class ReportFieldRegistry {

  private static final Logger log = LoggerFactory.getLogger(ReportFieldRegistry.class);

  /** Presentation order of groups. Groups not listed sort alphabetically after these. */
  static final List<String> GROUP_ORDER =
      List.of(
          "Case Details",
          "RIU Details",
          "Person Details",
          "Campaign Details",
          "Policy Details",
          "Disclosure Details",
          "Investigation Details",
          "Classification",
          "Source",
          "Assignment",
          "Reporter",
          "Employment",
          "Organization",
          "Location",
          "Ownership",
          "Schedule",
          "Audience",
          "Progress",
          "Review",
          "Submitter",
          "Version",
          "Timeline",
          "Dates",
          "Timestamps",
          "Metrics",
          "AI",
          "Custom Properties");

  private static final Comparator<String> GROUP_COMPARATOR =
      Comparator.<String>comparingInt(
              name -> GROUP_ORDER.contains(name) ? GROUP_ORDER.indexOf(name) : GROUP_ORDER.size())
          .thenComparing(Comparator.naturalOrder());

  private final List<FieldSource> sources;

  public ReportFieldRegistry(List<FieldSource> sources) {
    this.sources = sources;
  }

  /** All fields for the entity type; empty (and logged) for an unknown entity type. */
  public List<ReportFieldDefinition> getFields(String entityType, String orgId) {
    var type = ReportEntityType.fromKey(entityType);
    if (type.isEmpty()) {
      log.warn("No field registry found for entity type: {}", entityType);
      return List.of();
    }
    return getFields(type.get(), orgId);
  }

  public List<ReportFieldDefinition> getFields(ReportEntityType entityType, String orgId) {
    var fields = new ArrayList<ReportFieldDefinition>();
    for (FieldSource source : sources) {
      fields.addAll(source.listFields(entityType, orgId));
    }
    log.debug(
        "Assembled field catalog: entityType={}, orgId={}, fields={}",
        entityType.getKey(),
        orgId,
        fields.size());
    return fields;
  }

  /** Fields bucketed by group, groups in presentation order, fields in catalog order. */
  public List<FieldGroup> getFieldGroups(String entityType, String orgId) {
    var byGroup =
        getFields(entityType, orgId).stream()
            .collect(
                Collectors.groupingBy(
                    ReportFieldDefinition::group, LinkedHashMap::new, Collectors.toList()));
    return byGroup.entrySet().stream()
        .sorted((a, b) -> GROUP_COMPARATOR.compare(a.getKey(), b.getKey()))
        .map(entry -> new FieldGroup(entry.getKey(), List.copyOf(entry.getValue())))
        .toList();
  }

  /** Set-membership check of the given ids against the full catalog. */
  public FieldValidationResult validateFields(
      String entityType, String orgId, Collection<String> fieldIds) {
    Set<String> known =
        getFields(entityType, orgId).stream()
            .map(ReportFieldDefinition::id)
            .collect(Collectors.toSet());
    var invalid =
        fieldIds.stream()
            .filter(Objects::nonNull)
            .distinct()
            .filter(id -> !known.contains(id))
            .toList();
    return FieldValidationResult.of(invalid);
  }

  public Optional<ReportFieldDefinition> getFieldById(
      String entityType, String orgId, String fieldId) {
    return getFields(entityType, orgId).stream().filter(f -> f.id().equals(fieldId)).findFirst();
  }

  public List<String> getSupportedEntityTypes() {
    return Arrays.stream(ReportEntityType.values()).map(ReportEntityType::getKey).toList();
  }

  public int getFieldCount(String entityType, String orgId) {
    return getFields(entityType, orgId).size();
  }
}
