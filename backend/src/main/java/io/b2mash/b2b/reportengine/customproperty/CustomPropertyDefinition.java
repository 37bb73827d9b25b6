package io.b2mash.b2b.reportengine.customproperty;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A tenant-defined attribute on cases, investigations, persons or RIUs. Values live in the owning
 * record's {@code customFields} JSON under {@link #getKey()}.
 */
@Entity
@Table(name = "custom_property_definitions")
public class CustomPropertyDefinition {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, updatable = false, length = 255)
  private String organizationId;

  @Enumerated(EnumType.STRING)
  @Column(name = "entity_type", nullable = false, length = 20)
  private CustomPropertyEntityType entityType;

  @Column(name = "property_key", nullable = false, length = 100)
  private String key;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(name = "data_type", nullable = false, length = 20)
  private CustomPropertyDataType dataType;

  @Column(name = "group_name", length = 100)
  private String groupName;

  @Column(name = "display_order", nullable = false)
  private int displayOrder;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "options", columnDefinition = "jsonb")
  private Map<String, Object> options;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected CustomPropertyDefinition() {}

  public CustomPropertyDefinition(
      String organizationId,
      CustomPropertyEntityType entityType,
      String key,
      String name,
      CustomPropertyDataType dataType) {
    this.organizationId = organizationId;
    this.entityType = entityType;
    this.key = key;
    this.name = name;
    this.dataType = dataType;
    this.displayOrder = 0;
    this.active = true;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Places the property in a designer group at the given position. */
  public void arrange(String groupName, int displayOrder) {
    this.groupName = groupName;
    this.displayOrder = displayOrder;
    this.updatedAt = Instant.now();
  }

  public void updateOptions(Map<String, Object> options) {
    this.options = options;
    this.updatedAt = Instant.now();
  }

  public void deactivate() {
    this.active = false;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getOrganizationId() {
    return organizationId;
  }

  public CustomPropertyEntityType getEntityType() {
    return entityType;
  }

  public String getKey() {
    return key;
  }

  public String getName() {
    return name;
  }

  public CustomPropertyDataType getDataType() {
    return dataType;
  }

  public String getGroupName() {
    return groupName;
  }

  public int getDisplayOrder() {
    return displayOrder;
  }

  public Map<String, Object> getOptions() {
    return options;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
