package io.b2mash.b2b.reportengine.member;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "members")
public class Member {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, updatable = false, length = 255)
  private String organizationId;

  @Column(name = "external_user_id", nullable = false, length = 255)
  private String externalUserId;

  @Column(name = "email", nullable = false, length = 255)
  private String email;

  @Column(name = "first_name", length = 100)
  private String firstName;

  @Column(name = "last_name", length = 100)
  private String lastName;

  @Column(name = "org_role", nullable = false, length = 50)
  private String orgRole;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Member() {}

  public Member(
      String organizationId,
      String externalUserId,
      String email,
      String firstName,
      String lastName,
      String orgRole) {
    this.organizationId = organizationId;
    this.externalUserId = externalUserId;
    this.email = email;
    this.firstName = firstName;
    this.lastName = lastName;
    this.orgRole = orgRole;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** "First Last", falling back to the email when no name is known. */
  public String getDisplayName() {
    String first = firstName != null ? firstName.trim() : "";
    String last = lastName != null ? lastName.trim() : "";
    String full = (first + " " + last).trim();
    return full.isEmpty() ? email : full;
  }

  public UUID getId() {
    return id;
  }

  public String getOrganizationId() {
    return organizationId;
  }

  public String getExternalUserId() {
    return externalUserId;
  }

  public String getEmail() {
    return email;
  }

  public String getFirstName() {
    return firstName;
  }

  public String getLastName() {
    return lastName;
  }

  public String getOrgRole() {
    return orgRole;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
