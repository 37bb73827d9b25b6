package io.b2mash.b2b.reportengine.security;

/**
 * Role constants used across authentication and authorization.
 *
 * <p>Org roles come from the {@code org_role} JWT claim. Spring authorities are the {@code ROLE_}
 * prefixed versions used by {@code @PreAuthorize}.
 */
public final class Roles {

  public static final String SYSTEM_ADMIN = "SYSTEM_ADMIN";
  public static final String CCO = "CCO";
  public static final String COMPLIANCE_OFFICER = "COMPLIANCE_OFFICER";
  public static final String POLICY_AUTHOR = "POLICY_AUTHOR";
  public static final String TRIAGE_LEAD = "TRIAGE_LEAD";
  public static final String INVESTIGATOR = "INVESTIGATOR";
  public static final String HR_PARTNER = "HR_PARTNER";
  public static final String LEGAL_COUNSEL = "LEGAL_COUNSEL";
  public static final String DEPARTMENT_ADMIN = "DEPARTMENT_ADMIN";
  public static final String MANAGER = "MANAGER";
  public static final String READ_ONLY = "READ_ONLY";
  public static final String EMPLOYEE = "EMPLOYEE";
  public static final String OPERATOR = "OPERATOR";

  public static final String AUTHORITY_PREFIX = "ROLE_";
  public static final String AUTHORITY_INTERNAL = "ROLE_INTERNAL_SERVICE";

  private Roles() {}
}
