package io.b2mash.b2b.reportengine.security;

import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Reads the tenancy claims carried by access tokens.
 *
 * <p>Format: {@code { "sub": "user_xxx", "org_id": "org_xxx", "org_role": "COMPLIANCE_OFFICER" }}
 */
public final class JwtClaims {

  static final String ORG_ID_CLAIM = "org_id";
  static final String ORG_ROLE_CLAIM = "org_role";

  public static String extractOrgId(Jwt jwt) {
    return extractString(jwt, ORG_ID_CLAIM);
  }

  public static String extractOrgRole(Jwt jwt) {
    return extractString(jwt, ORG_ROLE_CLAIM);
  }

  private static String extractString(Jwt jwt, String claim) {
    Object value = jwt.getClaim(claim);
    return value instanceof String str ? str : null;
  }

  private JwtClaims() {}
}
