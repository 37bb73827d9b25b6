package io.b2mash.b2b.reportengine.security;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

@Component
public class ReportingJwtAuthenticationConverter
    implements Converter<Jwt, AbstractAuthenticationToken> {

  private static final Set<String> KNOWN_ROLES =
      Set.of(
          Roles.SYSTEM_ADMIN,
          Roles.CCO,
          Roles.COMPLIANCE_OFFICER,
          Roles.POLICY_AUTHOR,
          Roles.TRIAGE_LEAD,
          Roles.INVESTIGATOR,
          Roles.HR_PARTNER,
          Roles.LEGAL_COUNSEL,
          Roles.DEPARTMENT_ADMIN,
          Roles.MANAGER,
          Roles.READ_ONLY,
          Roles.EMPLOYEE,
          Roles.OPERATOR);

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    Collection<GrantedAuthority> authorities = extractAuthorities(jwt);
    return new JwtAuthenticationToken(jwt, authorities, jwt.getSubject());
  }

  private Collection<GrantedAuthority> extractAuthorities(Jwt jwt) {
    String orgRole = JwtClaims.extractOrgRole(jwt);
    if (orgRole == null) {
      return List.of();
    }
    String normalized = orgRole.toUpperCase(Locale.ROOT);
    if (!KNOWN_ROLES.contains(normalized)) {
      return List.of();
    }
    return List.of(new SimpleGrantedAuthority(Roles.AUTHORITY_PREFIX + normalized));
  }
}
