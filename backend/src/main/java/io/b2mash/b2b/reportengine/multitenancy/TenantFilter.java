package io.b2mash.b2b.reportengine.multitenancy;

import io.b2mash.b2b.reportengine.security.JwtClaims;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the organization from the {@code org_id} JWT claim. Every repository query is keyed by this
 * value, so an unbound request cannot reach tenant data.
 */
@Component
public class TenantFilter extends OncePerRequestFilter {

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

    if (authentication instanceof JwtAuthenticationToken jwtAuth) {
      String orgId = JwtClaims.extractOrgId(jwtAuth.getToken());
      if (orgId != null && !orgId.isBlank()) {
        try (var ignored = RequestScopes.bindOrganization(orgId)) {
          filterChain.doFilter(request, response);
        }
        return;
      }
    }

    // No JWT or no org claim: continue unbound, services reject with 401
    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return path.startsWith("/internal/") || path.startsWith("/actuator/");
  }
}
