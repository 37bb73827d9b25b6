package io.b2mash.b2b.reportengine.multitenancy;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final String MDC_REQUEST_ID = "requestId";
  private static final String MDC_ORG_ID = "orgId";
  private static final String MDC_USER_ID = "userId";
  private static final String MDC_MEMBER_ID = "memberId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      String orgId = RequestScopes.getOrgIdOrNull();
      if (orgId != null) {
        MDC.put(MDC_ORG_ID, orgId);
      }

      Authentication auth = SecurityContextHolder.getContext().getAuthentication();
      if (auth instanceof JwtAuthenticationToken jwtAuth) {
        MDC.put(MDC_USER_ID, jwtAuth.getToken().getSubject());
      }

      UUID memberId = RequestScopes.getMemberIdOrNull();
      if (memberId != null) {
        MDC.put(MDC_MEMBER_ID, memberId.toString());
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_ORG_ID);
      MDC.remove(MDC_USER_ID);
      MDC.remove(MDC_MEMBER_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}
