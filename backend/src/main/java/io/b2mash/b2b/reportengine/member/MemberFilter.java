package io.b2mash.b2b.reportengine.member;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.b2b.reportengine.multitenancy.RequestScopes;
import io.b2mash.b2b.reportengine.security.JwtClaims;
import io.b2mash.b2b.reportengine.security.Roles;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the acting member for the bound organization and binds member id and role. Unknown users
 * are created on first sight.
 */
@Component
public class MemberFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(MemberFilter.class);

  private final MemberRepository memberRepository;
  private final Cache<String, UUID> memberCache =
      Caffeine.newBuilder().maximumSize(50_000).expireAfterWrite(Duration.ofHours(1)).build();

  public MemberFilter(MemberRepository memberRepository) {
    this.memberRepository = memberRepository;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String orgId = RequestScopes.getOrgIdOrNull();

    if (orgId != null) {
      MemberInfo info = resolveMember(orgId);
      if (info != null) {
        try (var ignored = RequestScopes.bindMember(info.memberId(), info.orgRole())) {
          filterChain.doFilter(request, response);
        }
        return;
      }
    }

    // No organization or member resolution failed: continue unbound
    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return path.startsWith("/internal/") || path.startsWith("/actuator/");
  }

  private record MemberInfo(UUID memberId, String orgRole) {}

  private MemberInfo resolveMember(String orgId) {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (!(authentication instanceof JwtAuthenticationToken jwtAuth)) {
      return null;
    }

    Jwt jwt = jwtAuth.getToken();
    String externalUserId = jwt.getSubject();
    String claimedRole = JwtClaims.extractOrgRole(jwt);
    String orgRole =
        claimedRole != null ? claimedRole.toUpperCase(Locale.ROOT) : Roles.EMPLOYEE;

    if (externalUserId == null) {
      return null;
    }

    String cacheKey = orgId + ":" + externalUserId;
    UUID memberId;
    try {
      memberId =
          memberCache.get(cacheKey, k -> resolveOrCreateMember(orgId, externalUserId, orgRole));
    } catch (RuntimeException e) {
      log.warn(
          "Failed to resolve/create member for user {} in org {}: {}",
          externalUserId,
          orgId,
          e.getMessage());
      return null;
    }

    return new MemberInfo(memberId, orgRole);
  }

  private UUID resolveOrCreateMember(String orgId, String externalUserId, String orgRole) {
    return memberRepository
        .findByOrganizationIdAndExternalUserId(orgId, externalUserId)
        .map(Member::getId)
        .orElseGet(() -> lazyCreateMember(orgId, externalUserId, orgRole));
  }

  private UUID lazyCreateMember(String orgId, String externalUserId, String orgRole) {
    try {
      var member =
          new Member(
              orgId, externalUserId, externalUserId + "@placeholder.internal", null, null, orgRole);
      member = memberRepository.save(member);
      log.info(
          "Lazy-created member: id={}, externalUserId={}, orgId={}",
          member.getId(),
          externalUserId,
          orgId);
      return member.getId();
    } catch (DataIntegrityViolationException e) {
      // Race: another request already created this member
      return memberRepository
          .findByOrganizationIdAndExternalUserId(orgId, externalUserId)
          .map(Member::getId)
          .orElseThrow(
              () ->
                  new IllegalStateException(
                      "Member not found after constraint violation for: " + externalUserId));
    }
  }
}
