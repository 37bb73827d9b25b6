package io.b2mash.b2b.reportengine.audit;

import io.b2mash.b2b.reportengine.multitenancy.RequestScopes;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder that constructs an {@link AuditEventRecord}. Auto-populates organization, actor, source,
 * IP address and user agent from the current request context when available.
 *
 * <p>Usage:
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("report.created")
 *     .entityType("saved_report")
 *     .entityId(report.getId())
 *     .details(Map.of("name", report.getName()))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private static final int MAX_USER_AGENT_LENGTH = 500;

  private String eventType;
  private String entityType;
  private UUID entityId;
  private String organizationId;
  private UUID actorId;
  private String actorType;
  private String source;
  private Map<String, Object> details;

  private boolean organizationIdExplicitlySet;
  private boolean actorIdExplicitlySet;
  private boolean actorTypeExplicitlySet;
  private boolean sourceExplicitlySet;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder organizationId(String organizationId) {
    this.organizationId = organizationId;
    this.organizationIdExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder actorId(UUID actorId) {
    this.actorId = actorId;
    this.actorIdExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder actorType(String actorType) {
    this.actorType = actorType;
    this.actorTypeExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder source(String source) {
    this.source = source;
    this.sourceExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  /**
   * Builds the {@link AuditEventRecord}, auto-populating fields not explicitly set:
   *
   * <ul>
   *   <li>{@code organizationId} from {@link RequestScopes#getOrgIdOrNull()}
   *   <li>{@code actorId} from {@link RequestScopes#getMemberIdOrNull()}
   *   <li>{@code actorType} = "USER" if a member is bound, "SYSTEM" otherwise
   *   <li>{@code source} = "API" inside an HTTP request, "INTERNAL" otherwise
   *   <li>{@code ipAddress} and {@code userAgent} from the HTTP request
   * </ul>
   */
  public AuditEventRecord build() {
    String resolvedOrgId =
        organizationIdExplicitlySet ? this.organizationId : RequestScopes.getOrgIdOrNull();

    UUID boundMemberId = RequestScopes.getMemberIdOrNull();
    UUID resolvedActorId = actorIdExplicitlySet ? this.actorId : boundMemberId;

    String resolvedActorType = this.actorType;
    if (!actorTypeExplicitlySet) {
      resolvedActorType = boundMemberId != null ? "USER" : "SYSTEM";
    }

    HttpServletRequest request = resolveHttpRequest();

    String resolvedSource = this.source;
    if (!sourceExplicitlySet) {
      resolvedSource = request != null ? "API" : "INTERNAL";
    }

    String resolvedIpAddress = null;
    String resolvedUserAgent = null;
    if (request != null) {
      resolvedIpAddress = request.getRemoteAddr();
      String ua = request.getHeader("User-Agent");
      if (ua != null && ua.length() > MAX_USER_AGENT_LENGTH) {
        ua = ua.substring(0, MAX_USER_AGENT_LENGTH);
      }
      resolvedUserAgent = ua;
    }

    return new AuditEventRecord(
        eventType,
        entityType,
        entityId,
        resolvedOrgId,
        resolvedActorId,
        resolvedActorType,
        resolvedSource,
        resolvedIpAddress,
        resolvedUserAgent,
        details);
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
