package io.b2mash.b2b.reportengine.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}, which fills in organization, actor and request metadata.
 *
 * @param eventType event type following the {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g. "saved_report")
 * @param entityId id of the affected entity (not a FK, the entity may be deleted later)
 * @param organizationId tenant the event belongs to; null for events outside any tenant
 * @param actorId member id of the acting user; null for system-initiated events
 * @param actorType USER or SYSTEM
 * @param source origin of the action: API or INTERNAL
 * @param ipAddress client IP; null for non-HTTP sources
 * @param userAgent truncated User-Agent header; null for non-HTTP sources
 * @param details event payload stored as JSONB; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    String organizationId,
    UUID actorId,
    String actorType,
    String source,
    String ipAddress,
    String userAgent,
    Map<String, Object> details) {}
