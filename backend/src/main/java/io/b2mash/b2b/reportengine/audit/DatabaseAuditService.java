package io.b2mash.b2b.reportengine.audit;

import io.b2mash.b2b.reportengine.member.MemberNameResolver;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Database-backed implementation of {@link AuditService}.
 *
 * <p>Transaction semantics: {@code log()} participates in the caller's transaction. If the report
 * operation rolls back, the audit event rolls back too.
 */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditEventRepository auditEventRepository;
  private final MemberNameResolver memberNameResolver;

  public DatabaseAuditService(
      AuditEventRepository auditEventRepository, MemberNameResolver memberNameResolver) {
    this.auditEventRepository = auditEventRepository;
    this.memberNameResolver = memberNameResolver;
  }

  @Override
  @Transactional
  public void log(AuditEventRecord record) {
    var event = new AuditEvent(enrichActorName(record));
    auditEventRepository.save(event);
    log.debug(
        "Recorded audit event: type={}, entity={}/{}, actor={}",
        record.eventType(),
        record.entityType(),
        record.entityId(),
        record.actorId());
  }

  /**
   * Ensures {@code actor_name} is present in the details. A caller-provided value is kept; USER
   * actors are resolved by member id, everything else is "System".
   */
  private AuditEventRecord enrichActorName(AuditEventRecord record) {
    var details =
        new HashMap<String, Object>(record.details() != null ? record.details() : Map.of());
    if (!details.containsKey("actor_name")) {
      String name = null;
      if (record.actorId() != null && "USER".equals(record.actorType())) {
        name = memberNameResolver.resolveNameOrNull(record.actorId());
      }
      details.put("actor_name", name != null ? name : "System");
    }
    return new AuditEventRecord(
        record.eventType(),
        record.entityType(),
        record.entityId(),
        record.organizationId(),
        record.actorId(),
        record.actorType(),
        record.source(),
        record.ipAddress(),
        record.userAgent(),
        details);
  }
}
