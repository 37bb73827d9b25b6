package io.b2mash.b2b.reportengine.audit;

/** Records audit events for report and schedule lifecycle changes. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back (no REQUIRES_NEW).
   *
   * @param record the audit event data to persist
   */
  void log(AuditEventRecord record);
}
