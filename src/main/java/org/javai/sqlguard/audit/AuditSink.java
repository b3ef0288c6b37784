package org.javai.sqlguard.audit;

/**
 * Destination for audit records. Implementations may throw; {@link AuditTrail} keeps such
 * failures away from the request path.
 */
@FunctionalInterface
public interface AuditSink {

	void record(AuditRecord record);
}
