package net.maasbridge.resource.audit;

/**
 * Receives audit events. Implementations must not throw; an audit problem never changes
 * the outcome of the request being audited.
 */
@FunctionalInterface
public interface AuditSink {

    void record(AuditEvent event);
}
