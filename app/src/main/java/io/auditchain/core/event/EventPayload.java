package io.auditchain.core.event;

/**
 * Variant-specific body of an audit event. Implementations validate their
 * required fields when constructed.
 */
public interface EventPayload {

    EventKind kind();
}
