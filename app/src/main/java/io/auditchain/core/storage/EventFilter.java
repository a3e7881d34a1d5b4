package io.auditchain.core.storage;

import io.auditchain.core.event.AuditEvent;
import io.auditchain.core.event.EventKind;

/**
 * Optional kind and created_at bounds (epoch millis, both inclusive). Null means unbounded.
 */
public record EventFilter(EventKind kind, Long fromMillis, Long toMillis) {

    public static final EventFilter ALL = new EventFilter(null, null, null);

    public boolean matchesTime(long createdAt) {
        if (fromMillis != null && createdAt < fromMillis) return false;
        return toMillis == null || createdAt <= toMillis;
    }

    /** True when some created_at within [min, max] could match. */
    public boolean overlaps(long minCreatedAt, long maxCreatedAt) {
        if (fromMillis != null && maxCreatedAt < fromMillis) return false;
        return toMillis == null || minCreatedAt <= toMillis;
    }

    public boolean matches(AuditEvent event) {
        return (kind == null || event.kind() == kind) && matchesTime(event.createdAt());
    }
}
