package io.auditchain.core.query;

import io.auditchain.core.event.EventKind;

/**
 * Audit trail request. Kind and the created_at bounds (epoch millis, inclusive) are optional;
 * limit is clamped to 1..{@value #MAX_LIMIT}.
 */
public record AuditQuery(EventKind kind, Long startTime, Long endTime, int limit, String cursor) {
    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    public AuditQuery {
        if (startTime != null && endTime != null && startTime > endTime) {
            throw new IllegalArgumentException("startTime must not be after endTime");
        }
        limit = Math.max(1, Math.min(MAX_LIMIT, limit));
        if (cursor != null && cursor.isBlank()) cursor = null;
    }

    public static AuditQuery all(int limit) {
        return new AuditQuery(null, null, null, limit, null);
    }

    public static AuditQuery ofKind(EventKind kind, int limit) {
        return new AuditQuery(kind, null, null, limit, null);
    }

    public AuditQuery withCursor(String next) {
        return new AuditQuery(kind, startTime, endTime, limit, next);
    }
}
