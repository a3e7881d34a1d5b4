package io.auditchain.core.pool;

import io.auditchain.core.error.InvalidEventException;
import io.auditchain.core.event.AuditEvent;
import io.auditchain.core.event.EventKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * Pool-level checks on top of the construction-time payload validation: the kind must be
 * enabled and the event must not claim to come from the future.
 */
public class EventValidator {
    public static final String KIND_DISABLED = "kind_disabled";
    public static final long DEFAULT_MAX_FUTURE_SKEW_MILLIS = 5 * 60 * 1000L;

    private final Set<EventKind> enabledKinds;
    private final long maxFutureSkewMillis;

    public EventValidator(Set<EventKind> enabledKinds, long maxFutureSkewMillis) {
        this.enabledKinds = enabledKinds == null || enabledKinds.isEmpty()
                ? EnumSet.allOf(EventKind.class)
                : EnumSet.copyOf(enabledKinds);
        this.maxFutureSkewMillis = maxFutureSkewMillis;
    }

    public EventValidator() {
        this(EnumSet.allOf(EventKind.class), DEFAULT_MAX_FUTURE_SKEW_MILLIS);
    }

    public void validate(AuditEvent event) {
        validate(event, System.currentTimeMillis());
    }

    public void validate(AuditEvent event, long nowMillis) {
        if (event == null) {
            throw new InvalidEventException(null, "Event required");
        }
        if (!enabledKinds.contains(event.kind())) {
            throw new InvalidEventException("kind", KIND_DISABLED + ": " + event.kind().wireName() + " is not recorded");
        }
        if (event.createdAt() > nowMillis + maxFutureSkewMillis) {
            throw new InvalidEventException("created_at", "is more than " + maxFutureSkewMillis / 1000 + "s in the future");
        }
    }

    public Set<EventKind> enabledKinds() {
        return EnumSet.copyOf(enabledKinds);
    }
}
