package io.auditchain.core.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.auditchain.core.error.InvalidEventException;

import java.util.UUID;

/**
 * One immutable audit record: id, kind, typed payload and creation time (epoch millis).
 * The kind is carried explicitly so that stored JSON can be decoded without type hints.
 */
@JsonPropertyOrder(alphabetic = true)
public record AuditEvent(
        @JsonProperty("id") String id,
        @JsonProperty("kind") EventKind kind,
        @JsonProperty("created_at") long createdAt,
        @JsonProperty("payload") EventPayload payload
) {
    public static final int MAX_ID_LENGTH = 128;

    public AuditEvent {
        id = Fields.requireText(id, "id");
        if (id.length() > MAX_ID_LENGTH) {
            throw new InvalidEventException("id", "must be at most " + MAX_ID_LENGTH + " characters");
        }
        for (int i = 0; i < id.length(); i++) {
            if (Character.isISOControl(id.charAt(i))) {
                throw new InvalidEventException("id", "must not contain control characters");
            }
        }
        Fields.requireValue(kind, "kind");
        Fields.requireValue(payload, "payload");
        if (payload.kind() != kind) {
            throw new InvalidEventException("kind", "is " + kind + " but payload is " + payload.kind());
        }
        if (createdAt <= 0) {
            throw new InvalidEventException("created_at", "must be > 0");
        }
    }

    /** New event with a generated id, stamped now. */
    public static AuditEvent of(EventPayload payload) {
        return of(null, payload, System.currentTimeMillis());
    }

    /** New event; a null or blank id is replaced by a random UUID. */
    public static AuditEvent of(String id, EventPayload payload, long createdAt) {
        if (payload == null) {
            throw new InvalidEventException("payload", "is required");
        }
        String eventId = (id == null || id.isBlank()) ? UUID.randomUUID().toString() : id;
        return new AuditEvent(eventId, payload.kind(), createdAt, payload);
    }
}
