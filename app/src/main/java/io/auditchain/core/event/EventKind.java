package io.auditchain.core.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.auditchain.core.error.InvalidEventException;

import java.util.Locale;

/** The five kinds of audit event, each bound to its payload type. */
public enum EventKind {
    TRADE("trade", TradePayload.class),
    ORDER("order", OrderPayload.class),
    SYSTEM_CHANGE("system_change", SystemChangePayload.class),
    LOGIN("login", LoginPayload.class),
    CONFIG_CHANGE("config_change", ConfigChangePayload.class);

    private final String wireName;
    private final Class<? extends EventPayload> payloadType;

    EventKind(String wireName, Class<? extends EventPayload> payloadType) {
        this.wireName = wireName;
        this.payloadType = payloadType;
    }

    @JsonValue
    public String wireName() { return wireName; }

    public Class<? extends EventPayload> payloadType() { return payloadType; }

    /** Accepts both the wire name ("system_change") and the enum name ("SYSTEM_CHANGE"). */
    @JsonCreator
    public static EventKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidEventException("kind", "is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (EventKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return kind;
            }
        }
        throw new InvalidEventException("kind", "unknown event kind '" + value + "'");
    }
}
