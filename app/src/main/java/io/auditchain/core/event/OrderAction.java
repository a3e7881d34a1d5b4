package io.auditchain.core.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import io.auditchain.core.error.InvalidEventException;

import java.util.Locale;

/** Lifecycle step of an order that is being audited. */
public enum OrderAction {
    PLACED,
    CANCELLED,
    FILLED,
    REJECTED;

    @JsonCreator
    public static OrderAction parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidEventException("action", "unknown order action '" + value + "'");
        }
    }
}
