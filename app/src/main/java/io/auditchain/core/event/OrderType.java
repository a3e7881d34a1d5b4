package io.auditchain.core.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import io.auditchain.core.error.InvalidEventException;

import java.util.Locale;

public enum OrderType {
    MARKET,
    LIMIT,
    STOP,
    STOP_LIMIT;

    /** True for order types that cannot be placed without a limit price. */
    public boolean needsLimitPrice() {
        return this == LIMIT || this == STOP_LIMIT;
    }

    @JsonCreator
    public static OrderType parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new InvalidEventException("order_type", "unknown order type '" + value + "'");
        }
    }
}
