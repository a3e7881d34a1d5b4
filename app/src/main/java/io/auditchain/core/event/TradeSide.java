package io.auditchain.core.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import io.auditchain.core.error.InvalidEventException;

import java.util.Locale;

public enum TradeSide {
    BUY,
    SELL;

    @JsonCreator
    public static TradeSide parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidEventException("side", "must be BUY or SELL, got '" + value + "'");
        }
    }
}
