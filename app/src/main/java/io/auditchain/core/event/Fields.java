package io.auditchain.core.event;

import io.auditchain.core.error.InvalidEventException;

import java.math.BigDecimal;

/** Required-field checks shared by the payload records. */
final class Fields {
    private Fields() {}

    static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidEventException(field, "is required");
        }
        return value.trim();
    }

    static String optionalText(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    static <T> T requireValue(T value, String field) {
        if (value == null) {
            throw new InvalidEventException(field, "is required");
        }
        return value;
    }

    static BigDecimal requirePositive(BigDecimal value, String field) {
        requireValue(value, field);
        if (value.signum() <= 0) {
            throw new InvalidEventException(field, "must be > 0");
        }
        return value;
    }

    static BigDecimal optionalPositive(BigDecimal value, String field) {
        if (value != null && value.signum() <= 0) {
            throw new InvalidEventException(field, "must be > 0");
        }
        return value;
    }
}
