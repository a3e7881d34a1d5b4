package io.auditchain.core.query;

import java.util.Locale;

public enum ExportFormat {
    JSON("application/json"),
    CSV("text/csv");

    private final String contentType;

    ExportFormat(String contentType) {
        this.contentType = contentType;
    }

    public String contentType() {
        return contentType;
    }

    public static ExportFormat parse(String value) {
        if (value == null || value.isBlank()) return JSON;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown export format '" + value + "' (expected json or csv)", e);
        }
    }
}
