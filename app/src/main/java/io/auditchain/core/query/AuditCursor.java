package io.auditchain.core.query;

import io.auditchain.core.storage.EventPosition;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Opaque pagination token: URL-safe Base64 (no padding) of {@code v1:<block>:<position>}, naming
 * the last entry already returned.
 */
public final class AuditCursor {
    private static final String VERSION = "v1";

    private AuditCursor() {}

    public static String encode(EventPosition position) {
        String raw = VERSION + ":" + position.blockIndex() + ":" + position.position();
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    /** @throws IllegalArgumentException if the token was not produced by {@link #encode} */
    public static EventPosition decode(String cursor) {
        if (cursor == null || cursor.isBlank()) {
            throw new IllegalArgumentException("Cursor is empty");
        }
        String raw;
        try {
            raw = new String(Base64.getUrlDecoder().decode(cursor.trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed cursor", e);
        }
        String[] parts = raw.split(":");
        if (parts.length != 3 || !VERSION.equals(parts[0])) {
            throw new IllegalArgumentException("Malformed cursor");
        }
        try {
            return new EventPosition(Long.parseLong(parts[1]), Integer.parseInt(parts[2]));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed cursor", e);
        }
    }
}
