package io.auditchain.core.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.auditchain.core.event.AuditEvent;
import io.auditchain.core.event.ConfigChangePayload;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Masks credential-like values in events on their way out of the ledger (queries, reports,
 * pending listings, exports). Stored blocks are never touched, so hashes keep verifying.
 *
 * A field is sensitive when its name, lower-cased with '-' read as '_', ends with one of the
 * configured keys: with the defaults {@code db_password}, {@code apiKey} and {@code refresh-token}
 * all match. For config changes the key being changed is checked too, and old/new values that
 * hold a JSON object or array are masked field by field.
 */
public final class SensitiveDataMasker {

    public static final String MASK = "********";

    public static final Set<String> DEFAULT_KEYS = Collections.unmodifiableSet(new LinkedHashSet<>(List.of(
            "password", "passwd", "secret", "token", "api_key", "apikey", "private_key", "credentials")));

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Set<String> keys;

    public SensitiveDataMasker(Collection<String> keys) {
        Set<String> normalized = new LinkedHashSet<>();
        if (keys != null) {
            for (String key : keys) {
                if (key != null && !key.isBlank()) {
                    normalized.add(normalize(key));
                }
            }
        }
        this.keys = Collections.unmodifiableSet(normalized);
    }

    public static SensitiveDataMasker defaults() {
        return new SensitiveDataMasker(DEFAULT_KEYS);
    }

    public Set<String> keys() {
        return keys;
    }

    public boolean isSensitive(String fieldName) {
        if (fieldName == null || keys.isEmpty()) return false;
        String name = normalize(fieldName);
        for (String key : keys) {
            if (name.endsWith(key)) return true;
        }
        return false;
    }

    /** The event itself when nothing needed masking, otherwise a masked copy. */
    public AuditEvent redact(AuditEvent event) {
        if (keys.isEmpty() || !(event.payload() instanceof ConfigChangePayload change)) {
            return event;
        }
        ConfigChangePayload masked = redact(change);
        return masked == change ? event : new AuditEvent(event.id(), event.kind(), event.createdAt(), masked);
    }

    public List<AuditEvent> redactAll(List<AuditEvent> events) {
        List<AuditEvent> out = new ArrayList<>(events.size());
        for (AuditEvent event : events) {
            out.add(redact(event));
        }
        return out;
    }

    /**
     * Masks sensitive fields of a JSON tree in place, at any depth.
     *
     * @return true if anything was replaced
     */
    public boolean maskTree(JsonNode node) {
        boolean changed = false;
        if (node instanceof ObjectNode obj) {
            List<String> names = new ArrayList<>();
            obj.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                JsonNode child = obj.get(name);
                if (isSensitive(name)) {
                    if (!child.isNull() && !MASK.equals(child.asText(null))) {
                        obj.put(name, MASK);
                        changed = true;
                    }
                } else if (child.isContainerNode()) {
                    changed |= maskTree(child);
                }
            }
        } else if (node instanceof ArrayNode array) {
            for (JsonNode element : array) {
                changed |= maskTree(element);
            }
        }
        return changed;
    }

    private ConfigChangePayload redact(ConfigChangePayload change) {
        if (isSensitive(change.key())) {
            return new ConfigChangePayload(change.component(), change.key(),
                    change.oldValue() == null ? null : MASK,
                    change.newValue() == null ? null : MASK,
                    change.changedBy());
        }
        String oldValue = maskEmbedded(change.oldValue());
        String newValue = maskEmbedded(change.newValue());
        if (oldValue == change.oldValue() && newValue == change.newValue()) {
            return change;
        }
        return new ConfigChangePayload(change.component(), change.key(), oldValue, newValue, change.changedBy());
    }

    private String maskEmbedded(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        if (!trimmed.startsWith("{") && !trimmed.startsWith("[")) return value;
        try {
            JsonNode tree = MAPPER.readTree(trimmed);
            return maskTree(tree) ? MAPPER.writeValueAsString(tree) : value;
        } catch (JsonProcessingException e) {
            // plain text that only looks like JSON
            return value;
        }
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }
}
