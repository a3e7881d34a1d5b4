package io.auditchain.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.auditchain.core.error.InvalidEventException;
import io.auditchain.core.event.AuditEvent;
import io.auditchain.core.event.EventKind;
import io.auditchain.core.event.EventPayload;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical JSON encoding of events. Keys are sorted and decimals written plain, so the
 * same event list always serializes to the same string (this string is what gets hashed).
 */
public final class EventCodec {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .disable(MapperFeature.SORT_CREATOR_PROPERTIES_FIRST)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .build();

    private EventCodec() {}

    public static ObjectMapper mapper() {
        return CANONICAL;
    }

    public static String toJson(AuditEvent event) {
        try {
            return CANONICAL.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode event " + event.id(), e);
        }
    }

    public static byte[] toBytes(AuditEvent event) {
        return toJson(event).getBytes(StandardCharsets.UTF_8);
    }

    public static String serializeAll(List<AuditEvent> events) {
        try {
            return CANONICAL.writeValueAsString(events);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode transactions", e);
        }
    }

    public static AuditEvent fromBytes(byte[] bytes) {
        try {
            return fromTree(CANONICAL.readTree(bytes));
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed event bytes", e);
        }
    }

    public static List<AuditEvent> parseAll(String serializedTransactions) {
        JsonNode root;
        try {
            root = CANONICAL.readTree(serializedTransactions);
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed transaction list", e);
        }
        if (!(root instanceof ArrayNode array)) {
            throw new IllegalArgumentException("Transaction list must be a JSON array");
        }
        List<AuditEvent> out = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            out.add(fromTree(node));
        }
        return out;
    }

    /**
     * Decode one event object. The payload type is picked from the "kind" field.
     * Validation failures inside the payload surface as {@link InvalidEventException}.
     */
    public static AuditEvent fromTree(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new InvalidEventException(null, "event must be a JSON object");
        }
        EventKind kind = EventKind.parse(node.path("kind").asText(null));
        JsonNode payloadNode = node.get("payload");
        if (payloadNode == null || !payloadNode.isObject()) {
            throw new InvalidEventException("payload", "is required");
        }
        EventPayload payload = readPayload(payloadNode, kind);
        String id = node.path("id").asText(null);
        long createdAt = node.path("created_at").asLong(0L);
        return new AuditEvent(id, kind, createdAt, payload);
    }

    public static EventPayload readPayload(JsonNode payloadNode, EventKind kind) {
        try {
            return CANONICAL.treeToValue(payloadNode, kind.payloadType());
        } catch (JsonProcessingException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InvalidEventException invalid) {
                throw invalid;
            }
            throw new InvalidEventException("payload", "cannot be read as " + kind.wireName() + ": " + e.getOriginalMessage());
        }
    }
}
