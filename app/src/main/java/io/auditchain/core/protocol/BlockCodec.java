package io.auditchain.core.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;

/**
 * Stored block row: a JSON object with index, timestamp, previous_hash, nonce, hash and
 * serialized_transactions (the exact string that was hashed).
 */
public final class BlockCodec {
    private BlockCodec() {}

    public static byte[] toBytes(Block block) {
        ObjectNode row = EventCodec.mapper().createObjectNode();
        row.put("index", block.index());
        row.put("timestamp", block.timestamp());
        row.put("previous_hash", block.previousHash());
        row.put("nonce", block.nonce());
        row.put("hash", block.hash());
        row.put("serialized_transactions", block.serializedTransactions());
        try {
            return EventCodec.mapper().writeValueAsBytes(row);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode block " + block.index(), e);
        }
    }

    public static Block fromBytes(byte[] bytes) {
        try {
            JsonNode row = EventCodec.mapper().readTree(bytes);
            return new Block(
                    required(row, "index").asLong(),
                    required(row, "timestamp").asLong(),
                    required(row, "serialized_transactions").asText(),
                    required(row, "previous_hash").asText(),
                    required(row, "nonce").asLong(),
                    required(row, "hash").asText()
            );
        } catch (IOException | RuntimeException ex) {
            throw new IllegalArgumentException("Malformed block bytes", ex);
        }
    }

    private static JsonNode required(JsonNode row, String field) {
        JsonNode value = row == null ? null : row.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("missing field " + field);
        }
        return value;
    }
}
