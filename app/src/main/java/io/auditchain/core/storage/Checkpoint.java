package io.auditchain.core.storage;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Verification anchor left behind by pruning: index and hash of the oldest retained block.
 */
public record Checkpoint(
        @JsonProperty("index") long index,
        @JsonProperty("hash") String hash,
        @JsonProperty("created_at") long createdAt
) {
}
