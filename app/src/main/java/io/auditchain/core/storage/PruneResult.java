package io.auditchain.core.storage;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PruneResult(
        @JsonProperty("removed_blocks") long removedBlocks,
        @JsonProperty("removed_events") long removedEvents,
        @JsonProperty("checkpoint") Checkpoint checkpoint
) {
    public static PruneResult none(Checkpoint existing) {
        return new PruneResult(0, 0, existing);
    }
}
