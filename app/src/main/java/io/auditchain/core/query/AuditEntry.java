package io.auditchain.core.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.auditchain.core.event.AuditEvent;
import io.auditchain.core.storage.CommittedEvent;

public record AuditEntry(
        @JsonProperty("block_index") long blockIndex,
        @JsonProperty("position") int position,
        @JsonProperty("block_hash") String blockHash,
        @JsonProperty("event") AuditEvent event
) {
    public static AuditEntry from(CommittedEvent committed, SensitiveDataMasker masker) {
        return new AuditEntry(committed.blockIndex(), committed.position(), committed.blockHash(),
                masker.redact(committed.event()));
    }
}
