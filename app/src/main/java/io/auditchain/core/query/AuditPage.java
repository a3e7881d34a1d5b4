package io.auditchain.core.query;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** One page of the audit trail; {@code nextCursor} is null when nothing more matched. */
public record AuditPage(
        @JsonProperty("entries") List<AuditEntry> entries,
        @JsonProperty("next_cursor") String nextCursor
) {
    public AuditPage {
        entries = List.copyOf(entries);
    }

    public boolean hasMore() {
        return nextCursor != null;
    }
}
