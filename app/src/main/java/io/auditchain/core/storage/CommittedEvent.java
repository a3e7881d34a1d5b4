package io.auditchain.core.storage;

import io.auditchain.core.event.AuditEvent;

/** An event together with where it was committed. */
public record CommittedEvent(long blockIndex, int position, String blockHash, AuditEvent event) {

    public EventPosition location() {
        return new EventPosition(blockIndex, position);
    }
}
