package io.auditchain.core.pool;

import io.auditchain.core.error.InvalidEventException;
import io.auditchain.core.error.QueueWriteException;
import io.auditchain.core.event.AuditEvent;
import io.auditchain.core.metrics.LedgerMetrics;
import io.auditchain.core.storage.ChainStore;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Front door for new events: validates, then appends durably to the store's pending queue.
 * Never waits on mining; the only shared state is the store itself.
 */
public final class PendingPool {
    private static final Logger LOG = Logger.getLogger(PendingPool.class.getName());

    private final ChainStore store;
    private final EventValidator validator;

    public PendingPool(ChainStore store, EventValidator validator) {
        if (store == null) throw new IllegalArgumentException("store");
        this.store = store;
        this.validator = validator == null ? new EventValidator() : validator;
    }

    /**
     * @return true if newly queued, false if the id is already pending or committed
     * @throws InvalidEventException if the event fails validation (nothing is queued)
     * @throws QueueWriteException if the durable append fails; safe to retry
     */
    public boolean record(AuditEvent event) {
        try {
            validator.validate(event);
        } catch (InvalidEventException e) {
            LedgerMetrics.eventRejected(e.getField() == null ? "event" : e.getField());
            LOG.fine(() -> "Rejected event: " + e.getMessage());
            throw e;
        }
        boolean added;
        try {
            added = store.appendPending(event);
        } catch (QueueWriteException e) {
            LOG.log(Level.WARNING, "Durable append failed for event " + event.id(), e);
            throw e;
        }
        if (added) {
            LedgerMetrics.eventRecorded(event.kind());
            LOG.finer(() -> "Queued " + event.kind() + " event " + event.id());
        } else {
            LedgerMetrics.eventDuplicate();
            LOG.fine(() -> "Duplicate event id " + event.id() + " ignored");
        }
        return added;
    }

    public List<AuditEvent> peek(int limit) {
        return store.peekPending(limit);
    }

    public long size() {
        return store.pendingCount();
    }

    public boolean contains(String eventId) {
        return store.containsEvent(eventId);
    }

    public EventValidator validator() {
        return validator;
    }
}
