package io.auditchain.core.storage;

import io.auditchain.core.event.AuditEvent;
import io.auditchain.core.event.EventKind;
import io.auditchain.core.protocol.Block;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Test double that forwards to a real store; override single methods to inject faults. */
public class ForwardingChainStore implements ChainStore {
    protected final ChainStore delegate;

    public ForwardingChainStore(ChainStore delegate) {
        this.delegate = delegate;
    }

    @Override public boolean appendPending(AuditEvent event) { return delegate.appendPending(event); }
    @Override public List<AuditEvent> peekPending(int limit) { return delegate.peekPending(limit); }
    @Override public long pendingCount() { return delegate.pendingCount(); }
    @Override public boolean containsEvent(String eventId) { return delegate.containsEvent(eventId); }
    @Override public void append(Block block) { delegate.append(block); }
    @Override public Optional<Block> getBlock(long index) { return delegate.getBlock(index); }
    @Override public Optional<Block> getBlockByHash(String hash) { return delegate.getBlockByHash(hash); }
    @Override public Optional<Block> getTip() { return delegate.getTip(); }
    @Override public long firstIndex() { return delegate.firstIndex(); }
    @Override public Optional<Checkpoint> getCheckpoint() { return delegate.getCheckpoint(); }
    @Override public Iterable<Block> iterate(long start, long endExclusive) { return delegate.iterate(start, endExclusive); }
    @Override public Iterator<CommittedEvent> eventsAfter(EventPosition after, EventFilter filter) { return delegate.eventsAfter(after, filter); }
    @Override public Map<EventKind, Long> kindCounts() { return delegate.kindCounts(); }
    @Override public long approximateSizeBytes() { return delegate.approximateSizeBytes(); }
    @Override public PruneResult pruneThrough(long lastIndex) { return delegate.pruneThrough(lastIndex); }
    @Override public void close() { delegate.close(); }
}
