package io.auditchain.core.storage;

import io.auditchain.core.event.AuditEvent;
import io.auditchain.core.event.EventKind;
import io.auditchain.core.protocol.Block;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable home of the ledger: the pending pool and the committed chain live side by side so a
 * block commit and the removal of its events from the pool happen in one transaction.
 *
 * Notes:
 * - Blocks are keyed by index; the tip is the highest committed index.
 * - Committed event ids are remembered forever (also after pruning) for dedup.
 * - Read methods never wait on mining; they only see fully committed blocks.
 */
public interface ChainStore extends AutoCloseable {

    // -------------- pending pool ----------------

    /**
     * Durably queue an event.
     *
     * @return false if an event with the same id is already pending or committed
     * @throws io.auditchain.core.error.QueueWriteException if the write fails
     */
    boolean appendPending(AuditEvent event);

    /** Oldest-first snapshot of up to {@code limit} pending events. Does not modify the pool. */
    List<AuditEvent> peekPending(int limit);

    long pendingCount();

    /** True if the id is pending or was ever committed. */
    boolean containsEvent(String eventId);

    // -------------- chain ----------------

    /**
     * Atomically persist the block, advance the tip and drop the block's events from the pool.
     * Index 0 is accepted only on an empty store.
     *
     * @throws io.auditchain.core.error.ChainLinkException if the block does not extend the tip
     * @throws io.auditchain.core.error.PersistenceException if the write fails; nothing is applied
     */
    void append(Block block);

    Optional<Block> getBlock(long index);

    Optional<Block> getBlockByHash(String hash);

    Optional<Block> getTip();

    /** Index of the oldest retained block (0 until something is pruned). */
    long firstIndex();

    Optional<Checkpoint> getCheckpoint();

    /**
     * Blocks with {@code start <= index < endExclusive}, in index order, fetched lazily.
     * Each call to {@code iterator()} starts over.
     */
    Iterable<Block> iterate(long start, long endExclusive);

    /**
     * Committed events strictly after {@code after} (or from the start when null), in
     * (block index, position) order, restricted by {@code filter}. Lazy.
     */
    Iterator<CommittedEvent> eventsAfter(EventPosition after, EventFilter filter);

    /** Retained transaction counts per kind. */
    Map<EventKind, Long> kindCounts();

    long approximateSizeBytes();

    /**
     * Drop every retained block up to and including {@code lastIndex} and record a checkpoint at
     * {@code lastIndex + 1}. The tip can never be pruned.
     */
    PruneResult pruneThrough(long lastIndex);

    /** Number of retained blocks. */
    default long blockCount() {
        return getTip().map(tip -> tip.index() - firstIndex() + 1).orElse(0L);
    }

    @Override
    void close();
}
