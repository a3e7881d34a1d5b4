package io.auditchain.core.storage;

import io.auditchain.core.error.ChainLinkException;
import io.auditchain.core.event.AuditEvent;
import io.auditchain.core.event.EventKind;
import io.auditchain.core.protocol.Block;
import io.auditchain.core.protocol.BlockCodec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Simple, fast in-memory chain store.
 * Good for tests and short-lived ledgers; nothing survives a restart.
 *
 * Mutations are synchronized. Reads go through concurrent maps and only ever see blocks whose
 * events are already indexed, because the tip is published last.
 */
public final class InMemoryChainStore implements ChainStore {

    /** index -> Block */
    private final ConcurrentSkipListMap<Long, Block> blocks = new ConcurrentSkipListMap<>();

    /** block hash -> index */
    private final Map<String, Long> indexByHash = new ConcurrentHashMap<>();

    /** id -> event, insertion order is FIFO order */
    private final LinkedHashMap<String, AuditEvent> pending = new LinkedHashMap<>();

    /** Every id that was ever committed, kept across pruning. */
    private final Set<String> committedIds = ConcurrentHashMap.newKeySet();

    private final ConcurrentSkipListMap<EventPosition, CommittedEvent> events = new ConcurrentSkipListMap<>();
    private final Map<EventKind, ConcurrentSkipListMap<EventPosition, CommittedEvent>> byKind = new EnumMap<>(EventKind.class);
    private final Map<EventKind, Long> counts = new EnumMap<>(EventKind.class);

    private volatile Block tip;
    private volatile long firstIndex;
    private volatile Checkpoint checkpoint;
    private volatile long sizeBytes;

    public InMemoryChainStore() {
        for (EventKind kind : EventKind.values()) {
            byKind.put(kind, new ConcurrentSkipListMap<>());
            counts.put(kind, 0L);
        }
    }

    // -------------- pending pool ----------------

    @Override
    public synchronized boolean appendPending(AuditEvent event) {
        if (event == null) throw new IllegalArgumentException("event");
        if (pending.containsKey(event.id()) || committedIds.contains(event.id())) {
            return false;
        }
        pending.put(event.id(), event);
        return true;
    }

    @Override
    public synchronized List<AuditEvent> peekPending(int limit) {
        List<AuditEvent> out = new ArrayList<>(Math.min(Math.max(limit, 0), pending.size()));
        for (AuditEvent event : pending.values()) {
            if (out.size() >= limit) break;
            out.add(event);
        }
        return out;
    }

    @Override
    public synchronized long pendingCount() {
        return pending.size();
    }

    @Override
    public synchronized boolean containsEvent(String eventId) {
        return pending.containsKey(eventId) || committedIds.contains(eventId);
    }

    // -------------- chain ----------------

    @Override
    public synchronized void append(Block block) {
        if (block == null) throw new IllegalArgumentException("block");
        checkLinks(tip, block);

        List<AuditEvent> txs;
        try {
            txs = block.transactions();
        } catch (RuntimeException e) {
            throw new ChainLinkException("Block " + block.index() + " carries unreadable transactions: " + e.getMessage());
        }
        Set<String> seen = new HashSet<>();
        for (AuditEvent event : txs) {
            if (committedIds.contains(event.id()) || !seen.add(event.id())) {
                throw new ChainLinkException("Event " + event.id() + " is already committed");
            }
        }

        blocks.put(block.index(), block);
        indexByHash.put(block.hash(), block.index());
        for (int pos = 0; pos < txs.size(); pos++) {
            AuditEvent event = txs.get(pos);
            EventPosition at = new EventPosition(block.index(), pos);
            CommittedEvent committed = new CommittedEvent(block.index(), pos, block.hash(), event);
            events.put(at, committed);
            byKind.get(event.kind()).put(at, committed);
            counts.merge(event.kind(), 1L, Long::sum);
            committedIds.add(event.id());
            pending.remove(event.id());
        }
        sizeBytes += BlockCodec.toBytes(block).length;
        tip = block;
    }

    /** Shared linkage check: genesis on empty store, otherwise exactly tip + 1 with matching parent hash. */
    static void checkLinks(Block tip, Block block) {
        if (tip == null) {
            if (block.index() != 0) {
                throw new ChainLinkException("Empty store only accepts block 0, got " + block.index());
            }
            if (!Block.GENESIS_PREVIOUS_HASH.equals(block.previousHash())) {
                throw new ChainLinkException("Genesis block must reference the all-zero hash");
            }
            return;
        }
        if (block.index() != tip.index() + 1) {
            throw new ChainLinkException("Expected block " + (tip.index() + 1) + " but got " + block.index());
        }
        if (!tip.hash().equals(block.previousHash())) {
            throw new ChainLinkException("Block " + block.index() + " does not link to tip " + tip.hash());
        }
    }

    @Override
    public Optional<Block> getBlock(long index) {
        return Optional.ofNullable(blocks.get(index));
    }

    @Override
    public Optional<Block> getBlockByHash(String hash) {
        if (hash == null) return Optional.empty();
        Long index = indexByHash.get(hash);
        return index == null ? Optional.empty() : getBlock(index);
    }

    @Override
    public Optional<Block> getTip() {
        return Optional.ofNullable(tip);
    }

    @Override
    public long firstIndex() {
        return firstIndex;
    }

    @Override
    public Optional<Checkpoint> getCheckpoint() {
        return Optional.ofNullable(checkpoint);
    }

    @Override
    public Iterable<Block> iterate(long start, long endExclusive) {
        if (endExclusive <= start) return Collections.emptyList();
        return () -> blocks.subMap(start, true, endExclusive, false).values().iterator();
    }

    @Override
    public Iterator<CommittedEvent> eventsAfter(EventPosition after, EventFilter filter) {
        EventFilter f = filter == null ? EventFilter.ALL : filter;
        NavigableMap<EventPosition, CommittedEvent> source = f.kind() == null ? events : byKind.get(f.kind());
        // bounded by the tip seen now, so a block committed mid-scan is either wholly in or out
        Block limit = tip;
        if (limit == null) return Collections.emptyIterator();
        NavigableMap<EventPosition, CommittedEvent> view = source.headMap(new EventPosition(limit.index() + 1, 0), false);
        if (after != null) view = view.tailMap(after, false);
        Iterator<CommittedEvent> it = view.values().iterator();
        return new Iterator<>() {
            private CommittedEvent next = advance();

            private CommittedEvent advance() {
                while (it.hasNext()) {
                    CommittedEvent candidate = it.next();
                    if (f.matchesTime(candidate.event().createdAt())) return candidate;
                }
                return null;
            }

            @Override public boolean hasNext() {
                return next != null;
            }

            @Override public CommittedEvent next() {
                if (next == null) throw new NoSuchElementException();
                CommittedEvent out = next;
                next = advance();
                return out;
            }
        };
    }

    @Override
    public synchronized Map<EventKind, Long> kindCounts() {
        return Collections.unmodifiableMap(new EnumMap<>(counts));
    }

    @Override
    public long approximateSizeBytes() {
        return sizeBytes;
    }

    @Override
    public synchronized PruneResult pruneThrough(long lastIndex) {
        Block current = tip;
        if (current == null || lastIndex < firstIndex) {
            return PruneResult.none(checkpoint);
        }
        if (lastIndex >= current.index()) {
            throw new IllegalArgumentException("Cannot prune the tip (block " + current.index() + ")");
        }
        long removedBlocks = 0;
        long removedEvents = 0;
        for (long i = firstIndex; i <= lastIndex; i++) {
            Block block = blocks.get(i);
            if (block == null) continue;
            NavigableMap<EventPosition, CommittedEvent> inBlock =
                    events.subMap(new EventPosition(i, 0), true, new EventPosition(i + 1, 0), false);
            for (CommittedEvent committed : new ArrayList<>(inBlock.values())) {
                events.remove(committed.location());
                byKind.get(committed.event().kind()).remove(committed.location());
                counts.merge(committed.event().kind(), -1L, Long::sum);
                removedEvents++;
            }
            sizeBytes -= BlockCodec.toBytes(block).length;
            indexByHash.remove(block.hash());
            removedBlocks++;
        }
        Block oldestRetained = blocks.get(lastIndex + 1);
        checkpoint = new Checkpoint(oldestRetained.index(), oldestRetained.hash(), System.currentTimeMillis());
        firstIndex = lastIndex + 1;
        blocks.headMap(lastIndex, true).clear();
        return new PruneResult(removedBlocks, removedEvents, checkpoint);
    }

    @Override
    public void close() {
        // nothing to release
    }
}
