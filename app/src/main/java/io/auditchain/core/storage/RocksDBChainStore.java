package io.auditchain.core.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.auditchain.core.error.ChainLinkException;
import io.auditchain.core.error.PersistenceException;
import io.auditchain.core.error.QueueWriteException;
import io.auditchain.core.event.AuditEvent;
import io.auditchain.core.event.EventKind;
import io.auditchain.core.protocol.Block;
import io.auditchain.core.protocol.BlockCodec;
import io.auditchain.core.protocol.EventCodec;
import io.auditchain.core.storage.StoreKeys.BlockSummary;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.logging.Logger;

/**
 * Persistent ChainStore using RocksDB.
 *
 * Layout (column families):
 *  - "blocks"       : key = index(8),              val = block row JSON (see BlockCodec)
 *  - "block_hashes" : key = hash (utf8),           val = index(8)
 *  - "block_meta"   : key = index(8),              val = min created_at(8), max created_at(8), count(4)
 *  - "pending"      : key = seq(8),                val = event JSON
 *  - "pending_ids"  : key = event id (utf8),       val = seq(8)
 *  - "committed"    : key = event id (utf8),       val = index(8) position(4)
 *  - "events"       : key = index(8) position(4),  val = block hash + event JSON
 *  - "kinds"        : key = kind(1) index(8) position(4), val = created_at(8)
 *  - "meta"         : "tip", "first", "checkpoint", "count:KIND"
 *
 * Every mutation is a single synced WriteBatch, so a crash leaves either the old or the new state.
 */
public final class RocksDBChainStore implements ChainStore {

    private static final Logger LOG = Logger.getLogger(RocksDBChainStore.class.getName());

    static {
        RocksDB.loadLibrary();
    }

    static final String CF_BLOCKS = "blocks";
    static final String CF_BLOCK_HASHES = "block_hashes";
    static final String CF_BLOCK_META = "block_meta";
    static final String CF_PENDING = "pending";
    static final String CF_PENDING_IDS = "pending_ids";
    static final String CF_COMMITTED = "committed";
    static final String CF_EVENTS = "events";
    static final String CF_KINDS = "kinds";
    static final String CF_META = "meta";

    static final List<String> COLUMN_FAMILIES = List.of(
            CF_BLOCKS, CF_BLOCK_HASHES, CF_BLOCK_META, CF_PENDING, CF_PENDING_IDS,
            CF_COMMITTED, CF_EVENTS, CF_KINDS, CF_META);

    /** Entries pulled per RocksIterator during lazy scans. */
    static final int SCAN_BATCH = 256;

    private final RocksDB db;
    private final DBOptions dbOptions;
    private final WriteOptions syncWrites;
    private final List<ColumnFamilyHandle> handles;
    private final ColumnFamilyHandle cfBlocks;
    private final ColumnFamilyHandle cfBlockHashes;
    private final ColumnFamilyHandle cfBlockMeta;
    private final ColumnFamilyHandle cfPending;
    private final ColumnFamilyHandle cfPendingIds;
    private final ColumnFamilyHandle cfCommitted;
    private final ColumnFamilyHandle cfEvents;
    private final ColumnFamilyHandle cfKinds;
    private final ColumnFamilyHandle cfMeta;

    private final String dataDir;
    private long nextPendingSeq;
    private long pendingCount;
    private volatile Block tip;
    private volatile long firstIndex;
    private volatile Checkpoint checkpoint;
    private volatile boolean closed;

    private RocksDBChainStore(String dataDir, RocksDB db, DBOptions dbOptions, List<ColumnFamilyHandle> handles) {
        this.dataDir = dataDir;
        this.db = db;
        this.dbOptions = dbOptions;
        this.syncWrites = new WriteOptions().setSync(true);
        this.handles = handles;
        // index 0 is the default CF
        this.cfBlocks = handles.get(1);
        this.cfBlockHashes = handles.get(2);
        this.cfBlockMeta = handles.get(3);
        this.cfPending = handles.get(4);
        this.cfPendingIds = handles.get(5);
        this.cfCommitted = handles.get(6);
        this.cfEvents = handles.get(7);
        this.cfKinds = handles.get(8);
        this.cfMeta = handles.get(9);
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBChainStore open(String dataDir) {
        try {
            Files.createDirectories(Path.of(dataDir));
        } catch (IOException e) {
            throw new PersistenceException("Cannot create data directory " + dataDir, e);
        }
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        List<ColumnFamilyDescriptor> descriptors = new ArrayList<>();
        descriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY));
        for (String name : COLUMN_FAMILIES) {
            descriptors.add(new ColumnFamilyDescriptor(StoreKeys.utf8(name)));
        }
        List<ColumnFamilyHandle> handles = new ArrayList<>();
        try {
            RocksDB db = RocksDB.open(dbOpts, dataDir, descriptors, handles);
            RocksDBChainStore store = new RocksDBChainStore(dataDir, db, dbOpts, handles);
            store.loadState();
            return store;
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new PersistenceException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    private void loadState() throws RocksDBException {
        byte[] tipIndex = db.get(cfMeta, StoreKeys.META_TIP);
        if (tipIndex != null) {
            byte[] row = db.get(cfBlocks, tipIndex);
            if (row == null) {
                throw new PersistenceException("Tip block " + StoreKeys.readLong(tipIndex) + " is missing", null);
            }
            tip = BlockCodec.fromBytes(row);
        }
        byte[] first = db.get(cfMeta, StoreKeys.META_FIRST);
        firstIndex = first == null ? 0L : StoreKeys.readLong(first);
        byte[] cp = db.get(cfMeta, StoreKeys.META_CHECKPOINT);
        checkpoint = cp == null ? null : decodeCheckpoint(cp);

        try (RocksIterator it = db.newIterator(cfPending)) {
            it.seekToLast();
            nextPendingSeq = it.isValid() ? StoreKeys.readLong(it.key()) + 1 : 0L;
        }
        long count = 0;
        try (RocksIterator it = db.newIterator(cfPendingIds)) {
            for (it.seekToFirst(); it.isValid(); it.next()) count++;
        }
        pendingCount = count;
        final long pendingAtOpen = count;
        LOG.info(() -> "Opened chain store at " + dataDir + " (tip="
                + (tip == null ? "none" : tip.index()) + ", pending=" + pendingAtOpen + ")");
    }

    // -------------- pending pool ----------------

    @Override
    public synchronized boolean appendPending(AuditEvent event) {
        if (event == null) throw new IllegalArgumentException("event");
        byte[] id = StoreKeys.utf8(event.id());
        try {
            if (db.get(cfPendingIds, id) != null || db.get(cfCommitted, id) != null) {
                return false;
            }
            byte[] seq = StoreKeys.longKey(nextPendingSeq);
            try (WriteBatch batch = new WriteBatch()) {
                batch.put(cfPending, seq, EventCodec.toBytes(event));
                batch.put(cfPendingIds, id, seq);
                db.write(syncWrites, batch);
            }
            nextPendingSeq++;
            pendingCount++;
            return true;
        } catch (RocksDBException e) {
            throw new QueueWriteException(event.id(), e);
        }
    }

    @Override
    public synchronized List<AuditEvent> peekPending(int limit) {
        List<AuditEvent> out = new ArrayList<>();
        if (limit <= 0) return out;
        try (RocksIterator it = db.newIterator(cfPending)) {
            for (it.seekToFirst(); it.isValid() && out.size() < limit; it.next()) {
                out.add(EventCodec.fromBytes(it.value()));
            }
        }
        return out;
    }

    @Override
    public synchronized long pendingCount() {
        return pendingCount;
    }

    @Override
    public synchronized boolean containsEvent(String eventId) {
        if (eventId == null) return false;
        byte[] id = StoreKeys.utf8(eventId);
        try {
            return db.get(cfPendingIds, id) != null || db.get(cfCommitted, id) != null;
        } catch (RocksDBException e) {
            throw new PersistenceException("containsEvent failed", e);
        }
    }

    // -------------- chain ----------------

    @Override
    public synchronized void append(Block block) {
        if (block == null) throw new IllegalArgumentException("block");
        InMemoryChainStore.checkLinks(tip, block);

        List<AuditEvent> txs;
        try {
            txs = block.transactions();
        } catch (RuntimeException e) {
            throw new ChainLinkException("Block " + block.index() + " carries unreadable transactions: " + e.getMessage());
        }

        byte[] indexKey = StoreKeys.longKey(block.index());
        try (WriteBatch batch = new WriteBatch()) {
            Map<EventKind, Long> counts = readCounts();
            Set<String> seen = new HashSet<>();
            long removedFromPool = 0;
            long minCreated = Long.MAX_VALUE;
            long maxCreated = Long.MIN_VALUE;
            for (int pos = 0; pos < txs.size(); pos++) {
                AuditEvent event = txs.get(pos);
                byte[] id = StoreKeys.utf8(event.id());
                if (!seen.add(event.id()) || db.get(cfCommitted, id) != null) {
                    throw new ChainLinkException("Event " + event.id() + " is already committed");
                }
                byte[] positionKey = StoreKeys.positionKey(block.index(), pos);
                batch.put(cfEvents, positionKey, StoreKeys.eventValue(block.hash(), EventCodec.toBytes(event)));
                batch.put(cfKinds, StoreKeys.kindKey(event.kind(), block.index(), pos), StoreKeys.longKey(event.createdAt()));
                batch.put(cfCommitted, id, positionKey);
                byte[] seq = db.get(cfPendingIds, id);
                if (seq != null) {
                    batch.delete(cfPending, seq);
                    batch.delete(cfPendingIds, id);
                    removedFromPool++;
                }
                counts.merge(event.kind(), 1L, Long::sum);
                minCreated = Math.min(minCreated, event.createdAt());
                maxCreated = Math.max(maxCreated, event.createdAt());
            }
            if (txs.isEmpty()) {
                minCreated = block.timestamp();
                maxCreated = block.timestamp();
            }

            batch.put(cfBlocks, indexKey, BlockCodec.toBytes(block));
            batch.put(cfBlockHashes, StoreKeys.utf8(block.hash()), indexKey);
            batch.put(cfBlockMeta, indexKey,
                    new BlockSummary(block.index(), minCreated, maxCreated, txs.size()).toBytes());
            writeCounts(batch, counts);
            if (tip == null) {
                batch.put(cfMeta, StoreKeys.META_FIRST, indexKey);
            }
            batch.put(cfMeta, StoreKeys.META_TIP, indexKey);

            db.write(syncWrites, batch);
            pendingCount -= removedFromPool;
            tip = block;
        } catch (RocksDBException e) {
            throw new PersistenceException("Commit of block " + block.index() + " failed", e);
        }
    }

    @Override
    public Optional<Block> getBlock(long index) {
        if (index < 0) return Optional.empty();
        try {
            byte[] row = db.get(cfBlocks, StoreKeys.longKey(index));
            return row == null ? Optional.empty() : Optional.of(BlockCodec.fromBytes(row));
        } catch (RocksDBException e) {
            throw new PersistenceException("getBlock failed", e);
        }
    }

    @Override
    public Optional<Block> getBlockByHash(String hash) {
        if (hash == null) return Optional.empty();
        try {
            byte[] index = db.get(cfBlockHashes, StoreKeys.utf8(hash));
            return index == null ? Optional.empty() : getBlock(StoreKeys.readLong(index));
        } catch (RocksDBException e) {
            throw new PersistenceException("getBlockByHash failed", e);
        }
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

    /**
     * Raw rows are decoded one at a time; a row that fails to decode surfaces as
     * IllegalArgumentException from {@code next()} so the verifier can report it.
     */
    @Override
    public Iterable<Block> iterate(long start, long endExclusive) {
        if (endExclusive <= start) return Collections.emptyList();
        byte[] from = StoreKeys.longKey(Math.max(0, start));
        byte[] to = StoreKeys.longKey(endExclusive);
        return () -> scan(cfBlocks, from, to, (key, value) -> BlockCodec.fromBytes(value));
    }

    @Override
    public Iterator<CommittedEvent> eventsAfter(EventPosition after, EventFilter filter) {
        EventFilter f = filter == null ? EventFilter.ALL : filter;
        Block limit = tip;
        if (limit == null) return Collections.emptyIterator();
        long endBlock = limit.index() + 1;

        if (f.kind() != null) {
            EventKind kind = f.kind();
            byte[] from = after == null
                    ? StoreKeys.kindKey(kind, 0, 0)
                    : StoreKeys.successor(StoreKeys.kindKey(kind, after.blockIndex(), after.position()));
            byte[] to = StoreKeys.kindKey(kind, endBlock, 0);
            // the kind index carries created_at, so out-of-range events are skipped without decoding
            Iterator<EventPosition> positions = scan(cfKinds, from, to, (key, value) ->
                    f.matchesTime(StoreKeys.readLong(value)) ? StoreKeys.readPosition(key, 1) : null);
            return new Iterator<>() {
                @Override public boolean hasNext() {
                    return positions.hasNext();
                }

                @Override public CommittedEvent next() {
                    EventPosition at = positions.next();
                    return readEvent(at);
                }
            };
        }

        long startBlock = after == null ? 0L : after.blockIndex();
        Iterator<BlockSummary> summaries = scan(cfBlockMeta, StoreKeys.longKey(startBlock), StoreKeys.longKey(endBlock),
                (key, value) -> {
                    BlockSummary s = BlockSummary.read(key, value);
                    return s.count() > 0 && f.overlaps(s.minCreatedAt(), s.maxCreatedAt()) ? s : null;
                });
        return new Iterator<>() {
            private Iterator<CommittedEvent> current = Collections.emptyIterator();

            @Override public boolean hasNext() {
                while (!current.hasNext()) {
                    if (!summaries.hasNext()) return false;
                    BlockSummary s = summaries.next();
                    int firstPos = after != null && s.index() == after.blockIndex() ? after.position() + 1 : 0;
                    current = scan(cfEvents, StoreKeys.positionKey(s.index(), firstPos),
                            StoreKeys.positionKey(s.index() + 1, 0), (key, value) -> {
                                CommittedEvent ce = decodeEvent(key, value);
                                return f.matchesTime(ce.event().createdAt()) ? ce : null;
                            });
                }
                return true;
            }

            @Override public CommittedEvent next() {
                if (!hasNext()) throw new NoSuchElementException();
                return current.next();
            }
        };
    }

    private CommittedEvent readEvent(EventPosition at) {
        try {
            byte[] key = StoreKeys.positionKey(at.blockIndex(), at.position());
            byte[] value = db.get(cfEvents, key);
            if (value == null) {
                throw new PersistenceException("Indexed event " + at + " is missing", null);
            }
            return decodeEvent(key, value);
        } catch (RocksDBException e) {
            throw new PersistenceException("readEvent failed", e);
        }
    }

    private static CommittedEvent decodeEvent(byte[] key, byte[] value) {
        EventPosition at = StoreKeys.readPosition(key, 0);
        return new CommittedEvent(at.blockIndex(), at.position(),
                StoreKeys.eventValueHash(value), EventCodec.fromBytes(StoreKeys.eventValueJson(value)));
    }

    @Override
    public synchronized Map<EventKind, Long> kindCounts() {
        try {
            return Collections.unmodifiableMap(readCounts());
        } catch (RocksDBException e) {
            throw new PersistenceException("kindCounts failed", e);
        }
    }

    @Override
    public long approximateSizeBytes() {
        long total = 0;
        try {
            for (ColumnFamilyHandle cf : handles) {
                total += db.getLongProperty(cf, "rocksdb.estimate-live-data-size");
                total += db.getLongProperty(cf, "rocksdb.cur-size-all-mem-tables");
            }
        } catch (RocksDBException e) {
            throw new PersistenceException("approximateSizeBytes failed", e);
        }
        return total;
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
        try (WriteBatch batch = new WriteBatch()) {
            Map<EventKind, Long> counts = readCounts();
            long removedBlocks = 0;
            long removedEvents = 0;
            Iterator<Block> doomed = scan(cfBlocks, StoreKeys.longKey(firstIndex), StoreKeys.longKey(lastIndex + 1),
                    (key, value) -> BlockCodec.fromBytes(value));
            while (doomed.hasNext()) {
                Block block = doomed.next();
                byte[] indexKey = StoreKeys.longKey(block.index());
                Iterator<CommittedEvent> inBlock = scan(cfEvents, StoreKeys.positionKey(block.index(), 0),
                        StoreKeys.positionKey(block.index() + 1, 0), RocksDBChainStore::decodeEvent);
                while (inBlock.hasNext()) {
                    CommittedEvent ce = inBlock.next();
                    batch.delete(cfEvents, StoreKeys.positionKey(ce.blockIndex(), ce.position()));
                    batch.delete(cfKinds, StoreKeys.kindKey(ce.event().kind(), ce.blockIndex(), ce.position()));
                    counts.merge(ce.event().kind(), -1L, Long::sum);
                    removedEvents++;
                }
                batch.delete(cfBlocks, indexKey);
                batch.delete(cfBlockMeta, indexKey);
                batch.delete(cfBlockHashes, StoreKeys.utf8(block.hash()));
                removedBlocks++;
            }
            Block oldestRetained = getBlock(lastIndex + 1)
                    .orElseThrow(() -> new PersistenceException("Block " + (lastIndex + 1) + " is missing", null));
            Checkpoint cp = new Checkpoint(oldestRetained.index(), oldestRetained.hash(), System.currentTimeMillis());
            writeCounts(batch, counts);
            batch.put(cfMeta, StoreKeys.META_FIRST, StoreKeys.longKey(cp.index()));
            batch.put(cfMeta, StoreKeys.META_CHECKPOINT, encodeCheckpoint(cp));
            db.write(syncWrites, batch);

            firstIndex = cp.index();
            checkpoint = cp;
            return new PruneResult(removedBlocks, removedEvents, cp);
        } catch (RocksDBException e) {
            throw new PersistenceException("Prune through block " + lastIndex + " failed", e);
        }
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        // CF handles first, then DB/options
        for (ColumnFamilyHandle handle : handles) {
            handle.close();
        }
        db.close();
        syncWrites.close();
        dbOptions.close();
    }

    // -------------- helpers ----------------

    private Map<EventKind, Long> readCounts() throws RocksDBException {
        Map<EventKind, Long> counts = new EnumMap<>(EventKind.class);
        for (EventKind kind : EventKind.values()) {
            byte[] v = db.get(cfMeta, StoreKeys.countKey(kind));
            counts.put(kind, v == null ? 0L : StoreKeys.readLong(v));
        }
        return counts;
    }

    private void writeCounts(WriteBatch batch, Map<EventKind, Long> counts) throws RocksDBException {
        for (Map.Entry<EventKind, Long> e : counts.entrySet()) {
            batch.put(cfMeta, StoreKeys.countKey(e.getKey()), StoreKeys.longKey(e.getValue()));
        }
    }

    private static byte[] encodeCheckpoint(Checkpoint cp) {
        ObjectNode node = EventCodec.mapper().createObjectNode();
        node.put("index", cp.index());
        node.put("hash", cp.hash());
        node.put("created_at", cp.createdAt());
        return StoreKeys.utf8(node.toString());
    }

    private static Checkpoint decodeCheckpoint(byte[] bytes) {
        try {
            JsonNode node = EventCodec.mapper().readTree(bytes);
            return new Checkpoint(node.path("index").asLong(), node.path("hash").asText(), node.path("created_at").asLong());
        } catch (IOException e) {
            throw new PersistenceException("Stored checkpoint is unreadable", e);
        }
    }

    /**
     * Lazy scan over [from, to) in key order. Each batch opens a fresh iterator and seeks past the
     * last key it returned, so no RocksIterator outlives a single call. Entries decoded to null are
     * skipped.
     */
    private <T> Iterator<T> scan(ColumnFamilyHandle cf, byte[] from, byte[] to, BiFunction<byte[], byte[], T> decode) {
        return new Iterator<>() {
            private final ArrayDeque<T> buffer = new ArrayDeque<>();
            private byte[] seekKey = from;
            private boolean exhausted;

            @Override public boolean hasNext() {
                while (buffer.isEmpty() && !exhausted) {
                    fill();
                }
                return !buffer.isEmpty();
            }

            @Override public T next() {
                if (!hasNext()) throw new NoSuchElementException();
                return buffer.poll();
            }

            private void fill() {
                int read = 0;
                try (RocksIterator it = db.newIterator(cf)) {
                    for (it.seek(seekKey); it.isValid() && read < SCAN_BATCH; it.next()) {
                        byte[] key = it.key();
                        if (StoreKeys.compare(key, to) >= 0) {
                            exhausted = true;
                            return;
                        }
                        seekKey = StoreKeys.successor(key);
                        read++;
                        T decoded = decode.apply(key, it.value());
                        if (decoded != null) buffer.add(decoded);
                    }
                    if (!it.isValid()) exhausted = true;
                }
            }
        };
    }
}
