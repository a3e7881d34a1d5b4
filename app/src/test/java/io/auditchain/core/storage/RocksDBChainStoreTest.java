package io.auditchain.core.storage;

import io.auditchain.core.event.AuditEvent;
import io.auditchain.core.event.EventKind;
import io.auditchain.core.protocol.Block;
import io.auditchain.core.protocol.BlockCodec;
import io.auditchain.core.verify.ChainVerifier;
import io.auditchain.core.verify.VerificationCheck;
import io.auditchain.core.verify.VerificationResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RocksDBChainStoreTest extends ChainStoreContract {

    @TempDir
    Path tempDir;

    @Override
    protected ChainStore newStore() {
        return RocksDBChainStore.open(tempDir.resolve("chain").toString());
    }

    private ChainStore reopen() {
        store.close();
        store = RocksDBChainStore.open(tempDir.resolve("chain").toString());
        return store;
    }

    @Test
    void pendingEventsSurviveReopen() {
        appendGenesis(store, 1_000L);
        store.appendPending(trade("p1", 10));
        store.appendPending(login("p2", 11));

        reopen();

        assertEquals(2, store.pendingCount());
        assertEquals(List.of("p1", "p2"), store.peekPending(10).stream().map(AuditEvent::id).toList());
        assertTrue(store.appendPending(trade("p3", 12)));
        assertEquals("p3", store.peekPending(10).get(2).id());
    }

    @Test
    void chainStateSurvivesReopen() {
        appendGenesis(store, 1_000L);
        store.append(nextBlock(store, 2_000L, List.of(trade("a", 1), login("b", 2))));
        store.append(nextBlock(store, 3_000L, List.of(trade("c", 3))));
        store.append(nextBlock(store, 4_000L, List.of(trade("d", 4))));
        store.pruneThrough(0);
        Block tip = store.getTip().orElseThrow();

        reopen();

        assertEquals(tip.hash(), store.getTip().orElseThrow().hash());
        assertEquals(1L, store.firstIndex());
        assertEquals(1L, store.getCheckpoint().orElseThrow().index());
        assertEquals(3L, store.kindCounts().get(EventKind.TRADE));
        assertFalse(store.appendPending(trade("a", 1)));
        assertEquals(List.of("a", "b", "c", "d"), ids(store.eventsAfter(null, EventFilter.ALL)));
    }

    @Test
    void scansSpanMoreThanOneBatch() {
        appendGenesis(store, 1_000L);
        int blocks = RocksDBChainStore.SCAN_BATCH + 20;
        for (int i = 0; i < blocks; i++) {
            store.append(nextBlock(store, 2_000L + i, List.of(trade("e" + i, 100 + i))));
        }
        int seen = 0;
        for (Block ignored : store.iterate(1, blocks + 1)) {
            seen++;
        }
        assertEquals(blocks, seen);
        assertEquals(blocks, ids(store.eventsAfter(null, new EventFilter(EventKind.TRADE, null, null))).size());
        assertTrue(store.approximateSizeBytes() >= 0);
    }

    @Test
    void tamperedRowOnDiskFailsVerification() throws Exception {
        appendGenesis(store, 1_000L);
        store.append(nextBlock(store, 2_000L, List.of(trade("a", 1))));
        Block victim = nextBlock(store, 3_000L, List.of(trade("b", 2), trade("c", 3)));
        store.append(victim);
        store.append(nextBlock(store, 4_000L, List.of(login("d", 4))));
        store.close();

        Block forged = new Block(victim.index(), victim.timestamp(),
                victim.serializedTransactions().replace("101.5", "1.5"),
                victim.previousHash(), victim.nonce(), victim.hash());
        overwriteBlockRow(forged);

        store = RocksDBChainStore.open(tempDir.resolve("chain").toString());
        VerificationResult result = new ChainVerifier(store, 0).verify();
        assertFalse(result.valid());
        assertEquals(victim.index(), result.failedIndex());
        assertEquals(VerificationCheck.HASH_MISMATCH, result.failedCheck());
    }

    private void overwriteBlockRow(Block forged) throws Exception {
        RocksDB.loadLibrary();
        List<ColumnFamilyDescriptor> descriptors = new ArrayList<>();
        descriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY));
        for (String name : RocksDBChainStore.COLUMN_FAMILIES) {
            descriptors.add(new ColumnFamilyDescriptor(StoreKeys.utf8(name)));
        }
        List<ColumnFamilyHandle> handles = new ArrayList<>();
        try (DBOptions options = new DBOptions();
             RocksDB db = RocksDB.open(options, tempDir.resolve("chain").toString(), descriptors, handles)) {
            ColumnFamilyHandle blocks = handles.get(1 + RocksDBChainStore.COLUMN_FAMILIES.indexOf(RocksDBChainStore.CF_BLOCKS));
            db.put(blocks, StoreKeys.longKey(forged.index()), BlockCodec.toBytes(forged));
            for (ColumnFamilyHandle handle : handles) {
                handle.close();
            }
        }
    }
}
