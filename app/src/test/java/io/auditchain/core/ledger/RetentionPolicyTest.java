package io.auditchain.core.ledger;

import io.auditchain.core.event.AuditEvent;
import io.auditchain.core.event.LoginPayload;
import io.auditchain.core.protocol.Block;
import io.auditchain.core.storage.InMemoryChainStore;
import io.auditchain.core.storage.PruneResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetentionPolicyTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    /** Genesis plus one block per day, oldest {@code days} days ago. */
    private static InMemoryChainStore chainSpanningDays(int days) {
        InMemoryChainStore store = new InMemoryChainStore();
        store.append(GenesisBuilder.buildGenesis(NOW.minus(Duration.ofDays(days + 1)).toEpochMilli()));
        for (int d = days; d >= 0; d--) {
            long ts = NOW.minus(Duration.ofDays(d)).toEpochMilli();
            AuditEvent login = AuditEvent.of("day-" + d, new LoginPayload("kim", true, null, null), ts);
            Block tip = store.getTip().orElseThrow();
            Block candidate = Block.candidate(tip.index() + 1, ts, List.of(login), tip.hash());
            store.append(candidate.withNonce(0, candidate.computeHash()));
        }
        return store;
    }

    @Test
    void prunesBlocksOlderThanCutoff() {
        InMemoryChainStore store = chainSpanningDays(10);
        PruneResult result = RetentionPolicy.pruneOlderThan(store, NOW.minus(Duration.ofDays(5)));

        // genesis plus the blocks for days 10..6
        assertEquals(6, result.removedBlocks());
        long firstTs = store.getBlock(store.firstIndex()).orElseThrow().timestamp();
        assertEquals(NOW.minus(Duration.ofDays(5)).toEpochMilli(), firstTs);
    }

    @Test
    void neverRemovesTheTip() {
        InMemoryChainStore store = chainSpanningDays(3);
        Block tip = store.getTip().orElseThrow();
        PruneResult result = RetentionPolicy.pruneOlderThan(store, NOW.plus(Duration.ofDays(30)));

        assertEquals(tip.index(), store.firstIndex());
        assertEquals(tip.hash(), result.checkpoint().hash());
        assertEquals(1L, store.blockCount());
    }

    @Test
    void nothingToPrune() {
        InMemoryChainStore store = chainSpanningDays(2);
        PruneResult byAge = RetentionPolicy.pruneOlderThan(store, NOW.minus(Duration.ofDays(365)));
        assertEquals(0, byAge.removedBlocks());
        assertNull(byAge.checkpoint());

        PruneResult bySize = RetentionPolicy.keepLast(store, 100);
        assertEquals(0, bySize.removedBlocks());
        assertEquals(0L, store.firstIndex());
    }

    @Test
    void appliesBothConfiguredLimits() {
        InMemoryChainStore store = chainSpanningDays(10);
        LedgerConfig config = LedgerConfig.defaultLocal().withRetention(3, 7);

        PruneResult result = RetentionPolicy.apply(store, config, NOW);
        assertEquals(3L, store.blockCount());
        assertEquals(store.firstIndex(), result.checkpoint().index());
        assertEquals(9, result.removedBlocks());
    }
}
