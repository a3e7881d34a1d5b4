package io.auditchain.core.verify;

import io.auditchain.core.consensus.ProofOfWork;
import io.auditchain.core.error.ChainIntegrityException;
import io.auditchain.core.event.AuditEvent;
import io.auditchain.core.event.TradePayload;
import io.auditchain.core.event.TradeSide;
import io.auditchain.core.ledger.GenesisBuilder;
import io.auditchain.core.protocol.Block;
import io.auditchain.core.storage.ChainStore;
import io.auditchain.core.storage.Checkpoint;
import io.auditchain.core.storage.ForwardingChainStore;
import io.auditchain.core.storage.InMemoryChainStore;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ChainVerifierTest {

    private static final int DIFFICULTY = 1;

    private static AuditEvent trade(String id) {
        return AuditEvent.of(id, TradePayload.of("IBM", TradeSide.BUY, BigDecimal.ONE, new BigDecimal("150")), 1_000L);
    }

    private static Block mineOnto(ChainStore store, AuditEvent... events) {
        Block tip = store.getTip().orElseThrow();
        Block candidate = Block.candidate(tip.index() + 1, tip.timestamp() + 1, List.of(events), tip.hash());
        Block mined = new ProofOfWork().mine(candidate, DIFFICULTY, 1_000_000L, Duration.ofSeconds(10));
        store.append(mined);
        return mined;
    }

    private static InMemoryChainStore chainOf(int blocks) {
        InMemoryChainStore store = new InMemoryChainStore();
        store.append(GenesisBuilder.buildGenesis(1_000L));
        for (int i = 0; i < blocks; i++) {
            mineOnto(store, trade("v-" + i + "-a"), trade("v-" + i + "-b"));
        }
        return store;
    }

    @Test
    void validChainPasses() {
        ChainVerifier verifier = new ChainVerifier(chainOf(4), DIFFICULTY);
        VerificationResult result = verifier.verify();
        assertTrue(result.valid());
        assertEquals(5, result.chainLength());
        assertEquals(8, result.transactionCount());
        assertNull(result.failedIndex());
        assertSame(result, verifier.lastResult());
    }

    @Test
    void emptyStoreIsTriviallyValid() {
        assertTrue(new ChainVerifier(new InMemoryChainStore(), DIFFICULTY).verify().valid());
    }

    @Test
    void storedHashThatDoesNotMatchContentsIsCaught() {
        InMemoryChainStore store = chainOf(2);
        Block tip = store.getTip().orElseThrow();
        // the store checks linkage only, so a forged hash is accepted and left for the verifier
        Block forged = new Block(tip.index() + 1, tip.timestamp() + 1, "[]", tip.hash(), 0, "0".repeat(64));
        store.append(forged);

        VerificationResult result = new ChainVerifier(store, DIFFICULTY).verify();
        assertFalse(result.valid());
        assertEquals(3L, result.failedIndex());
        assertEquals(VerificationCheck.HASH_MISMATCH, result.failedCheck());
        assertEquals(3, result.chainLength());
    }

    @Test
    void raisedDifficultyFlagsOlderBlocks() {
        InMemoryChainStore store = chainOf(3);
        VerificationResult result = new ChainVerifier(store, 64).verify();
        assertFalse(result.valid());
        assertEquals(1L, result.failedIndex());
        assertEquals(VerificationCheck.DIFFICULTY, result.failedCheck());
    }

    @Test
    void prunedChainVerifiesAgainstCheckpoint() {
        InMemoryChainStore store = chainOf(5);
        store.pruneThrough(2);
        VerificationResult result = new ChainVerifier(store, DIFFICULTY).verify();
        assertTrue(result.valid());
        assertEquals(3, result.chainLength());
    }

    @Test
    void missingTailBlockIsAnIndexGap() {
        InMemoryChainStore real = chainOf(4);
        ChainStore truncated = new ForwardingChainStore(real) {
            @Override
            public Iterable<Block> iterate(long start, long endExclusive) {
                List<Block> out = new ArrayList<>();
                for (Block b : delegate.iterate(start, endExclusive)) {
                    if (b.index() != 4) out.add(b);
                }
                return out;
            }
        };
        VerificationResult result = new ChainVerifier(truncated, DIFFICULTY).verify();
        assertFalse(result.valid());
        assertEquals(VerificationCheck.INDEX_GAP, result.failedCheck());
        assertEquals(4L, result.failedIndex());
    }

    @Test
    void missingMiddleBlockBreaksLinkage() {
        InMemoryChainStore real = chainOf(4);
        ChainStore holed = new ForwardingChainStore(real) {
            @Override
            public Iterable<Block> iterate(long start, long endExclusive) {
                List<Block> out = new ArrayList<>();
                for (Block b : delegate.iterate(start, endExclusive)) {
                    if (b.index() != 2) out.add(b);
                }
                return out;
            }
        };
        VerificationResult result = new ChainVerifier(holed, DIFFICULTY).verify();
        assertFalse(result.valid());
        assertEquals(VerificationCheck.LINKAGE, result.failedCheck());
        assertEquals(3L, result.failedIndex());
    }

    @Test
    void verifyOrThrowCarriesResult() {
        InMemoryChainStore store = chainOf(1);
        ChainIntegrityException ex = assertThrows(ChainIntegrityException.class,
                () -> new ChainVerifier(store, 64).verifyOrThrow());
        assertEquals(VerificationCheck.DIFFICULTY, ex.getResult().failedCheck());
    }

    @Test
    void pruneDuringVerificationDoesNotReportCheckpointFailure() {
        InMemoryChainStore backing = chainOf(3);
        ChainStore pruning = new ForwardingChainStore(backing) {
            private boolean pruned;

            @Override
            public Iterable<Block> iterate(long start, long endExclusive) {
                if (!pruned) {
                    pruned = true;
                    delegate.pruneThrough(1);
                }
                return super.iterate(start, endExclusive);
            }
        };

        VerificationResult result = new ChainVerifier(pruning, DIFFICULTY).verify();

        assertTrue(result.valid(), result.message());
        assertEquals(2, result.chainLength());
        assertEquals(2L, backing.firstIndex());
    }

    @Test
    void checkpointMismatchWithStableRangeStillFails() {
        InMemoryChainStore backing = chainOf(3);
        backing.pruneThrough(1);
        ChainStore wrongCheckpoint = new ForwardingChainStore(backing) {
            @Override
            public Optional<Checkpoint> getCheckpoint() {
                return Optional.of(new Checkpoint(2, "a".repeat(64), 1_000L));
            }
        };

        VerificationResult result = new ChainVerifier(wrongCheckpoint, DIFFICULTY).verify();

        assertFalse(result.valid());
        assertEquals(VerificationCheck.CHECKPOINT, result.failedCheck());
        assertEquals(2L, result.failedIndex());
    }
}
