package io.auditchain.core.ledger;

import io.auditchain.core.consensus.ProofOfWork;
import io.auditchain.core.error.PersistenceException;
import io.auditchain.core.event.AuditEvent;
import io.auditchain.core.event.TradePayload;
import io.auditchain.core.event.TradeSide;
import io.auditchain.core.metrics.LedgerMetrics;
import io.auditchain.core.protocol.Block;
import io.auditchain.core.storage.ChainStore;
import io.auditchain.core.storage.ForwardingChainStore;
import io.auditchain.core.storage.InMemoryChainStore;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class MinerTest {

    private static final LedgerConfig CONFIG = LedgerConfig.defaultLocal()
            .withAutoMine(false)
            .withDifficulty(1)
            .withMineOnShutdown(false);

    private static AuditEvent trade(String id) {
        return AuditEvent.of(id, TradePayload.of("GOOG", TradeSide.SELL, BigDecimal.ONE, new BigDecimal("140.10")), System.currentTimeMillis());
    }

    private static InMemoryChainStore storeWithGenesis() {
        InMemoryChainStore store = new InMemoryChainStore();
        GenesisBuilder.initIfNeeded(store);
        return store;
    }

    @Test
    void minesPendingEventsIntoNextBlock() {
        InMemoryChainStore store = storeWithGenesis();
        store.appendPending(trade("m-1"));
        store.appendPending(trade("m-2"));
        store.appendPending(trade("m-3"));
        double before = LedgerMetrics.registry().counter("ledger.blocks.mined").count();

        Miner miner = new Miner(store, new ProofOfWork(), CONFIG);
        MiningResult result = miner.forceMine();

        assertTrue(result.isMined());
        Block block = result.block();
        assertEquals(1L, block.index());
        assertTrue(block.hash().startsWith("0"));
        assertEquals(3, block.transactions().size());
        assertEquals(0, store.pendingCount());
        assertEquals(before + 1, LedgerMetrics.registry().counter("ledger.blocks.mined").count());
        assertEquals(MiningResult.Status.MINED, miner.status().lastStatus());
    }

    @Test
    void emptyPoolMinesNothing() {
        Miner miner = new Miner(storeWithGenesis(), new ProofOfWork(), CONFIG);
        assertEquals(MiningResult.Status.NOTHING_PENDING, miner.forceMine().status());
    }

    @Test
    void respectsMaxBlockSize() {
        InMemoryChainStore store = storeWithGenesis();
        for (int i = 0; i < 5; i++) {
            store.appendPending(trade("cap-" + i));
        }
        Miner miner = new Miner(store, new ProofOfWork(), CONFIG.withMaxBlockSize(2));

        assertEquals(2, miner.forceMine().block().transactions().size());
        assertEquals(3, store.pendingCount());
        assertEquals("cap-2", store.peekPending(1).get(0).id());
    }

    @Test
    void concurrentForcedMiningCommitsOnce() throws Exception {
        InMemoryChainStore store = storeWithGenesis();
        store.appendPending(trade("race-1"));
        Miner miner = new Miner(store, new ProofOfWork(), CONFIG);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<MiningResult>> futures = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    return miner.forceMine();
                }));
            }
            go.countDown();
            List<MiningResult.Status> statuses = new ArrayList<>();
            for (Future<MiningResult> f : futures) {
                statuses.add(f.get(30, TimeUnit.SECONDS).status());
            }
            assertTrue(statuses.contains(MiningResult.Status.MINED));
            assertTrue(statuses.contains(MiningResult.Status.NOTHING_PENDING));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1L, store.getTip().orElseThrow().index());
    }

    @Test
    void timeoutLeavesEventsPendingAndWarns() {
        InMemoryChainStore store = storeWithGenesis();
        store.appendPending(trade("slow-1"));
        LedgerConfig hard = CONFIG.withDifficulty(12).withMiningLimits(Duration.ofMillis(100), Long.MAX_VALUE);
        Miner miner = new Miner(store, new ProofOfWork(), hard);

        List<LogRecord> records = new ArrayList<>();
        Handler capture = new Handler() {
            @Override public void publish(LogRecord record) { records.add(record); }
            @Override public void flush() { }
            @Override public void close() { }
        };
        Logger logger = Logger.getLogger(Miner.class.getName());
        logger.addHandler(capture);
        try {
            MiningResult result = miner.forceMine();
            assertEquals(MiningResult.Status.TIMED_OUT, result.status());
        } finally {
            logger.removeHandler(capture);
        }

        assertTrue(records.stream().anyMatch(r -> r.getLevel() == Level.WARNING && r.getMessage().contains("timed out")));
        assertEquals(1, store.pendingCount());
        assertEquals("slow-1", store.peekPending(10).get(0).id());
        assertEquals(0L, store.getTip().orElseThrow().index());
    }

    @Test
    void commitFailureBacksOffAndKeepsEvents() {
        InMemoryChainStore real = storeWithGenesis();
        real.appendPending(trade("fail-1"));
        ChainStore failing = new ForwardingChainStore(real) {
            @Override
            public void append(Block block) {
                throw new PersistenceException("write failed", new IllegalStateException("io"));
            }
        };
        Miner miner = new Miner(failing, new ProofOfWork(), CONFIG);

        assertEquals(MiningResult.Status.FAILED, miner.forceMine().status());
        assertEquals(1, miner.status().consecutiveFailures());
        assertEquals(1, real.pendingCount());

        // the next periodic attempt falls inside the backoff window and is skipped
        miner.autoTick();
        assertEquals(1, miner.status().consecutiveFailures());

        assertEquals(MiningResult.Status.FAILED, miner.forceMine().status());
        assertEquals(2, miner.status().consecutiveFailures());
    }

    @Test
    void haltBlocksMiningUntilCleared() {
        InMemoryChainStore store = storeWithGenesis();
        store.appendPending(trade("h-1"));
        Miner miner = new Miner(store, new ProofOfWork(), CONFIG);

        miner.halt("integrity failure");
        assertTrue(miner.isHalted());
        assertEquals(MiningResult.Status.HALTED, miner.forceMine().status());
        assertEquals(1, store.pendingCount());

        miner.clearHalt();
        assertEquals(MiningResult.Status.MINED, miner.forceMine().status());
    }

    @Test
    void closeFlushesPendingWhenConfigured() {
        InMemoryChainStore store = storeWithGenesis();
        store.appendPending(trade("flush-1"));
        Miner miner = new Miner(store, new ProofOfWork(), CONFIG.withMineOnShutdown(true));
        miner.close();
        assertEquals(0, store.pendingCount());
        assertEquals(1L, store.getTip().orElseThrow().index());
    }

    @Test
    void keepsMiningAfterClockStepsBehindTip() {
        long tipTime = System.currentTimeMillis() + Duration.ofMinutes(10).toMillis();
        InMemoryChainStore store = new InMemoryChainStore();
        store.append(GenesisBuilder.buildGenesis(tipTime));
        store.appendPending(trade("clock-1"));

        Miner miner = new Miner(store, new ProofOfWork(), CONFIG);
        MiningResult first = miner.forceMine();

        assertEquals(MiningResult.Status.MINED, first.status(), first.message());
        assertEquals(tipTime, first.block().timestamp());
        assertEquals(0, store.pendingCount());

        store.appendPending(trade("clock-2"));
        MiningResult second = miner.forceMine();
        assertEquals(MiningResult.Status.MINED, second.status(), second.message());
        assertEquals(2L, store.getTip().orElseThrow().index());
    }
}
