package io.auditchain.core.ledger;

import io.auditchain.core.consensus.ChainRules;
import io.auditchain.core.consensus.ProofOfWork;
import io.auditchain.core.error.MiningTimeoutException;
import io.auditchain.core.error.PersistenceException;
import io.auditchain.core.event.AuditEvent;
import io.auditchain.core.metrics.LedgerMetrics;
import io.auditchain.core.protocol.Block;
import io.auditchain.core.storage.ChainStore;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds a block from the oldest pending events, runs PoW, validates it, and commits it.
 *
 * Periodic and forced attempts share one lock, so at most one search runs at a time and a
 * forced call waits for an in-flight one. Events are only read from the pool here; they leave
 * it in the same store transaction that commits their block, so an aborted attempt leaves the
 * pool exactly as it was.
 */
public final class Miner implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Miner.class.getName());

    /** Upper bound on the automatic-mining backoff, as a multiple of the interval. */
    static final int MAX_BACKOFF_FACTOR = 16;

    private final ChainStore store;
    private final ProofOfWork pow;
    private final LedgerConfig config;
    private final ReentrantLock lock = new ReentrantLock();

    private ScheduledExecutorService scheduler;
    private volatile boolean mining;
    private volatile String haltReason;
    private volatile int consecutiveFailures;
    private volatile long nextAutoAttemptAt;
    private volatile Long lastMinedAt;
    private volatile MiningResult.Status lastStatus;

    public Miner(ChainStore store, ProofOfWork pow, LedgerConfig config) {
        this.store = store;
        this.pow = pow;
        this.config = config;
    }

    /** Start periodic mining if enabled. Safe to call more than once. */
    public synchronized void start() {
        if (!config.autoMine || scheduler != null) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ledger-miner");
            t.setDaemon(true);
            return t;
        });
        long interval = config.miningIntervalSeconds;
        scheduler.scheduleWithFixedDelay(this::autoTick, interval, interval, TimeUnit.SECONDS);
        LOG.info(() -> "Automatic mining every " + interval + "s at difficulty " + config.difficulty);
    }

    void autoTick() {
        long now = System.currentTimeMillis();
        if (now < nextAutoAttemptAt) {
            LOG.fine(() -> "Backing off after " + consecutiveFailures + " failed commits");
            return;
        }
        try {
            MiningResult result = forceMine();
            LOG.fine(() -> "Automatic mining: " + result.status());
        } catch (RuntimeException e) {
            // keep the schedule alive; a thrown exception would cancel it
            LOG.log(Level.SEVERE, "Automatic mining attempt failed", e);
        }
    }

    /** One production attempt. Blocks while another attempt is in flight. */
    public MiningResult forceMine() {
        lock.lock();
        try {
            MiningResult result = mineLocked();
            lastStatus = result.status();
            return result;
        } finally {
            lock.unlock();
        }
    }

    private MiningResult mineLocked() {
        String halt = haltReason;
        if (halt != null) {
            return MiningResult.halted(halt);
        }

        // 1) Gather events, oldest first
        List<AuditEvent> batch = store.peekPending(config.maxBlockSize);
        if (batch.isEmpty()) {
            return MiningResult.nothingPending();
        }

        // 2) Parent info
        Optional<Block> tipOpt = store.getTip();
        if (tipOpt.isEmpty()) {
            return MiningResult.failed("Chain has no genesis block");
        }
        Block tip = tipOpt.get();

        // 3) Candidate, timestamp never behind the parent
        long timestamp = Math.max(System.currentTimeMillis(), tip.timestamp());
        Block template = Block.candidate(tip.index() + 1, timestamp, batch, tip.hash());

        mining = true;
        try {
            // 4) Mine
            Block mined = LedgerMetrics.recordMining(() ->
                    pow.mine(template, config.difficulty, config.maxPowAttempts, config.miningTimeout));

            // 5) Validate before persisting, then commit (pool removal is part of the commit)
            ChainRules.validateCandidate(mined, tip, config.difficulty);
            store.append(mined);

            LedgerMetrics.incrementBlocks();
            consecutiveFailures = 0;
            nextAutoAttemptAt = 0L;
            lastMinedAt = System.currentTimeMillis();
            LOG.info(() -> String.format("Mined block %d with %d events (nonce=%d, hash=%s)",
                    mined.index(), batch.size(), mined.nonce(), mined.hash()));
            return MiningResult.mined(mined);
        } catch (MiningTimeoutException e) {
            LedgerMetrics.miningTimeout();
            String message = String.format(
                    "Mining block %d timed out after %d attempts in %d ms; %d events stay pending",
                    e.getBlockIndex(), e.getAttempts(), e.getElapsedMillis(), batch.size());
            LOG.warning(message);
            return MiningResult.timedOut(message);
        } catch (PersistenceException e) {
            LedgerMetrics.miningFailure();
            int failures = ++consecutiveFailures;
            long factor = Math.min(1L << Math.min(failures, 4), MAX_BACKOFF_FACTOR);
            nextAutoAttemptAt = System.currentTimeMillis() + config.miningIntervalSeconds * 1000L * factor;
            LOG.log(Level.SEVERE, "Commit of block " + template.index() + " failed (" + failures
                    + " in a row); events stay pending", e);
            return MiningResult.failed(e.getMessage());
        } finally {
            mining = false;
        }
    }

    /** Run {@code action} while holding the mining lock (no block is mined meanwhile). */
    public <T> T runExclusive(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /** Stop all mining (periodic and forced) until {@link #clearHalt()}. */
    public void halt(String reason) {
        haltReason = reason == null ? "halted" : reason;
        LOG.severe(() -> "Mining halted: " + haltReason);
    }

    public void clearHalt() {
        if (haltReason != null) {
            LOG.warning(() -> "Mining halt cleared (was: " + haltReason + ")");
        }
        haltReason = null;
    }

    public boolean isHalted() {
        return haltReason != null;
    }

    public MinerStatus status() {
        return new MinerStatus(config.autoMine, mining, haltReason != null, haltReason,
                consecutiveFailures, lastMinedAt, lastStatus);
    }

    /** Stop the schedule, then make one last attempt to flush the pool if configured. */
    @Override
    public void close() {
        ScheduledExecutorService s;
        synchronized (this) {
            s = scheduler;
            scheduler = null;
        }
        if (s != null) {
            s.shutdown();
            try {
                if (!s.awaitTermination(config.miningTimeout.toMillis() + 5_000L, TimeUnit.MILLISECONDS)) {
                    s.shutdownNow();
                }
            } catch (InterruptedException e) {
                s.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        if (config.mineOnShutdown && store.pendingCount() > 0) {
            MiningResult result = forceMine();
            LOG.info(() -> "Shutdown flush: " + result.message());
        }
    }
}
