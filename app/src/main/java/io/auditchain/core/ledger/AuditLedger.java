package io.auditchain.core.ledger;

import io.auditchain.core.consensus.ProofOfWork;
import io.auditchain.core.error.ChainIntegrityException;
import io.auditchain.core.error.InvalidEventException;
import io.auditchain.core.event.AuditEvent;
import io.auditchain.core.event.ConfigChangePayload;
import io.auditchain.core.event.EventKind;
import io.auditchain.core.event.EventPayload;
import io.auditchain.core.event.LoginPayload;
import io.auditchain.core.event.OrderPayload;
import io.auditchain.core.event.SystemChangePayload;
import io.auditchain.core.event.TradePayload;
import io.auditchain.core.pool.EventValidator;
import io.auditchain.core.pool.PendingPool;
import io.auditchain.core.protocol.Block;
import io.auditchain.core.query.AuditPage;
import io.auditchain.core.query.AuditQuery;
import io.auditchain.core.query.AuditQueryService;
import io.auditchain.core.query.AuditReport;
import io.auditchain.core.query.ExportFormat;
import io.auditchain.core.query.LedgerExporter;
import io.auditchain.core.query.LedgerStats;
import io.auditchain.core.query.SensitiveDataMasker;
import io.auditchain.core.storage.ChainStore;
import io.auditchain.core.storage.InMemoryChainStore;
import io.auditchain.core.storage.PruneResult;
import io.auditchain.core.storage.RocksDBChainStore;
import io.auditchain.core.verify.ChainVerifier;
import io.auditchain.core.verify.VerificationResult;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Wires storage, pending pool, miner, verifier and the query side.
 * Call start() once; after that record events and read them back from any thread.
 */
public final class AuditLedger implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(AuditLedger.class.getName());

    private final ChainStore chain;
    private final LedgerConfig config;
    private final PendingPool pool;
    private final Miner miner;
    private final ChainVerifier verifier;
    private final AuditQueryService queries;
    private final LedgerExporter exporter;
    private final SensitiveDataMasker masker;
    private volatile boolean closed;

    public AuditLedger(ChainStore chain, ProofOfWork pow, LedgerConfig config) {
        this.chain = chain;
        this.config = config;
        this.pool = new PendingPool(chain, new EventValidator(config.recordTypes, EventValidator.DEFAULT_MAX_FUTURE_SKEW_MILLIS));
        this.miner = new Miner(chain, pow, config);
        this.verifier = new ChainVerifier(chain, config.difficulty);
        this.masker = new SensitiveDataMasker(config.sensitiveKeys);
        this.queries = new AuditQueryService(chain, verifier, miner::status, masker);
        this.exporter = new LedgerExporter(chain, masker);
    }

    /** Convenience factory for an in-memory ledger. */
    public static AuditLedger inMemory(LedgerConfig config) {
        return new AuditLedger(new InMemoryChainStore(), new ProofOfWork(), config);
    }

    /** Convenience factory for a RocksDB-backed ledger. */
    public static AuditLedger rocks(LedgerConfig config, String dataDir) {
        return new AuditLedger(RocksDBChainStore.open(dataDir), new ProofOfWork(), config);
    }

    /**
     * Ensure genesis exists, optionally verify what is already on disk, then start periodic
     * mining. A chain that fails verification leaves mining halted.
     */
    public void start() {
        GenesisBuilder.initIfNeeded(chain);
        if (config.verifyOnStart) {
            VerificationResult result = verifyChain();
            if (result.valid()) {
                LOG.info(() -> "Chain verified on start: " + result.chainLength() + " blocks, "
                        + result.transactionCount() + " events");
            }
        }
        miner.start();
        LOG.info(() -> "Audit ledger started with " + config + ", " + chain.pendingCount() + " events pending");
    }

    // -------------- recording ----------------

    /**
     * Validate and durably queue an event.
     *
     * @return true if newly queued, false if the id was already seen
     */
    public boolean record(AuditEvent event) {
        return pool.record(event);
    }

    public boolean recordTrade(AuditEvent event) {
        return record(requireKind(event, EventKind.TRADE));
    }

    public AuditEvent recordTrade(TradePayload payload) {
        return recordPayload(payload);
    }

    public boolean recordOrder(AuditEvent event) {
        return record(requireKind(event, EventKind.ORDER));
    }

    public AuditEvent recordOrder(OrderPayload payload) {
        return recordPayload(payload);
    }

    public boolean recordSystemChange(AuditEvent event) {
        return record(requireKind(event, EventKind.SYSTEM_CHANGE));
    }

    public AuditEvent recordSystemChange(SystemChangePayload payload) {
        return recordPayload(payload);
    }

    public boolean recordLogin(AuditEvent event) {
        return record(requireKind(event, EventKind.LOGIN));
    }

    public AuditEvent recordLogin(LoginPayload payload) {
        return recordPayload(payload);
    }

    public boolean recordConfigChange(AuditEvent event) {
        return record(requireKind(event, EventKind.CONFIG_CHANGE));
    }

    public AuditEvent recordConfigChange(ConfigChangePayload payload) {
        return recordPayload(payload);
    }

    private AuditEvent recordPayload(EventPayload payload) {
        AuditEvent event = AuditEvent.of(payload);
        record(event);
        return event;
    }

    private static AuditEvent requireKind(AuditEvent event, EventKind expected) {
        if (event == null) {
            throw new InvalidEventException(null, "Event required");
        }
        if (event.kind() != expected) {
            throw new InvalidEventException("kind", "expected " + expected.wireName() + " but got " + event.kind().wireName());
        }
        return event;
    }

    /** Oldest pending events, with sensitive values masked. */
    public List<AuditEvent> peekPending(int limit) {
        return masker.redactAll(pool.peek(limit));
    }

    public long pendingCount() {
        return pool.size();
    }

    // -------------- mining & integrity ----------------

    /** Mine now; blocks until this attempt completes. */
    public MiningResult forceMine() {
        return miner.forceMine();
    }

    /** Verify the whole retained chain. A failure halts mining until {@link #clearHalt()}. */
    public VerificationResult verifyChain() {
        VerificationResult result = verifier.verify();
        if (!result.valid()) {
            miner.halt("integrity check " + result.failedCheck() + " failed at block " + result.failedIndex());
        }
        return result;
    }

    /** Same as {@link #verifyChain()} but throws {@link ChainIntegrityException} on failure. */
    public VerificationResult verifyOrThrow() {
        VerificationResult result = verifyChain();
        if (!result.valid()) {
            throw new ChainIntegrityException(result);
        }
        return result;
    }

    public void clearHalt() {
        miner.clearHalt();
    }

    // -------------- retention ----------------

    /** Drop the oldest blocks created before {@code olderThan}. The tip is always kept. */
    public PruneResult prune(Instant olderThan) {
        return miner.runExclusive(() -> RetentionPolicy.pruneOlderThan(chain, olderThan));
    }

    /** Apply max_chain_size and prune_older_than_days from the config. */
    public PruneResult applyRetention() {
        return miner.runExclusive(() -> RetentionPolicy.apply(chain, config, Instant.now()));
    }

    // -------------- reads ----------------

    public AuditPage getAuditTrail(AuditQuery query) {
        return queries.getAuditTrail(query);
    }

    public AuditReport generateReport(EventKind kind, Long startTime, Long endTime, boolean detailed) {
        return queries.generateReport(kind, startTime, endTime, detailed);
    }

    public LedgerStats getStats() {
        return queries.getStats();
    }

    public void export(ExportFormat format, OutputStream out) throws IOException {
        exporter.export(format, out);
    }

    public Optional<Block> getBlock(long index) {
        return chain.getBlock(index);
    }

    public Optional<Block> getBlockByHash(String hash) {
        return chain.getBlockByHash(hash);
    }

    /** Stop mining (with a final flush when configured) and release the store. */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        try {
            miner.close();
        } finally {
            chain.close();
        }
        LOG.info("Audit ledger closed");
    }

    public ChainStore chain() { return chain; }
    public LedgerConfig config() { return config; }
    public Miner miner() { return miner; }
    public ChainVerifier verifier() { return verifier; }
    public AuditQueryService queries() { return queries; }
}
