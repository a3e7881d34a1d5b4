package io.auditchain.core.verify;

import io.auditchain.core.error.ChainIntegrityException;
import io.auditchain.core.metrics.LedgerMetrics;
import io.auditchain.core.protocol.Block;
import io.auditchain.core.protocol.Hashes;
import io.auditchain.core.storage.ChainStore;
import io.auditchain.core.storage.Checkpoint;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Walks the retained chain from its first block to the tip seen at the start of the run and
 * checks every block, stopping at the first failure.
 *
 * Per block, in order: recomputed hash, difficulty (not for genesis), linkage (genesis against
 * the all-zero hash, the first block of a pruned chain against the checkpoint, everything else
 * against its predecessor), then index continuity. Blocks are streamed, so memory stays flat
 * regardless of chain length. Blocks committed while a run is in progress are not checked. If
 * pruning moves the first retained block while a run is in progress, the run restarts from the
 * new start instead of reporting a checkpoint failure.
 */
public final class ChainVerifier {
    private static final Logger LOG = Logger.getLogger(ChainVerifier.class.getName());

    private static final int MAX_ATTEMPTS = 3;

    private final ChainStore store;
    private final int difficulty;
    private volatile VerificationResult lastResult;

    public ChainVerifier(ChainStore store, int difficulty) {
        if (store == null) throw new IllegalArgumentException("store");
        this.store = store;
        this.difficulty = difficulty;
    }

    public VerificationResult verify() {
        long checkedAt = System.currentTimeMillis();
        for (int attempt = 1; ; attempt++) {
            Optional<Block> tipSnapshot = store.getTip();
            if (tipSnapshot.isEmpty()) {
                return remember(VerificationResult.ok(0, 0, checkedAt));
            }
            long first = store.firstIndex();
            Checkpoint checkpoint = store.getCheckpoint().orElse(null);
            VerificationResult result = walk(tipSnapshot.get().index(), first, checkpoint, checkedAt);
            if (result.valid()) {
                LOG.fine(() -> "Chain verified: " + result.chainLength() + " blocks, "
                        + result.transactionCount() + " transactions");
                return remember(result);
            }
            if (attempt < MAX_ATTEMPTS && retainedRangeMoved(first, checkpoint)) {
                LOG.log(Level.FINE, "Retained range changed during verification (attempt {0}), restarting",
                        attempt);
                continue;
            }
            LedgerMetrics.verifyFailure();
            LOG.log(Level.SEVERE, "Chain integrity failure at block {0} ({1}): {2}",
                    new Object[]{result.failedIndex(), result.failedCheck(), result.message()});
            return remember(result);
        }
    }

    // A prune that lands between reading the start and iterating shifts the first block.
    private boolean retainedRangeMoved(long first, Checkpoint checkpoint) {
        return store.firstIndex() != first
                || !Objects.equals(store.getCheckpoint().orElse(null), checkpoint);
    }

    private VerificationResult walk(long tipIndex, long first, Checkpoint checkpoint, long checkedAt) {
        long expected = first;
        long transactions = 0;
        String previousHash = null;
        Iterator<Block> blocks = store.iterate(first, tipIndex + 1).iterator();
        while (true) {
            Block block;
            try {
                if (!blocks.hasNext()) break;
                block = blocks.next();
            } catch (RuntimeException e) {
                return fail(expected - first, transactions, checkedAt, expected, VerificationCheck.MALFORMED,
                        "Stored block cannot be decoded: " + e.getMessage());
            }
            long checked = expected - first;
            long index = block.index();

            if (!block.computeHash().equals(block.hash())) {
                return fail(checked, transactions, checkedAt, index, VerificationCheck.HASH_MISMATCH,
                        "Recomputed hash does not match stored hash " + block.hash());
            }
            if (index > 0 && !Hashes.meetsDifficulty(block.hash(), difficulty)) {
                return fail(checked, transactions, checkedAt, index, VerificationCheck.DIFFICULTY,
                        "Hash " + block.hash() + " does not meet difficulty " + difficulty);
            }
            if (index == 0) {
                if (!Block.GENESIS_PREVIOUS_HASH.equals(block.previousHash())) {
                    return fail(checked, transactions, checkedAt, index, VerificationCheck.LINKAGE,
                            "Genesis block does not reference the all-zero hash");
                }
            } else if (previousHash == null) {
                if (checkpoint == null || checkpoint.index() != index || !checkpoint.hash().equals(block.hash())) {
                    return fail(checked, transactions, checkedAt, index, VerificationCheck.CHECKPOINT,
                            checkpoint == null
                                    ? "Chain starts at block " + index + " but no checkpoint is recorded"
                                    : "Block " + index + " does not match checkpoint " + checkpoint.index() + "/" + checkpoint.hash());
                }
            } else if (!previousHash.equals(block.previousHash())) {
                return fail(checked, transactions, checkedAt, index, VerificationCheck.LINKAGE,
                        "previous_hash does not match block " + (index - 1));
            }
            if (index != expected) {
                return fail(checked, transactions, checkedAt, expected, VerificationCheck.INDEX_GAP,
                        "Expected block " + expected + " but found " + index);
            }
            try {
                transactions += block.transactions().size();
            } catch (RuntimeException e) {
                return fail(checked, transactions, checkedAt, index, VerificationCheck.MALFORMED,
                        "Transactions cannot be decoded: " + e.getMessage());
            }
            previousHash = block.hash();
            expected++;
        }
        if (expected != tipIndex + 1) {
            return fail(expected - first, transactions, checkedAt, expected, VerificationCheck.INDEX_GAP,
                    "Block " + expected + " is missing (tip is " + tipIndex + ")");
        }
        return VerificationResult.ok(expected - first, transactions, checkedAt);
    }

    /** Same as {@link #verify()} but throws on failure. */
    public VerificationResult verifyOrThrow() {
        VerificationResult result = verify();
        if (!result.valid()) {
            throw new ChainIntegrityException(result);
        }
        return result;
    }

    /** Result of the most recent run, or null if none has completed. */
    public VerificationResult lastResult() {
        return lastResult;
    }

    public int difficulty() {
        return difficulty;
    }

    private VerificationResult fail(long checked, long transactions, long checkedAt, long index,
                                    VerificationCheck check, String message) {
        return VerificationResult.failure(checked, transactions, checkedAt, index, check, message);
    }

    private VerificationResult remember(VerificationResult result) {
        lastResult = result;
        return result;
    }
}
