package io.auditchain.core.ledger;

import io.auditchain.core.protocol.Block;
import io.auditchain.core.storage.ChainStore;
import io.auditchain.core.storage.PruneResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Decides how much of the chain prefix may be dropped. Only a contiguous run of the oldest
 * blocks is ever removed and the tip always survives.
 */
public final class RetentionPolicy {
    private static final Logger LOG = Logger.getLogger(RetentionPolicy.class.getName());

    private RetentionPolicy() {}

    /** Prune the longest prefix whose blocks are all older than {@code cutoff}. */
    public static PruneResult pruneOlderThan(ChainStore store, Instant cutoff) {
        Optional<Block> tip = store.getTip();
        if (tip.isEmpty()) return PruneResult.none(null);
        long cutoffMillis = cutoff.toEpochMilli();
        long last = -1;
        for (Block block : store.iterate(store.firstIndex(), tip.get().index())) {
            if (block.timestamp() >= cutoffMillis) break;
            last = block.index();
        }
        return pruneThrough(store, last, "older than " + cutoff);
    }

    /** Keep at most {@code maxBlocks} retained blocks. */
    public static PruneResult keepLast(ChainStore store, long maxBlocks) {
        Optional<Block> tip = store.getTip();
        if (tip.isEmpty() || maxBlocks <= 0 || store.blockCount() <= maxBlocks) {
            return PruneResult.none(store.getCheckpoint().orElse(null));
        }
        return pruneThrough(store, tip.get().index() - maxBlocks, "beyond the newest " + maxBlocks);
    }

    /** Apply both configured limits (either may be disabled with 0). */
    public static PruneResult apply(ChainStore store, LedgerConfig config, Instant now) {
        PruneResult byAge = PruneResult.none(store.getCheckpoint().orElse(null));
        if (config.pruneOlderThanDays > 0) {
            byAge = pruneOlderThan(store, now.minus(Duration.ofDays(config.pruneOlderThanDays)));
        }
        PruneResult bySize = config.maxChainSize > 0 ? keepLast(store, config.maxChainSize) : PruneResult.none(null);
        return new PruneResult(
                byAge.removedBlocks() + bySize.removedBlocks(),
                byAge.removedEvents() + bySize.removedEvents(),
                bySize.checkpoint() != null ? bySize.checkpoint() : byAge.checkpoint());
    }

    private static PruneResult pruneThrough(ChainStore store, long lastIndex, String why) {
        if (lastIndex < store.firstIndex()) {
            return PruneResult.none(store.getCheckpoint().orElse(null));
        }
        PruneResult result = store.pruneThrough(lastIndex);
        LOG.info(() -> String.format("Pruned %d blocks (%d events) %s; checkpoint at block %d",
                result.removedBlocks(), result.removedEvents(), why, result.checkpoint().index()));
        return result;
    }
}
