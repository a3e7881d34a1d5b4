package io.auditchain.core.consensus;

import io.auditchain.core.error.ChainLinkException;
import io.auditchain.core.protocol.Block;
import io.auditchain.core.protocol.Hashes;

/**
 * Rules a freshly mined block must satisfy before it is handed to the store.
 */
public final class ChainRules {
    private ChainRules() {}

    /**
     * Allowed skew for a block timestamp past the later of the local clock and the parent's
     * timestamp, so a parent stamped ahead of a clock that stepped back still accepts children.
     */
    public static final long MAX_FUTURE_DRIFT_MILLIS = 60_000L;

    public static void validateCandidate(Block block, Block tip, int difficulty) {
        long expectedIndex = tip.index() + 1;
        if (block.index() != expectedIndex) {
            throw new ChainLinkException("Bad block index: expected " + expectedIndex + ", got " + block.index());
        }
        if (!block.previousHash().equals(tip.hash())) {
            throw new ChainLinkException("Block " + block.index() + " does not extend tip " + tip.hash());
        }
        if (block.transactions().isEmpty()) {
            throw new ChainLinkException("Block " + block.index() + " carries no transactions");
        }
        if (!block.hash().equals(block.computeHash())) {
            throw new ChainLinkException("Block " + block.index() + " hash does not match its contents");
        }
        if (!Hashes.meetsDifficulty(block.hash(), difficulty)) {
            throw new ChainLinkException("Block " + block.index() + " does not meet difficulty " + difficulty);
        }
        if (block.timestamp() < tip.timestamp()) {
            throw new ChainLinkException("Block " + block.index() + " timestamp precedes its parent");
        }
        long reference = Math.max(System.currentTimeMillis(), tip.timestamp());
        if (block.timestamp() > reference + MAX_FUTURE_DRIFT_MILLIS) {
            throw new ChainLinkException("Block " + block.index() + " timestamp too far in future");
        }
    }
}
