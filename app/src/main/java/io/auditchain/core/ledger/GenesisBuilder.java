package io.auditchain.core.ledger;

import io.auditchain.core.protocol.Block;
import io.auditchain.core.protocol.Hashes;
import io.auditchain.core.storage.ChainStore;

import java.util.Collections;
import java.util.logging.Logger;

/**
 * Creates the genesis block.
 * - index = 0
 * - previous_hash = 64 '0' characters
 * - no transactions, nonce 0 (difficulty does not apply to genesis)
 */
public final class GenesisBuilder {
    private static final Logger LOG = Logger.getLogger(GenesisBuilder.class.getName());

    private GenesisBuilder(){}

    /** Build the empty genesis block stamped with the given time. */
    public static Block buildGenesis(long timestamp) {
        String txs = "[]";
        return new Block(0L, timestamp, txs, Block.GENESIS_PREVIOUS_HASH, 0L,
                Hashes.blockHash(0L, timestamp, txs, Block.GENESIS_PREVIOUS_HASH, 0L));
    }

    /**
     * If the chain is empty, store the genesis block.
     * Idempotent: does nothing if a tip already exists.
     */
    public static void initIfNeeded(ChainStore chain) {
        if (chain.getTip().isPresent()) return;
        Block genesis = buildGenesis(System.currentTimeMillis());
        chain.append(genesis);
        LOG.info(() -> "Created genesis block " + genesis.hash());
    }
}
