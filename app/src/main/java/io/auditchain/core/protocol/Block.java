package io.auditchain.core.protocol;

import io.auditchain.core.event.AuditEvent;

import java.util.List;

/**
 * A committed (or candidate) unit of the ledger.
 *
 * The serialized transaction string is the source of truth: it is what gets hashed and what is
 * stored. The event list is decoded from it on first access.
 */
public final class Block {

    /** previous_hash of block 0. */
    public static final String GENESIS_PREVIOUS_HASH = "0".repeat(64);

    private final long index;
    private final long timestamp;
    private final String serializedTransactions;
    private final String previousHash;
    private final long nonce;
    private final String hash;
    private volatile List<AuditEvent> transactions;

    public Block(long index, long timestamp, String serializedTransactions, String previousHash, long nonce, String hash) {
        if (index < 0) throw new IllegalArgumentException("index must be >= 0");
        if (serializedTransactions == null) throw new IllegalArgumentException("missing transactions");
        if (previousHash == null) throw new IllegalArgumentException("missing previous hash");
        if (hash == null) throw new IllegalArgumentException("missing hash");
        this.index = index;
        this.timestamp = timestamp;
        this.serializedTransactions = serializedTransactions;
        this.previousHash = previousHash;
        this.nonce = nonce;
        this.hash = hash;
    }

    /** Unmined candidate: nonce 0 and its matching hash. */
    public static Block candidate(long index, long timestamp, List<AuditEvent> events, String previousHash) {
        String serialized = EventCodec.serializeAll(events);
        Block block = new Block(index, timestamp, serialized, previousHash, 0L,
                Hashes.blockHash(index, timestamp, serialized, previousHash, 0L));
        block.transactions = List.copyOf(events);
        return block;
    }

    /** Same contents with a different nonce, hash recomputed. */
    public Block withNonce(long newNonce, String newHash) {
        Block block = new Block(index, timestamp, serializedTransactions, previousHash, newNonce, newHash);
        block.transactions = this.transactions;
        return block;
    }

    public long index() { return index; }
    public long timestamp() { return timestamp; }
    public String serializedTransactions() { return serializedTransactions; }
    public String previousHash() { return previousHash; }
    public long nonce() { return nonce; }
    public String hash() { return hash; }

    public boolean isGenesis() { return index == 0; }

    /** Decoded events; throws IllegalArgumentException if the stored JSON is malformed. */
    public List<AuditEvent> transactions() {
        List<AuditEvent> txs = transactions;
        if (txs == null) {
            txs = List.copyOf(EventCodec.parseAll(serializedTransactions));
            transactions = txs;
        }
        return txs;
    }

    public String computeHash() {
        return Hashes.blockHash(index, timestamp, serializedTransactions, previousHash, nonce);
    }

    @Override public String toString() {
        return "Block{index=" + index + ", hash=" + hash.substring(0, Math.min(12, hash.length())) + "...}";
    }
}
