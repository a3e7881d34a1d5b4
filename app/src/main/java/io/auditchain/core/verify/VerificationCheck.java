package io.auditchain.core.verify;

/** Which invariant a verification run found broken, in the order they are checked per block. */
public enum VerificationCheck {
    /** Stored hash differs from the hash recomputed over the block contents. */
    HASH_MISMATCH,
    /** Hash lacks the required leading zero digits. */
    DIFFICULTY,
    /** previous_hash does not match the predecessor (or the genesis constant for block 0). */
    LINKAGE,
    /** Oldest retained block of a pruned chain does not match the recorded checkpoint. */
    CHECKPOINT,
    /** A block is missing or out of sequence. */
    INDEX_GAP,
    /** A stored block or its transaction list cannot be decoded. */
    MALFORMED
}
