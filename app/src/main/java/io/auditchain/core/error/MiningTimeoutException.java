package io.auditchain.core.error;

/**
 * Thrown when a proof-of-work search exhausts its attempt ceiling or wall-clock budget.
 */
public class MiningTimeoutException extends LedgerException {

    public static final String ERROR_CODE = "MINING_TIMEOUT";

    private final long blockIndex;
    private final long attempts;
    private final long elapsedMillis;

    public MiningTimeoutException(long blockIndex, long attempts, long elapsedMillis) {
        super(ERROR_CODE, String.format(
            "Proof-of-work for block %d gave up after %d attempts in %d ms",
            blockIndex, attempts, elapsedMillis
        ));
        this.blockIndex = blockIndex;
        this.attempts = attempts;
        this.elapsedMillis = elapsedMillis;
    }

    public long getBlockIndex() {
        return blockIndex;
    }

    public long getAttempts() {
        return attempts;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }
}
