package io.auditchain.core.error;

import io.auditchain.core.verify.VerificationResult;

/**
 * Thrown when verification finds a tampered or corrupted chain.
 */
public class ChainIntegrityException extends LedgerException {

    public static final String ERROR_CODE = "CHAIN_INTEGRITY";

    private final VerificationResult result;

    public ChainIntegrityException(VerificationResult result) {
        super(ERROR_CODE, String.format(
            "Chain integrity check %s failed at block %d: %s",
            result.failedCheck(), result.failedIndex(), result.message()
        ));
        this.result = result;
    }

    public VerificationResult getResult() {
        return result;
    }
}
