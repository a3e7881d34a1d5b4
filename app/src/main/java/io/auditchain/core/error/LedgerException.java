package io.auditchain.core.error;

/**
 * Base exception for all ledger errors. Carries a stable error code that the
 * admin API reports back to callers.
 */
public class LedgerException extends RuntimeException {

    private final String errorCode;

    public LedgerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public LedgerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
