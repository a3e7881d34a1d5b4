package io.auditchain.core.error;

/**
 * Thrown when the chain store cannot complete a read or commit.
 */
public class PersistenceException extends LedgerException {

    public static final String ERROR_CODE = "PERSISTENCE_FAILED";

    public PersistenceException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }

    protected PersistenceException(String errorCode, String message) {
        super(errorCode, message);
    }
}
