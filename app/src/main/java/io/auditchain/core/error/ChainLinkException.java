package io.auditchain.core.error;

/**
 * Thrown when a block offered to the store does not extend the current tip.
 */
public class ChainLinkException extends PersistenceException {

    public static final String ERROR_CODE = "CHAIN_LINK_REJECTED";

    public ChainLinkException(String message) {
        super(ERROR_CODE, message);
    }
}
