package io.auditchain.core.error;

/**
 * Thrown when the durable append to the pending pool fails. Transient: the caller may retry,
 * duplicates are dropped by event id.
 */
public class QueueWriteException extends LedgerException {

    public static final String ERROR_CODE = "QUEUE_WRITE_FAILED";

    public QueueWriteException(String eventId, Throwable cause) {
        super(ERROR_CODE, String.format("Failed to queue event '%s'", eventId), cause);
    }
}
