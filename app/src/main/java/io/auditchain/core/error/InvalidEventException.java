package io.auditchain.core.error;

/**
 * Thrown when an event is malformed or incomplete. Such events never enter the pending pool.
 */
public class InvalidEventException extends LedgerException {

    public static final String ERROR_CODE = "INVALID_EVENT";

    private final String field;

    public InvalidEventException(String field, String message) {
        super(ERROR_CODE, field == null ? message : field + ": " + message);
        this.field = field;
    }

    /** Name of the offending field, or null when the event as a whole was rejected. */
    public String getField() {
        return field;
    }
}
