package com.printdesk.jobcore.error;

/**
 * Base class for every failure this service reports to its callers.
 *
 * Unchecked, and always scoped to the single requested operation: the
 * surrounding transaction rolls back and nothing else is affected.
 * {@link Kind} drives the HTTP mapping in ApiExceptionHandler.
 */
public class JobCoreException extends RuntimeException {

    public enum Kind {
        NOT_FOUND,
        INVALID_REQUEST,
        INVALID_TRANSITION,
        IMMUTABLE_RECORD,
        SEQUENCE_CONFLICT,
        OPEN_CHANGE_ORDER,
        NOT_READY
    }

    private final Kind kind;

    public JobCoreException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public JobCoreException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
