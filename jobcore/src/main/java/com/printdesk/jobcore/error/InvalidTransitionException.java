package com.printdesk.jobcore.error;

/**
 * An operation was requested against a record whose current status does not
 * permit it, e.g. submitting a change order that is already APPROVED.
 * Reported to the caller as a rejected request; never retried.
 */
public class InvalidTransitionException extends JobCoreException {

    public InvalidTransitionException(String message) {
        super(Kind.INVALID_TRANSITION, message);
    }

    public static InvalidTransitionException of(String operation, String recordNo, Enum<?> status) {
        return new InvalidTransitionException(
                "Cannot " + operation + " " + recordNo + " with status " + status);
    }
}
