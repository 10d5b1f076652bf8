package com.printdesk.jobcore.error;

/**
 * Attempted to change summary, changes or version of a change order that is
 * APPROVED or REJECTED. Always surfaced; never retried or ignored.
 */
public class ImmutableRecordException extends JobCoreException {

    public ImmutableRecordException(String changeOrderNo, Enum<?> status) {
        super(Kind.IMMUTABLE_RECORD,
                "Change order " + changeOrderNo + " is " + status + " and can no longer be modified");
    }
}
