package com.printdesk.jobcore.error;

/**
 * A concurrent transaction won the race for a sequence value (master
 * sequence or per-job change-order version).
 *
 * The allocating transaction is retried as a whole; callers only see this
 * exception once the retry budget is exhausted.
 */
public class SequenceConflictException extends JobCoreException {

    private final String sequence;

    public SequenceConflictException(String sequence, String message, Throwable cause) {
        super(Kind.SEQUENCE_CONFLICT, message, cause);
        this.sequence = sequence;
    }

    public String getSequence() { return sequence; }
}
