package com.printdesk.jobcore.error;

/**
 * Raised when single-open-per-job is enforced and the job already has a
 * DRAFT or PENDING_APPROVAL change order.
 */
public class OpenChangeOrderExistsException extends JobCoreException {

    public OpenChangeOrderExistsException(String baseJobId) {
        super(Kind.OPEN_CHANGE_ORDER,
                "Job " + baseJobId + " already has an open change order; approve, reject or delete it first");
    }
}
