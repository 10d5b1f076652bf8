package com.printdesk.jobcore.model;

/**
 * Approval state of a ChangeOrder.
 *
 * Transitions:
 *   DRAFT            → PENDING_APPROVAL (submit)
 *   PENDING_APPROVAL → DRAFT            (withdraw)
 *   PENDING_APPROVAL → APPROVED         (approve)
 *   PENDING_APPROVAL → REJECTED         (reject)
 *   DRAFT            → APPROVED         (approve, only when direct approval is enabled)
 *
 * APPROVED and REJECTED are terminal: the record is never edited or deleted again.
 */
public enum ChangeOrderStatus {
    DRAFT,
    PENDING_APPROVAL,
    APPROVED,
    REJECTED;

    /** DRAFT and PENDING_APPROVAL change orders are still "open". */
    public boolean isOpen() {
        return this == DRAFT || this == PENDING_APPROVAL;
    }

    public boolean isTerminal() {
        return this == APPROVED || this == REJECTED;
    }
}
