package com.printdesk.jobcore.numbering;

/**
 * Next free slot in a job's change-order history.
 *
 * @param version       1-based, contiguous per job
 * @param changeOrderNo "{baseJobId}-CO{version}"
 */
public record ChangeOrderNumber(int version, String changeOrderNo) {}
