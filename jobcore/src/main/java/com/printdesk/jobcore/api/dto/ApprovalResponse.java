package com.printdesk.jobcore.api.dto;

import com.printdesk.jobcore.changeorder.ApprovalResult;

/**
 * Response body for POST /change-orders/{id}/approve: the approved change
 * order and the job with its moved effectiveCoVersion.
 */
public record ApprovalResponse(ChangeOrderResponse changeOrder, JobResponse job) {

    public static ApprovalResponse from(ApprovalResult result) {
        return new ApprovalResponse(
                ChangeOrderResponse.from(result.changeOrder()),
                JobResponse.from(result.job()));
    }
}
