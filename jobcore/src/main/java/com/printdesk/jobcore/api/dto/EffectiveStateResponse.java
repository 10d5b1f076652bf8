package com.printdesk.jobcore.api.dto;

import com.printdesk.jobcore.changeorder.EffectiveJobState;
import com.printdesk.jobcore.model.SpecFields;

import java.util.UUID;

/**
 * Response body for GET /jobs/{id}/effective-state.
 */
public record EffectiveStateResponse(
        UUID       jobId,
        String     baseJobId,
        Integer    effectiveCoVersion,
        SpecFields baseSpecs,
        SpecFields effectiveSpecs,
        String     latestChangeOrderNo,
        String     latestSummary,
        int        appliedCount
) {
    public static EffectiveStateResponse from(EffectiveJobState s) {
        return new EffectiveStateResponse(
                s.job().getId(),
                s.job().getBaseJobId(),
                s.job().getEffectiveCoVersion(),
                s.baseSpecs(),
                s.effectiveSpecs(),
                s.latestApproved() == null ? null : s.latestApproved().getChangeOrderNo(),
                s.latestApproved() == null ? null : s.latestApproved().getSummary(),
                s.appliedCount()
        );
    }
}
