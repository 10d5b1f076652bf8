package com.printdesk.jobcore.api.dto;

import com.printdesk.jobcore.model.ChangeOrder;
import com.printdesk.jobcore.model.ChangeOrderStatus;
import com.printdesk.jobcore.model.SpecFields;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ChangeOrderResponse(
        UUID              id,
        UUID              jobId,
        int               version,
        String            changeOrderNo,
        String            summary,
        SpecFields        changes,
        ChangeOrderStatus status,
        List<String>      affectsVendors,
        boolean           requiresNewPO,
        boolean           requiresReprice,
        Instant           approvedAt,
        String            approvedBy,
        Instant           rejectedAt,
        String            rejectionReason,
        Instant           createdAt,
        Instant           updatedAt
) {
    public static ChangeOrderResponse from(ChangeOrder co) {
        return new ChangeOrderResponse(
                co.getId(),
                co.getJobId(),
                co.getVersion(),
                co.getChangeOrderNo(),
                co.getSummary(),
                co.getChanges(),
                co.getStatus(),
                co.getAffectsVendors().stream().sorted().toList(),
                co.isRequiresNewPo(),
                co.isRequiresReprice(),
                co.getApprovedAt(),
                co.getApprovedBy(),
                co.getRejectedAt(),
                co.getRejectionReason(),
                co.getCreatedAt(),
                co.getUpdatedAt()
        );
    }
}
