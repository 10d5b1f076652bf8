package com.printdesk.jobcore.api.dto;

import com.printdesk.jobcore.changeorder.ChangeOrderDraft;
import com.printdesk.jobcore.model.SpecFields;

import java.util.Set;

/**
 * Request body for POST /jobs/{jobId}/change-orders.
 *
 * Required: summary
 * Optional: changes, affectsVendors, requiresNewPO, requiresReprice
 * Version and number are never accepted from the caller.
 */
public record CreateChangeOrderRequest(
        String      summary,
        SpecFields  changes,
        Set<String> affectsVendors,
        Boolean     requiresNewPO,
        Boolean     requiresReprice
) {

    public ChangeOrderDraft toDraft() {
        return new ChangeOrderDraft(
                summary,
                changes,
                affectsVendors == null ? Set.of() : affectsVendors,
                Boolean.TRUE.equals(requiresNewPO),
                Boolean.TRUE.equals(requiresReprice));
    }
}
