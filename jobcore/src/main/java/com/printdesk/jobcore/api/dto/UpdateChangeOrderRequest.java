package com.printdesk.jobcore.api.dto;

import com.printdesk.jobcore.changeorder.ChangeOrderEdit;
import com.printdesk.jobcore.model.SpecFields;

import java.util.Set;

/**
 * Request body for PATCH /change-orders/{id}. Absent fields are left unchanged.
 */
public record UpdateChangeOrderRequest(
        String      summary,
        SpecFields  changes,
        Integer     version,
        Set<String> affectsVendors,
        Boolean     requiresNewPO,
        Boolean     requiresReprice
) {

    public ChangeOrderEdit toEdit() {
        return new ChangeOrderEdit(summary, changes, version, affectsVendors, requiresNewPO, requiresReprice);
    }
}
