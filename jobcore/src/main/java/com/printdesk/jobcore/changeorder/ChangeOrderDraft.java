package com.printdesk.jobcore.changeorder;

import com.printdesk.jobcore.model.SpecFields;

import java.util.Set;

/**
 * Content of a new change order. Version and number are never supplied by
 * the caller; they come from ChangeOrderAllocator.
 */
public record ChangeOrderDraft(
        String      summary,
        SpecFields  changes,
        Set<String> affectsVendors,
        boolean     requiresNewPo,
        boolean     requiresReprice
) {

    public static ChangeOrderDraft of(String summary, SpecFields changes) {
        return new ChangeOrderDraft(summary, changes, Set.of(), false, false);
    }
}
