package com.printdesk.jobcore.changeorder;

import com.printdesk.jobcore.model.SpecFields;

import java.util.Set;

/**
 * Partial update of a change order: null means "leave as is".
 *
 * {@code version} is accepted only so that an attempt to change it can be
 * rejected explicitly; it is never applied.
 */
public record ChangeOrderEdit(
        String      summary,
        SpecFields  changes,
        Integer     version,
        Set<String> affectsVendors,
        Boolean     requiresNewPo,
        Boolean     requiresReprice
) {

    public static ChangeOrderEdit summary(String summary) {
        return new ChangeOrderEdit(summary, null, null, null, null, null);
    }

    public boolean isEmpty() {
        return summary == null && changes == null && version == null
                && affectsVendors == null && requiresNewPo == null && requiresReprice == null;
    }
}
