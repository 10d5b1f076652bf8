package com.printdesk.jobcore.component;

import com.printdesk.jobcore.model.ComponentOwner;
import com.printdesk.jobcore.model.ComponentType;
import com.printdesk.jobcore.model.JobComponent;

/**
 * The fields of a component that validation looks at. Built from persisted
 * JobComponents or taken straight from a request body; any field may be null.
 */
public record ComponentLine(
        ComponentType  type,
        String         name,
        ComponentOwner owner,
        String         vendorId
) {

    public static ComponentLine of(JobComponent c) {
        return new ComponentLine(c.getType(), c.getName(), c.getOwner(), c.getVendorId());
    }

    public static ComponentLine of(SuggestedComponent s) {
        return new ComponentLine(s.type(), s.name(), s.owner(), null);
    }
}
