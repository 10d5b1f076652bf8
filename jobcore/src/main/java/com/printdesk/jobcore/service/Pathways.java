package com.printdesk.jobcore.service;

import com.printdesk.jobcore.component.ComponentLine;
import com.printdesk.jobcore.model.ComponentOwner;
import com.printdesk.jobcore.model.Pathway;
import com.printdesk.jobcore.model.RoutingType;

import java.util.List;
import java.util.Objects;

/**
 * Picks the commercial pathway of a new job.
 *
 *   P1  routed through the partner shop (BRADFORD_JD)
 *   P3  work split across more than one distinct vendor
 *   P2  everything else
 */
final class Pathways {

    private Pathways() {}

    static Pathway determine(RoutingType routingType, List<ComponentLine> components) {
        if (routingType == RoutingType.BRADFORD_JD) return Pathway.P1;

        long vendors = components.stream()
                .filter(c -> c.owner() == ComponentOwner.VENDOR)
                .map(ComponentLine::vendorId)
                .filter(Objects::nonNull)
                .filter(v -> !v.isBlank())
                .distinct()
                .count();
        return vendors > 1 ? Pathway.P3 : Pathway.P2;
    }
}
