package com.printdesk.jobcore.api.dto;

import com.printdesk.jobcore.model.ComponentOwner;
import com.printdesk.jobcore.model.ComponentStatus;
import com.printdesk.jobcore.model.ComponentType;
import com.printdesk.jobcore.model.JobComponent;

import java.util.UUID;

/**
 * Read-only view of a persisted component returned by GET /jobs/{id}/components.
 */
public record ComponentResponse(
        UUID            id,
        ComponentType   type,
        String          name,
        String          description,
        ComponentOwner  owner,
        String          vendorId,
        boolean         artworkRequired,
        boolean         dataRequired,
        int             sortOrder,
        ComponentStatus status
) {
    public static ComponentResponse from(JobComponent c) {
        return new ComponentResponse(
                c.getId(),
                c.getType(),
                c.getName(),
                c.getDescription(),
                c.getOwner(),
                c.getVendorId(),
                c.isArtworkRequired(),
                c.isDataRequired(),
                c.getSortOrder(),
                c.getStatus()
        );
    }
}
