package com.printdesk.jobcore.service;

import com.printdesk.jobcore.component.JobClassification;
import com.printdesk.jobcore.model.RoutingType;
import com.printdesk.jobcore.model.SpecFields;

import java.util.List;

/**
 * Everything needed to open a new job.
 *
 * Required: title
 * Optional:
 *   jobTypeCode     derived from the classification when absent
 *   classification  UNCLASSIFIED when absent
 *   routingType     THIRD_PARTY_VENDOR when absent
 *   components      the suggestion engine's list is seeded when null;
 *                   an explicit (possibly legacy) list replaces it
 */
public record CreateJobCommand(
        String              title,
        String              customerId,
        String              jobTypeCode,
        JobClassification   classification,
        RoutingType         routingType,
        SpecFields          specs,
        List<NewComponent>  components
) {

    public static CreateJobCommand of(String title, JobClassification classification) {
        return new CreateJobCommand(title, null, null, classification, null, null, null);
    }
}
