package com.printdesk.jobcore.api.dto;

import com.printdesk.jobcore.model.Job;
import com.printdesk.jobcore.model.JobStatus;
import com.printdesk.jobcore.model.Pathway;
import com.printdesk.jobcore.model.RoutingType;
import com.printdesk.jobcore.model.SpecFields;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /jobs, GET /jobs/{id} and POST /jobs/{id}/activate.
 */
public record JobResponse(
        UUID        id,
        String      title,
        String      customerId,
        String      baseJobId,
        long        masterSeq,
        String      jobTypeCode,
        Integer     effectiveCoVersion,
        JobStatus   status,
        Pathway     pathway,
        RoutingType routingType,
        SpecFields  specs,
        Instant     createdAt,
        Instant     updatedAt
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.getId(),
                job.getTitle(),
                job.getCustomerId(),
                job.getBaseJobId(),
                job.getMasterSeq(),
                job.getJobTypeCode(),
                job.getEffectiveCoVersion(),
                job.getStatus(),
                job.getPathway(),
                job.getRoutingType(),
                job.getSpecs(),
                job.getCreatedAt(),
                job.getUpdatedAt()
        );
    }
}
