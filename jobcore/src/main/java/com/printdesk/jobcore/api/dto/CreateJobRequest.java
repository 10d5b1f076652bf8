package com.printdesk.jobcore.api.dto;

import com.printdesk.jobcore.component.JobClassification;
import com.printdesk.jobcore.model.ComponentOwner;
import com.printdesk.jobcore.model.ComponentType;
import com.printdesk.jobcore.model.JobMetaType;
import com.printdesk.jobcore.model.JobType;
import com.printdesk.jobcore.model.MailFormat;
import com.printdesk.jobcore.model.RoutingType;
import com.printdesk.jobcore.model.SpecFields;
import com.printdesk.jobcore.service.CreateJobCommand;
import com.printdesk.jobcore.service.NewComponent;

import java.util.List;

/**
 * Request body for POST /jobs.
 *
 * Required: title
 * Optional: everything else. jobTypeCode is derived from the classification
 *   fields unless given explicitly; components are suggested unless given.
 */
public record CreateJobRequest(
        String             title,
        String             customerId,
        String             jobTypeCode,
        JobMetaType        jobMetaType,
        MailFormat         mailFormat,
        JobType            jobType,
        Integer            envelopeComponents,
        boolean            hasSamples,
        boolean            hasData,
        boolean            hasVersions,
        RoutingType        routingType,
        SpecFields         specs,
        List<ComponentRow> components
) {

    /** One caller-supplied component; {@code supplier} is the legacy supplier code. */
    public record ComponentRow(
            ComponentType  type,
            String         name,
            String         description,
            ComponentOwner owner,
            String         vendorId,
            String         supplier
    ) {
        NewComponent toNewComponent() {
            return new NewComponent(type, name, description, owner, vendorId, supplier);
        }
    }

    public CreateJobCommand toCommand() {
        JobClassification classification = new JobClassification(
                jobMetaType, mailFormat, jobType, envelopeComponents, hasSamples, hasData, hasVersions);
        return new CreateJobCommand(
                title,
                customerId,
                jobTypeCode,
                classification,
                routingType,
                specs,
                components == null ? null : components.stream().map(ComponentRow::toNewComponent).toList());
    }
}
