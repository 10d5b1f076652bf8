package com.printdesk.jobcore.service;

import com.printdesk.jobcore.component.ComponentDefaults;
import com.printdesk.jobcore.component.ComponentLine;
import com.printdesk.jobcore.component.ComponentSuggestionEngine;
import com.printdesk.jobcore.component.ComponentTypes;
import com.printdesk.jobcore.component.ComponentValidator;
import com.printdesk.jobcore.component.JobClassification;
import com.printdesk.jobcore.component.SuggestedComponent;
import com.printdesk.jobcore.component.ValidationIssue;
import com.printdesk.jobcore.error.InvalidRequestException;
import com.printdesk.jobcore.error.InvalidTransitionException;
import com.printdesk.jobcore.error.JobNotReadyException;
import com.printdesk.jobcore.error.NotFoundException;
import com.printdesk.jobcore.model.ComponentOwner;
import com.printdesk.jobcore.model.ComponentType;
import com.printdesk.jobcore.model.Job;
import com.printdesk.jobcore.model.JobComponent;
import com.printdesk.jobcore.model.JobStatus;
import com.printdesk.jobcore.model.Pathway;
import com.printdesk.jobcore.model.RoutingType;
import com.printdesk.jobcore.numbering.JobIdentifierAllocator;
import com.printdesk.jobcore.numbering.JobIdentifiers;
import com.printdesk.jobcore.numbering.JobTypeCodes;
import com.printdesk.jobcore.numbering.SequenceTransactions;
import com.printdesk.jobcore.repository.JobComponentRepository;
import com.printdesk.jobcore.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Job creation and release from DRAFT.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    // Column widths in V1__init.sql
    static final int MAX_TEXT_LENGTH      = 255;
    static final int MAX_TYPE_CODE_LENGTH = 16;

    private final SequenceTransactions      sequenceTransactions;
    private final JobIdentifierAllocator    identifierAllocator;
    private final ComponentSuggestionEngine suggestionEngine;
    private final ComponentValidator        validator;
    private final JobRepository             jobRepo;
    private final JobComponentRepository    componentRepo;

    public JobService(SequenceTransactions sequenceTransactions,
                      JobIdentifierAllocator identifierAllocator,
                      ComponentSuggestionEngine suggestionEngine,
                      ComponentValidator validator,
                      JobRepository jobRepo,
                      JobComponentRepository componentRepo) {
        this.sequenceTransactions = sequenceTransactions;
        this.identifierAllocator  = identifierAllocator;
        this.suggestionEngine     = suggestionEngine;
        this.validator            = validator;
        this.jobRepo              = jobRepo;
        this.componentRepo        = componentRepo;
    }

    // ------------------------------------------------------------------
    // Job creation
    // ------------------------------------------------------------------

    /**
     * Create a new job in DRAFT.
     *
     * Steps, all in one transaction (retried as a whole on a sequence conflict):
     *  1. Draw the next masterSeq and build the baseJobId
     *  2. Save the Job row with its classification, routing and pathway
     *  3. Seed its components (suggested defaults, or the caller's list)
     *
     * The counter increment and the job insert commit together, so a failed
     * creation never burns a sequence value.
     */
    public Job createJob(CreateJobCommand cmd) {
        if (cmd == null || cmd.title() == null || cmd.title().isBlank()) {
            throw new InvalidRequestException("title is required");
        }
        requireMaxLength("title", cmd.title(), MAX_TEXT_LENGTH);
        requireMaxLength("customerId", cmd.customerId(), MAX_TEXT_LENGTH);
        requireMaxLength("jobTypeCode", cmd.jobTypeCode(), MAX_TYPE_CODE_LENGTH);
        JobClassification classification =
                cmd.classification() == null ? JobClassification.UNCLASSIFIED : cmd.classification();
        String jobTypeCode = cmd.jobTypeCode() == null || cmd.jobTypeCode().isBlank()
                ? JobTypeCodes.derive(classification)
                : cmd.jobTypeCode();
        RoutingType routing = cmd.routingType() == null ? RoutingType.THIRD_PARTY_VENDOR : cmd.routingType();

        // Resolve components up front so a bad list fails before anything is allocated.
        List<PlannedComponent> planned = cmd.components() == null
                ? suggestionEngine.suggest(classification).stream().map(PlannedComponent::from).toList()
                : cmd.components().stream().map(PlannedComponent::from).toList();
        Pathway pathway = Pathways.determine(routing,
                planned.stream().map(PlannedComponent::line).toList());

        Job created = sequenceTransactions.execute("master", () -> {
            JobIdentifiers ids = identifierAllocator.allocate(jobTypeCode);

            Job job = new Job(cmd.title(), ids.baseJobId(), ids.masterSeq(), ids.jobTypeCode());
            job.setCustomerId(cmd.customerId());
            job.setJobMetaType(classification.jobMetaType());
            job.setMailFormat(classification.mailFormat());
            job.setJobType(classification.jobType());
            job.setEnvelopeComponents(classification.envelopeComponents());
            job.setRoutingType(routing);
            job.setPathway(pathway);
            job.setSpecs(cmd.specs());
            job = jobRepo.save(job);

            List<JobComponent> components = new ArrayList<>();
            for (int i = 0; i < planned.size(); i++) {
                components.add(planned.get(i).toEntity(job, i));
            }
            componentRepo.saveAll(components);
            return job;
        });

        log.info("Job {} created (masterSeq={}, pathway={}, {} components)",
                created.getBaseJobId(), created.getMasterSeq(), created.getPathway(), planned.size());
        return created;
    }

    // ------------------------------------------------------------------
    // Release
    // ------------------------------------------------------------------

    /**
     * Move a DRAFT job to ACTIVE once its components pass validation.
     *
     * @throws JobNotReadyException       carrying the issues, when validation fails
     * @throws InvalidTransitionException if the job is not DRAFT
     */
    @Transactional
    public Job activate(UUID jobId) {
        Job job = jobRepo.findByIdForUpdate(jobId)
                .orElseThrow(() -> new NotFoundException("Job", jobId));
        if (job.getStatus() != JobStatus.DRAFT) {
            throw InvalidTransitionException.of("activate", job.getBaseJobId(), job.getStatus());
        }

        List<ValidationIssue> issues = validator.validate(
                componentRepo.findByJobIdOrderBySortOrderAsc(jobId).stream()
                        .map(ComponentLine::of)
                        .toList());
        if (!issues.isEmpty()) {
            log.warn("Job {} not activated: {} component issue(s)", job.getBaseJobId(), issues.size());
            throw new JobNotReadyException(job.getBaseJobId(), issues);
        }

        job.setStatus(JobStatus.ACTIVE);
        log.info("Job {} ACTIVE", job.getBaseJobId());
        return job;
    }

    public Optional<Job> findById(UUID id) {
        return jobRepo.findById(id);
    }

    /** Components of a job in sortOrder. */
    @Transactional(readOnly = true)
    public List<JobComponent> getComponents(UUID jobId) {
        return componentRepo.findByJobIdOrderBySortOrderAsc(jobId);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static void requireMaxLength(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new InvalidRequestException(
                    field + " must be at most " + max + " characters, got " + value.length());
        }
    }

    /** A component row about to be inserted, before it has a job. */
    private record PlannedComponent(
            ComponentType  type,
            String         name,
            String         description,
            ComponentOwner owner,
            String         vendorId,
            boolean        artworkRequired,
            boolean        dataRequired
    ) {

        static PlannedComponent from(SuggestedComponent s) {
            return new PlannedComponent(s.type(), s.name(), s.description(), s.owner(), null,
                    s.artworkRequired(), s.dataRequired());
        }

        static PlannedComponent from(NewComponent c) {
            if (c == null || c.name() == null || c.name().isBlank()) {
                throw new InvalidRequestException("Every component needs a name");
            }
            requireMaxLength("component name", c.name(), MAX_TEXT_LENGTH);
            requireMaxLength("component vendorId", c.vendorId(), MAX_TEXT_LENGTH);
            ComponentType type = c.type() != null ? c.type() : ComponentTypes.inferFromName(c.name());
            ComponentOwner owner = c.owner() != null ? c.owner()
                    : ComponentTypes.ownerForLegacySupplier(c.legacySupplier());
            ComponentDefaults defaults = ComponentDefaults.forType(type);
            return new PlannedComponent(type, c.name(), c.description(), owner, c.vendorId(),
                    defaults.artworkRequired(), defaults.dataRequired());
        }

        ComponentLine line() {
            return new ComponentLine(type, name, owner, vendorId);
        }

        JobComponent toEntity(Job job, int sortOrder) {
            JobComponent c = new JobComponent(job, type, name, sortOrder);
            c.setDescription(description);
            c.setOwner(owner);
            c.setVendorId(vendorId);
            c.setArtworkRequired(artworkRequired);
            c.setDataRequired(dataRequired);
            return c;
        }
    }
}
