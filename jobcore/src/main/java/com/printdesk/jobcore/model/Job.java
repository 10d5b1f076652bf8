package com.printdesk.jobcore.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A customer print job.
 *
 * The human-readable identity ({@code baseJobId}, e.g. "BK000001") is assigned
 * once at creation from the global master sequence and never changes. Later
 * modifications are recorded as ChangeOrders; {@code effectiveCoVersion}
 * points at the most recently approved one.
 *
 * DB table: job  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "job")
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String title;

    // Opaque reference into the CRM; this service never dereferences it.
    @Column(name = "customer_id")
    private String customerId;

    @Column(name = "base_job_id", nullable = false, unique = true, updatable = false, length = 32)
    private String baseJobId;

    @Column(name = "master_seq", nullable = false, unique = true, updatable = false)
    private long masterSeq;

    @Column(name = "job_type_code", nullable = false, updatable = false, length = 16)
    private String jobTypeCode;

    // Null until the first change order is approved.
    @Column(name = "effective_co_version")
    private Integer effectiveCoVersion;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.DRAFT;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Pathway pathway = Pathway.P2;

    @Enumerated(EnumType.STRING)
    @Column(name = "routing_type", nullable = false)
    private RoutingType routingType = RoutingType.THIRD_PARTY_VENDOR;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_meta_type")
    private JobMetaType jobMetaType;

    @Enumerated(EnumType.STRING)
    @Column(name = "mail_format")
    private MailFormat mailFormat;

    @Column(name = "envelope_components")
    private Integer envelopeComponents;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type")
    private JobType jobType;

    // Base specs as entered at creation; approved change orders are layered on top.
    @Convert(converter = SpecFieldsConverter.class)
    @Column(columnDefinition = "TEXT", nullable = false)
    private SpecFields specs = SpecFields.EMPTY;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    // Called automatically by JPA before every UPDATE.
    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(String title, String baseJobId, long masterSeq, String jobTypeCode) {
        this.title       = title;
        this.baseJobId   = baseJobId;
        this.masterSeq   = masterSeq;
        this.jobTypeCode = jobTypeCode;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID        getId()                 { return id; }
    public String      getTitle()              { return title; }
    public String      getCustomerId()         { return customerId; }
    public String      getBaseJobId()          { return baseJobId; }
    public long        getMasterSeq()          { return masterSeq; }
    public String      getJobTypeCode()        { return jobTypeCode; }
    public Integer     getEffectiveCoVersion() { return effectiveCoVersion; }
    public JobStatus   getStatus()             { return status; }
    public Pathway     getPathway()            { return pathway; }
    public RoutingType getRoutingType()        { return routingType; }
    public JobMetaType getJobMetaType()        { return jobMetaType; }
    public MailFormat  getMailFormat()         { return mailFormat; }
    public Integer     getEnvelopeComponents() { return envelopeComponents; }
    public JobType     getJobType()            { return jobType; }
    public SpecFields  getSpecs()              { return specs; }
    public Instant     getCreatedAt()          { return createdAt; }
    public Instant     getUpdatedAt()          { return updatedAt; }

    public void setTitle(String title)                    { this.title = title; }
    public void setCustomerId(String customerId)          { this.customerId = customerId; }
    public void setStatus(JobStatus status)               { this.status = status; }
    public void setPathway(Pathway pathway)               { this.pathway = pathway; }
    public void setRoutingType(RoutingType routingType)   { this.routingType = routingType; }
    public void setJobMetaType(JobMetaType v)             { this.jobMetaType = v; }
    public void setMailFormat(MailFormat v)               { this.mailFormat = v; }
    public void setEnvelopeComponents(Integer v)          { this.envelopeComponents = v; }
    public void setJobType(JobType v)                     { this.jobType = v; }
    public void setSpecs(SpecFields specs)                { this.specs = specs == null ? SpecFields.EMPTY : specs; }

    // Only EffectiveVersionResolver moves this pointer, inside the approval transaction.
    public void setEffectiveCoVersion(Integer version)    { this.effectiveCoVersion = version; }
}
