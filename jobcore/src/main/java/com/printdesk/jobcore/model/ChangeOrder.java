package com.printdesk.jobcore.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * One versioned modification of a Job.
 *
 * Change orders never overwrite the job's specs; each one carries a delta
 * ({@code changes}) that is layered onto the base specs once approved.
 * {@code version} is allocated under a row lock on the owning job, so the
 * versions of a job always form 1..N with no gaps or duplicates.
 *
 * Once APPROVED or REJECTED the record is part of the job's permanent audit
 * trail: summary, changes and version are never modified again.
 *
 * DB table: change_order  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "change_order",
       uniqueConstraints = @UniqueConstraint(name = "uq_change_order_job_version",
                                             columnNames = {"job_id", "version"}))
public class ChangeOrder {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Many change orders belong to one job.
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "job_id", nullable = false, updatable = false)
    private Job job;

    // Read-only mirror of the FK so callers can get the job id without touching the proxy.
    @Column(name = "job_id", insertable = false, updatable = false)
    private UUID jobId;

    @Column(nullable = false, updatable = false)
    private int version;

    @Column(name = "change_order_no", nullable = false, unique = true, updatable = false, length = 48)
    private String changeOrderNo;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String summary;

    @Convert(converter = SpecFieldsConverter.class)
    @Column(columnDefinition = "TEXT", nullable = false)
    private SpecFields changes = SpecFields.EMPTY;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ChangeOrderStatus status = ChangeOrderStatus.DRAFT;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "change_order_vendor", joinColumns = @JoinColumn(name = "change_order_id"))
    @Column(name = "vendor_id", nullable = false)
    private Set<String> affectsVendors = new LinkedHashSet<>();

    @Column(name = "requires_new_po", nullable = false)
    private boolean requiresNewPo;

    @Column(name = "requires_reprice", nullable = false)
    private boolean requiresReprice;

    // Set only on the transition into APPROVED.
    @Column(name = "approved_at")
    private Instant approvedAt;

    @Column(name = "approved_by")
    private String approvedBy;

    // Set only on the transition into REJECTED.
    @Column(name = "rejected_at")
    private Instant rejectedAt;

    @Column(name = "rejection_reason", columnDefinition = "TEXT")
    private String rejectionReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected ChangeOrder() {}   // required by JPA

    public ChangeOrder(Job job, int version, String changeOrderNo, String summary, SpecFields changes) {
        this.job           = job;
        this.jobId         = job.getId();
        this.version       = version;
        this.changeOrderNo = changeOrderNo;
        this.summary       = summary;
        this.changes       = changes == null ? SpecFields.EMPTY : changes;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID              getId()              { return id; }
    public Job               getJob()             { return job; }
    public UUID              getJobId()           { return jobId; }
    public int               getVersion()         { return version; }
    public String            getChangeOrderNo()   { return changeOrderNo; }
    public String            getSummary()         { return summary; }
    public SpecFields        getChanges()         { return changes; }
    public ChangeOrderStatus getStatus()          { return status; }
    public Set<String>       getAffectsVendors()  { return affectsVendors; }
    public boolean           isRequiresNewPo()    { return requiresNewPo; }
    public boolean           isRequiresReprice()  { return requiresReprice; }
    public Instant           getApprovedAt()      { return approvedAt; }
    public String            getApprovedBy()      { return approvedBy; }
    public Instant           getRejectedAt()      { return rejectedAt; }
    public String            getRejectionReason() { return rejectionReason; }
    public Instant           getCreatedAt()       { return createdAt; }
    public Instant           getUpdatedAt()       { return updatedAt; }

    // ------------------------------------------------------------------
    // Mutators. Guarded by ChangeOrderStateMachine; callers outside the
    // changeorder package only use them while the record is DRAFT.
    // ------------------------------------------------------------------

    public void setSummary(String summary)          { this.summary = summary; }
    public void setChanges(SpecFields changes)      { this.changes = changes == null ? SpecFields.EMPTY : changes; }
    public void setRequiresNewPo(boolean v)         { this.requiresNewPo = v; }
    public void setRequiresReprice(boolean v)       { this.requiresReprice = v; }
    public void setStatus(ChangeOrderStatus status) { this.status = status; }

    public void setAffectsVendors(Set<String> vendors) {
        this.affectsVendors.clear();
        if (vendors != null) this.affectsVendors.addAll(vendors);
    }

    public void markApproved(String approver, Instant at) {
        this.status     = ChangeOrderStatus.APPROVED;
        this.approvedBy = approver;
        this.approvedAt = at;
    }

    public void markRejected(String reason, Instant at) {
        this.status          = ChangeOrderStatus.REJECTED;
        this.rejectionReason = reason;
        this.rejectedAt      = at;
    }
}
