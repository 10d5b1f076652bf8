package com.printdesk.jobcore.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One production step of a Job (print, proof, data, mailing, ...).
 *
 * Components are seeded from the suggestion engine when the job is created
 * and displayed/executed in {@code sortOrder}.
 *
 * DB table: component  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "component")
public class JobComponent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "job_id", nullable = false, updatable = false)
    private Job job;

    @Column(name = "job_id", insertable = false, updatable = false)
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ComponentType type;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ComponentOwner owner = ComponentOwner.INTERNAL;

    // Required when owner = VENDOR (checked by ComponentValidator, not by the DB).
    @Column(name = "vendor_id")
    private String vendorId;

    @Column(name = "artwork_required", nullable = false)
    private boolean artworkRequired;

    @Column(name = "data_required", nullable = false)
    private boolean dataRequired;

    @Column(name = "sort_order", nullable = false)
    private int sortOrder;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ComponentStatus status = ComponentStatus.PENDING;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected JobComponent() {}   // required by JPA

    public JobComponent(Job job, ComponentType type, String name, int sortOrder) {
        this.job       = job;
        this.jobId     = job.getId();
        this.type      = type;
        this.name      = name;
        this.sortOrder = sortOrder;
    }

    public UUID            getId()              { return id; }
    public Job             getJob()             { return job; }
    public UUID            getJobId()           { return jobId; }
    public ComponentType   getType()            { return type; }
    public String          getName()            { return name; }
    public String          getDescription()     { return description; }
    public ComponentOwner  getOwner()           { return owner; }
    public String          getVendorId()        { return vendorId; }
    public boolean         isArtworkRequired()  { return artworkRequired; }
    public boolean         isDataRequired()     { return dataRequired; }
    public int             getSortOrder()       { return sortOrder; }
    public ComponentStatus getStatus()          { return status; }
    public Instant         getCreatedAt()       { return createdAt; }

    public void setDescription(String description)   { this.description = description; }
    public void setOwner(ComponentOwner owner)        { this.owner = owner; }
    public void setVendorId(String vendorId)          { this.vendorId = vendorId; }
    public void setArtworkRequired(boolean v)         { this.artworkRequired = v; }
    public void setDataRequired(boolean v)            { this.dataRequired = v; }
    public void setStatus(ComponentStatus status)     { this.status = status; }
}
