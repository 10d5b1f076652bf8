package com.printdesk.jobcore.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Persisted counter behind {@code Job.masterSeq}.
 *
 * A single row (id = "master-seq") is locked with SELECT FOR UPDATE, bumped
 * and written back inside the transaction that inserts the new Job, so no two
 * jobs can ever receive the same sequence value.
 *
 * DB table: master_sequence  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "master_sequence")
public class MasterSequence {

    public static final String MASTER_ID = "master-seq";

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "current_value", nullable = false)
    private long currentValue;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    protected MasterSequence() {}   // required by JPA

    public MasterSequence(String id, long currentValue) {
        this.id           = id;
        this.currentValue = currentValue;
    }

    public String  getId()           { return id; }
    public long    getCurrentValue() { return currentValue; }
    public Instant getUpdatedAt()    { return updatedAt; }

    /** Advance the counter by one and return the new value. */
    public long next() {
        this.currentValue++;
        this.updatedAt = Instant.now();
        return currentValue;
    }
}
