package com.printdesk.jobcore;

import com.printdesk.jobcore.model.ChangeOrder;
import com.printdesk.jobcore.model.ChangeOrderStatus;
import com.printdesk.jobcore.model.Job;
import com.printdesk.jobcore.model.SpecFields;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Builds entities for unit tests that never touch a database, setting the
 * generated id by reflection.
 */
public final class TestEntities {

    private TestEntities() {}

    public static Job job(String baseJobId) {
        Job job = new Job("Spring catalog", baseJobId, 1, "BK");
        setId(job, UUID.randomUUID());
        return job;
    }

    public static ChangeOrder changeOrder(Job job, int version, ChangeOrderStatus status) {
        ChangeOrder co = new ChangeOrder(job, version, job.getBaseJobId() + "-CO" + version,
                "Change " + version, SpecFields.of(Map.of("quantity", 5000 + version)));
        setId(co, UUID.randomUUID());
        switch (status) {
            case APPROVED -> co.markApproved("u1", Instant.now());
            case REJECTED -> co.markRejected("too late", Instant.now());
            default       -> co.setStatus(status);
        }
        return co;
    }

    public static <T> T setId(T entity, UUID id) {
        try {
            var f = entity.getClass().getDeclaredField("id");
            f.setAccessible(true);
            f.set(entity, id);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return entity;
    }
}
