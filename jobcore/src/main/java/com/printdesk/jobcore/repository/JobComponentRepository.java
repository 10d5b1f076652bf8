package com.printdesk.jobcore.repository;

import com.printdesk.jobcore.model.JobComponent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD for the component table.
 */
public interface JobComponentRepository extends JpaRepository<JobComponent, UUID> {

    /** All components of a job in execution order. */
    List<JobComponent> findByJobIdOrderBySortOrderAsc(UUID jobId);
}
