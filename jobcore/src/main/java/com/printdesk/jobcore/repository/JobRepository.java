package com.printdesk.jobcore.repository;

import com.printdesk.jobcore.model.Job;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + locking queries for the job table.
 */
public interface JobRepository extends JpaRepository<Job, UUID> {

    /**
     * Load a job with SELECT ... FOR UPDATE.
     *
     * The job row is the serialization point for everything that has to be
     * consistent per job: change-order version allocation and the
     * effectiveCoVersion pointer. Concurrent callers block here until the
     * holder commits, then see its writes.
     *
     * Must run inside a @Transactional method.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") UUID id);

    Optional<Job> findByBaseJobId(String baseJobId);
}
