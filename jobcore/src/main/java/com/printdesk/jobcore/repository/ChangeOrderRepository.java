package com.printdesk.jobcore.repository;

import com.printdesk.jobcore.model.ChangeOrder;
import com.printdesk.jobcore.model.ChangeOrderStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + versioning queries for the change_order table.
 */
public interface ChangeOrderRepository extends JpaRepository<ChangeOrder, UUID> {

    /**
     * Lock a single change order for a state transition.
     * Lock order is always change order first, then its job.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM ChangeOrder c WHERE c.id = :id")
    Optional<ChangeOrder> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Highest version allocated so far for a job (0 when it has none).
     * Only meaningful while the caller holds the job row lock.
     */
    @Query("SELECT COALESCE(MAX(c.version), 0) FROM ChangeOrder c WHERE c.jobId = :jobId")
    int findMaxVersion(@Param("jobId") UUID jobId);

    /** Full history of a job, newest first. */
    List<ChangeOrder> findByJobIdOrderByVersionDesc(UUID jobId);

    /** Change orders of a job in one status, oldest version first. */
    List<ChangeOrder> findByJobIdAndStatusOrderByVersionAsc(UUID jobId, ChangeOrderStatus status);

    long countByJobIdAndStatusIn(UUID jobId, Collection<ChangeOrderStatus> statuses);

    Optional<ChangeOrder> findByJobIdAndVersion(UUID jobId, int version);
}
