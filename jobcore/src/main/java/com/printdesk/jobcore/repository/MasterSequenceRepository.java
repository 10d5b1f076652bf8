package com.printdesk.jobcore.repository;

import com.printdesk.jobcore.model.MasterSequence;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Access to the master_sequence counter row.
 */
public interface MasterSequenceRepository extends JpaRepository<MasterSequence, String> {

    /**
     * SELECT ... FOR UPDATE on the counter row. The lock is held until the
     * surrounding transaction (which also inserts the Job) commits.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM MasterSequence s WHERE s.id = :id")
    Optional<MasterSequence> findByIdForUpdate(@Param("id") String id);
}
