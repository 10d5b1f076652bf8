package com.printdesk.jobcore.numbering;

import com.printdesk.jobcore.error.NotFoundException;
import com.printdesk.jobcore.model.Job;
import com.printdesk.jobcore.repository.ChangeOrderRepository;
import com.printdesk.jobcore.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Allocates the next {version, changeOrderNo} for an existing job.
 *
 * There is no per-job sequence object, so the job row itself is the lock:
 * <ol>
 *   <li>SELECT ... FOR UPDATE on the job</li>
 *   <li>SELECT MAX(version) over its change orders (0 if none)</li>
 *   <li>version = max + 1</li>
 * </ol>
 * The caller inserts the ChangeOrder in the same transaction. A concurrent
 * allocateNext for the same job blocks at step 1 until that insert commits,
 * then reads the new maximum, so versions stay unique and contiguous. The
 * unique (job_id, version) constraint is the backstop if that ever fails.
 */
@Component
public class ChangeOrderAllocator {

    private static final Logger log = LoggerFactory.getLogger(ChangeOrderAllocator.class);

    private final JobRepository         jobRepo;
    private final ChangeOrderRepository changeOrderRepo;

    public ChangeOrderAllocator(JobRepository jobRepo, ChangeOrderRepository changeOrderRepo) {
        this.jobRepo         = jobRepo;
        this.changeOrderRepo = changeOrderRepo;
    }

    /**
     * @return the next slot; the job stays locked until the caller's transaction ends
     * @throws NotFoundException if the job does not exist
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ChangeOrderNumber allocateNext(UUID jobId) {
        Job job = jobRepo.findByIdForUpdate(jobId)
                .orElseThrow(() -> new NotFoundException("Job", jobId));

        int version = changeOrderRepo.findMaxVersion(jobId) + 1;
        ChangeOrderNumber next = new ChangeOrderNumber(version,
                JobIdFormat.changeOrderNo(job.getBaseJobId(), version));
        log.debug("Allocated change order {} for job {}", next.changeOrderNo(), jobId);
        return next;
    }
}
