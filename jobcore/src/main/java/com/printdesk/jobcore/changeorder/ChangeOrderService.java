package com.printdesk.jobcore.changeorder;

import com.printdesk.jobcore.error.InvalidRequestException;
import com.printdesk.jobcore.error.NotFoundException;
import com.printdesk.jobcore.error.OpenChangeOrderExistsException;
import com.printdesk.jobcore.model.ChangeOrder;
import com.printdesk.jobcore.model.ChangeOrderStatus;
import com.printdesk.jobcore.model.Job;
import com.printdesk.jobcore.model.SpecFields;
import com.printdesk.jobcore.numbering.ChangeOrderAllocator;
import com.printdesk.jobcore.numbering.ChangeOrderNumber;
import com.printdesk.jobcore.numbering.JobIdFormat;
import com.printdesk.jobcore.numbering.SequenceTransactions;
import com.printdesk.jobcore.repository.ChangeOrderRepository;
import com.printdesk.jobcore.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Entry point for everything a caller does with change orders.
 *
 * Creation is the only operation that allocates, so it alone runs through
 * {@link SequenceTransactions}. State changes are delegated to
 * {@link ChangeOrderStateMachine}.
 */
@Service
public class ChangeOrderService {

    private static final Logger log = LoggerFactory.getLogger(ChangeOrderService.class);

    private static final EnumSet<ChangeOrderStatus> OPEN = EnumSet.noneOf(ChangeOrderStatus.class);

    static {
        for (ChangeOrderStatus status : ChangeOrderStatus.values()) {
            if (status.isOpen()) OPEN.add(status);
        }
    }

    private final SequenceTransactions    sequenceTransactions;
    private final ChangeOrderAllocator    allocator;
    private final ChangeOrderStateMachine stateMachine;
    private final ChangeOrderRepository   changeOrderRepo;
    private final JobRepository           jobRepo;
    private final JobIdFormat             jobIdFormat;
    private final boolean                 singleOpenPerJob;

    public ChangeOrderService(
            SequenceTransactions sequenceTransactions,
            ChangeOrderAllocator allocator,
            ChangeOrderStateMachine stateMachine,
            ChangeOrderRepository changeOrderRepo,
            JobRepository jobRepo,
            JobIdFormat jobIdFormat,
            @Value("${printdesk.change-orders.single-open-per-job:false}") boolean singleOpenPerJob) {
        this.sequenceTransactions = sequenceTransactions;
        this.allocator            = allocator;
        this.stateMachine         = stateMachine;
        this.changeOrderRepo      = changeOrderRepo;
        this.jobRepo              = jobRepo;
        this.jobIdFormat          = jobIdFormat;
        this.singleOpenPerJob     = singleOpenPerJob;
    }

    // ------------------------------------------------------------------
    // Creation
    // ------------------------------------------------------------------

    /**
     * Allocate the next version for the job and insert a DRAFT change order
     * with it, in one transaction. Retried as a whole on a sequence conflict.
     *
     * @throws NotFoundException               if the job does not exist
     * @throws InvalidRequestException         if the summary is blank
     * @throws OpenChangeOrderExistsException  if single-open-per-job is on and
     *                                         the job already has an open one
     */
    public ChangeOrder create(UUID jobId, ChangeOrderDraft draft) {
        Objects.requireNonNull(draft, "draft");
        if (draft.summary() == null || draft.summary().isBlank()) {
            throw new InvalidRequestException("Summary is required");
        }

        ChangeOrder created = sequenceTransactions.execute("change-order", () -> {
            ChangeOrderNumber next = allocator.allocateNext(jobId);
            // Already loaded and locked by the allocator in this transaction.
            Job job = jobRepo.getReferenceById(jobId);

            if (singleOpenPerJob && changeOrderRepo.countByJobIdAndStatusIn(jobId, OPEN) > 0) {
                throw new OpenChangeOrderExistsException(job.getBaseJobId());
            }

            ChangeOrder co = new ChangeOrder(job, next.version(), next.changeOrderNo(),
                    draft.summary(), draft.changes());
            co.setAffectsVendors(draft.affectsVendors());
            co.setRequiresNewPo(draft.requiresNewPo());
            co.setRequiresReprice(draft.requiresReprice());
            return changeOrderRepo.save(co);
        });

        log.info("Change order {} created for job {} (v{})",
                created.getChangeOrderNo(), jobId, created.getVersion());
        return created;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /** Full history of a job, newest version first. */
    @Transactional(readOnly = true)
    public List<ChangeOrder> listForJob(UUID jobId) {
        if (!jobRepo.existsById(jobId)) {
            throw new NotFoundException("Job", jobId);
        }
        return changeOrderRepo.findByJobIdOrderByVersionDesc(jobId);
    }

    @Transactional(readOnly = true)
    public ChangeOrder findById(UUID changeOrderId) {
        return changeOrderRepo.findById(changeOrderId)
                .orElseThrow(() -> new NotFoundException("Change order", changeOrderId));
    }

    /**
     * Look up a change order by its number, e.g. "BK000001-CO2".
     *
     * @throws InvalidRequestException if the number is malformed
     */
    @Transactional(readOnly = true)
    public ChangeOrder findByNumber(String changeOrderNo) {
        JobIdFormat.ParsedChangeOrderNo parsed = jobIdFormat.parseChangeOrderNo(changeOrderNo)
                .orElseThrow(() -> new InvalidRequestException(
                        "Malformed change order number: '" + changeOrderNo + "'"));

        Job job = jobRepo.findByBaseJobId(parsed.baseJobId())
                .orElseThrow(() -> new NotFoundException("Change order", changeOrderNo));
        return changeOrderRepo.findByJobIdAndVersion(job.getId(), parsed.version())
                .orElseThrow(() -> new NotFoundException("Change order", changeOrderNo));
    }

    /**
     * Base specs of the job with every APPROVED change order applied in
     * ascending version order.
     */
    @Transactional(readOnly = true)
    public EffectiveJobState effectiveState(UUID jobId) {
        Job job = jobRepo.findById(jobId)
                .orElseThrow(() -> new NotFoundException("Job", jobId));
        List<ChangeOrder> approved =
                changeOrderRepo.findByJobIdAndStatusOrderByVersionAsc(jobId, ChangeOrderStatus.APPROVED);

        SpecFields effective = job.getSpecs();
        for (ChangeOrder co : approved) {
            effective = effective.apply(co.getChanges());
        }

        ChangeOrder latest = null;
        if (job.getEffectiveCoVersion() != null) {
            int pointer = job.getEffectiveCoVersion();
            latest = approved.stream()
                    .filter(co -> co.getVersion() == pointer)
                    .findFirst()
                    .orElse(null);
        }
        return new EffectiveJobState(job, job.getSpecs(), effective, latest, approved.size());
    }

    // ------------------------------------------------------------------
    // Workflow
    // ------------------------------------------------------------------

    public ChangeOrder updateDraft(UUID changeOrderId, ChangeOrderEdit edit) {
        return stateMachine.update(changeOrderId, edit);
    }

    public ChangeOrder submitForApproval(UUID changeOrderId) {
        return stateMachine.submit(changeOrderId);
    }

    public ChangeOrder withdraw(UUID changeOrderId) {
        return stateMachine.withdraw(changeOrderId);
    }

    public ApprovalResult approve(UUID changeOrderId, String approverId) {
        return stateMachine.approve(changeOrderId, approverId);
    }

    public ChangeOrder reject(UUID changeOrderId, String reason) {
        return stateMachine.reject(changeOrderId, reason);
    }

    public void deleteDraft(UUID changeOrderId) {
        stateMachine.delete(changeOrderId);
    }
}
