package com.printdesk.jobcore.changeorder;

import com.printdesk.jobcore.error.ImmutableRecordException;
import com.printdesk.jobcore.error.InvalidRequestException;
import com.printdesk.jobcore.error.InvalidTransitionException;
import com.printdesk.jobcore.error.NotFoundException;
import com.printdesk.jobcore.model.ChangeOrder;
import com.printdesk.jobcore.model.ChangeOrderStatus;
import com.printdesk.jobcore.model.Job;
import com.printdesk.jobcore.repository.ChangeOrderRepository;
import com.printdesk.jobcore.repository.JobRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Approval workflow of a change order.
 *
 * <pre>
 *   DRAFT ──submit──▶ PENDING_APPROVAL ──approve──▶ APPROVED
 *     ▲                  │        └─────reject───▶ REJECTED
 *     └────withdraw──────┘
 * </pre>
 *
 * Only DRAFT records can be edited or deleted. APPROVED and REJECTED records
 * are the job's audit trail and are never modified again.
 *
 * Every transition locks the change order row first and, where the job is
 * involved, the job row second. Nothing locks in the opposite order, so
 * transitions cannot deadlock with each other or with ChangeOrderAllocator
 * (which only locks the job).
 */
@Component
public class ChangeOrderStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ChangeOrderStateMachine.class);

    private static final Map<ChangeOrderStatus, Set<ChangeOrderStatus>> TRANSITIONS =
            new EnumMap<>(ChangeOrderStatus.class);

    static {
        TRANSITIONS.put(ChangeOrderStatus.DRAFT,
                EnumSet.of(ChangeOrderStatus.PENDING_APPROVAL));
        TRANSITIONS.put(ChangeOrderStatus.PENDING_APPROVAL,
                EnumSet.of(ChangeOrderStatus.DRAFT, ChangeOrderStatus.APPROVED, ChangeOrderStatus.REJECTED));
        TRANSITIONS.put(ChangeOrderStatus.APPROVED, EnumSet.noneOf(ChangeOrderStatus.class));
        TRANSITIONS.put(ChangeOrderStatus.REJECTED, EnumSet.noneOf(ChangeOrderStatus.class));
    }

    private final ChangeOrderRepository    changeOrderRepo;
    private final JobRepository            jobRepo;
    private final EffectiveVersionResolver effectiveVersionResolver;
    private final MeterRegistry            meterRegistry;
    private final boolean                  allowDirectApproval;

    public ChangeOrderStateMachine(
            ChangeOrderRepository changeOrderRepo,
            JobRepository jobRepo,
            EffectiveVersionResolver effectiveVersionResolver,
            MeterRegistry meterRegistry,
            @Value("${printdesk.change-orders.allow-direct-approval:false}") boolean allowDirectApproval) {
        this.changeOrderRepo          = changeOrderRepo;
        this.jobRepo                  = jobRepo;
        this.effectiveVersionResolver = effectiveVersionResolver;
        this.meterRegistry            = meterRegistry;
        this.allowDirectApproval      = allowDirectApproval;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    /** DRAFT → PENDING_APPROVAL. */
    @Transactional
    public ChangeOrder submit(UUID changeOrderId) {
        ChangeOrder co = lock(changeOrderId);
        requireTransition(co, ChangeOrderStatus.PENDING_APPROVAL, "submit");
        co.setStatus(ChangeOrderStatus.PENDING_APPROVAL);
        recorded(co, "submitted");
        return co;
    }

    /** PENDING_APPROVAL → DRAFT, so the record can be edited again. */
    @Transactional
    public ChangeOrder withdraw(UUID changeOrderId) {
        ChangeOrder co = lock(changeOrderId);
        if (co.getStatus() != ChangeOrderStatus.PENDING_APPROVAL) {
            throw InvalidTransitionException.of("withdraw", co.getChangeOrderNo(), co.getStatus());
        }
        co.setStatus(ChangeOrderStatus.DRAFT);
        recorded(co, "withdrawn");
        return co;
    }

    /**
     * PENDING_APPROVAL → APPROVED (or DRAFT → APPROVED when direct approval
     * is enabled), and move the job's effective version to this change order.
     * Both rows are written in this one transaction.
     */
    @Transactional
    public ApprovalResult approve(UUID changeOrderId, String approverId) {
        if (approverId == null || approverId.isBlank()) {
            throw new InvalidRequestException("approvedBy is required");
        }
        ChangeOrder co = lock(changeOrderId);
        boolean direct = allowDirectApproval && co.getStatus() == ChangeOrderStatus.DRAFT;
        if (!direct) {
            requireTransition(co, ChangeOrderStatus.APPROVED, "approve");
        }

        Job job = jobRepo.findByIdForUpdate(co.getJobId())
                .orElseThrow(() -> new NotFoundException("Job", co.getJobId()));

        co.markApproved(approverId, Instant.now());
        effectiveVersionResolver.apply(job, co);
        recorded(co, direct ? "approved directly by " + approverId : "approved by " + approverId);
        return new ApprovalResult(co, job);
    }

    /** PENDING_APPROVAL → REJECTED. The job's effective version is not touched. */
    @Transactional
    public ChangeOrder reject(UUID changeOrderId, String reason) {
        ChangeOrder co = lock(changeOrderId);
        requireTransition(co, ChangeOrderStatus.REJECTED, "reject");
        co.markRejected(reason == null || reason.isBlank() ? null : reason, Instant.now());
        recorded(co, "rejected");
        return co;
    }

    // ------------------------------------------------------------------
    // Draft editing
    // ------------------------------------------------------------------

    /**
     * Apply a partial edit to a DRAFT change order.
     *
     * @throws ImmutableRecordException   if the record is APPROVED or REJECTED
     * @throws InvalidTransitionException if it is PENDING_APPROVAL (withdraw first)
     * @throws InvalidRequestException    if the edit tries to move the version
     *                                    or blanks the summary
     */
    @Transactional
    public ChangeOrder update(UUID changeOrderId, ChangeOrderEdit edit) {
        ChangeOrder co = lock(changeOrderId);

        if (co.getStatus().isTerminal()) {
            throw new ImmutableRecordException(co.getChangeOrderNo(), co.getStatus());
        }
        if (co.getStatus() != ChangeOrderStatus.DRAFT) {
            throw new InvalidTransitionException("Cannot update " + co.getChangeOrderNo()
                    + " while it is " + co.getStatus() + "; withdraw it to DRAFT first");
        }
        if (edit == null || edit.isEmpty()) {
            return co;
        }
        if (edit.version() != null && edit.version() != co.getVersion()) {
            throw new InvalidRequestException("version of " + co.getChangeOrderNo()
                    + " is assigned at creation and cannot be changed");
        }
        if (edit.summary() != null) {
            if (edit.summary().isBlank()) throw new InvalidRequestException("Summary cannot be blank");
            co.setSummary(edit.summary());
        }
        if (edit.changes() != null)         co.setChanges(edit.changes());
        if (edit.affectsVendors() != null)  co.setAffectsVendors(edit.affectsVendors());
        if (edit.requiresNewPo() != null)   co.setRequiresNewPo(edit.requiresNewPo());
        if (edit.requiresReprice() != null) co.setRequiresReprice(edit.requiresReprice());

        log.info("Change order {} updated", co.getChangeOrderNo());
        return co;
    }

    /**
     * Delete a DRAFT change order. Only the job's highest version may go,
     * otherwise the version sequence would get a hole.
     */
    @Transactional
    public void delete(UUID changeOrderId) {
        ChangeOrder co = lock(changeOrderId);
        if (co.getStatus() != ChangeOrderStatus.DRAFT) {
            throw InvalidTransitionException.of("delete", co.getChangeOrderNo(), co.getStatus());
        }

        // Hold the job lock so no new version is allocated while we check.
        jobRepo.findByIdForUpdate(co.getJobId())
                .orElseThrow(() -> new NotFoundException("Job", co.getJobId()));
        int latest = changeOrderRepo.findMaxVersion(co.getJobId());
        if (co.getVersion() != latest) {
            throw new InvalidTransitionException("Cannot delete " + co.getChangeOrderNo()
                    + ": only the latest version (CO" + latest + ") can be deleted");
        }

        changeOrderRepo.delete(co);
        log.info("Change order {} deleted", co.getChangeOrderNo());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ChangeOrder lock(UUID changeOrderId) {
        return changeOrderRepo.findByIdForUpdate(changeOrderId)
                .orElseThrow(() -> new NotFoundException("Change order", changeOrderId));
    }

    private static void requireTransition(ChangeOrder co, ChangeOrderStatus target, String operation) {
        if (!TRANSITIONS.get(co.getStatus()).contains(target)) {
            throw InvalidTransitionException.of(operation, co.getChangeOrderNo(), co.getStatus());
        }
    }

    private void recorded(ChangeOrder co, String what) {
        meterRegistry.counter("printdesk.change_order.transitions", "to", co.getStatus().name()).increment();
        log.info("Change order {} (job {}, v{}) {}",
                co.getChangeOrderNo(), co.getJobId(), co.getVersion(), what);
    }
}
