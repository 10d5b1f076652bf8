package com.printdesk.jobcore.changeorder;

import com.printdesk.jobcore.model.ChangeOrder;
import com.printdesk.jobcore.model.ChangeOrderStatus;
import com.printdesk.jobcore.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Moves {@code Job.effectiveCoVersion} to a just-approved change order.
 *
 * Only {@link ChangeOrderStateMachine#approve} calls this, inside its
 * transaction and while it holds the job row lock. A reader therefore never
 * sees an APPROVED change order next to a stale pointer.
 *
 * The pointer takes the approved version even when it is lower than the
 * current one (an older draft approved after a newer one): it tracks the
 * latest approval event, not the highest version.
 */
@Component
class EffectiveVersionResolver {

    private static final Logger log = LoggerFactory.getLogger(EffectiveVersionResolver.class);

    void apply(Job lockedJob, ChangeOrder approved) {
        if (approved.getStatus() != ChangeOrderStatus.APPROVED) {
            throw new IllegalStateException("Change order " + approved.getChangeOrderNo()
                    + " is " + approved.getStatus() + ", not APPROVED");
        }
        if (!lockedJob.getId().equals(approved.getJobId())) {
            throw new IllegalStateException("Change order " + approved.getChangeOrderNo()
                    + " does not belong to job " + lockedJob.getBaseJobId());
        }

        Integer previous = lockedJob.getEffectiveCoVersion();
        lockedJob.setEffectiveCoVersion(approved.getVersion());
        log.info("Job {} effective change order version {} -> {}",
                lockedJob.getBaseJobId(), previous, approved.getVersion());
    }
}
