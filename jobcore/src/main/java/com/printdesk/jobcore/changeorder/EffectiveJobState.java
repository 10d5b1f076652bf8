package com.printdesk.jobcore.changeorder;

import com.printdesk.jobcore.model.ChangeOrder;
import com.printdesk.jobcore.model.Job;
import com.printdesk.jobcore.model.SpecFields;

/**
 * A job's specs as production should see them: base specs with the changes
 * of every approved change order applied in version order.
 *
 * @param latestApproved most recently approved change order, or null
 * @param appliedCount   number of approved change orders folded in
 */
public record EffectiveJobState(
        Job         job,
        SpecFields  baseSpecs,
        SpecFields  effectiveSpecs,
        ChangeOrder latestApproved,
        int         appliedCount
) {}
