package com.printdesk.jobcore.changeorder;

import com.printdesk.jobcore.model.ChangeOrder;
import com.printdesk.jobcore.model.Job;

/**
 * Outcome of an approval: both rows as committed together.
 */
public record ApprovalResult(ChangeOrder changeOrder, Job job) {}
