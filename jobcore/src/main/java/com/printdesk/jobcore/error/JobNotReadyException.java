package com.printdesk.jobcore.error;

import com.printdesk.jobcore.component.ValidationIssue;

import java.util.List;

/**
 * A job cannot leave DRAFT because its component set failed validation.
 */
public class JobNotReadyException extends JobCoreException {

    private final List<ValidationIssue> issues;

    public JobNotReadyException(String baseJobId, List<ValidationIssue> issues) {
        super(Kind.NOT_READY, "Job " + baseJobId + " has " + issues.size()
                + " component issue(s) and cannot leave DRAFT");
        this.issues = List.copyOf(issues);
    }

    public List<ValidationIssue> getIssues() { return issues; }
}
