package com.printdesk.jobcore.api.dto;

import com.printdesk.jobcore.component.ValidationIssue;

import java.util.List;

/** Response body for POST /components/validation. */
public record ValidationResponse(boolean valid, List<ValidationIssue> issues) {

    public static ValidationResponse of(List<ValidationIssue> issues) {
        return new ValidationResponse(issues.isEmpty(), issues);
    }
}
