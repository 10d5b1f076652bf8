package com.printdesk.jobcore.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.printdesk.jobcore.component.ValidationIssue;

import java.util.List;

/**
 * Error envelope returned for every failed request:
 *   {"error": "Conflict", "code": "INVALID_TRANSITION", "message": "..."}
 * {@code issues} is only present for NOT_READY.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String                error,
        String                code,
        String                message,
        List<ValidationIssue> issues
) {
    public static ErrorResponse of(String error, String code, String message) {
        return new ErrorResponse(error, code, message, null);
    }
}
