package com.printdesk.jobcore.api;

import com.printdesk.jobcore.api.dto.ErrorResponse;
import com.printdesk.jobcore.error.JobCoreException;
import com.printdesk.jobcore.error.JobNotReadyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain exceptions to HTTP responses with an {@link ErrorResponse} body.
 *
 *   NOT_FOUND           404
 *   INVALID_REQUEST     400
 *   INVALID_TRANSITION  409
 *   IMMUTABLE_RECORD    409
 *   SEQUENCE_CONFLICT   409  (only after the retry budget is spent)
 *   OPEN_CHANGE_ORDER   409
 *   NOT_READY           422  (with the validation issues)
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(JobCoreException.class)
    public ResponseEntity<ErrorResponse> handle(JobCoreException e) {
        HttpStatus status = statusFor(e.getKind());
        if (status == HttpStatus.CONFLICT) {
            log.warn("Rejected ({}): {}", e.getKind(), e.getMessage());
        }

        ErrorResponse body = e instanceof JobNotReadyException notReady
                ? new ErrorResponse(status.getReasonPhrase(), e.getKind().name(), e.getMessage(),
                        notReady.getIssues())
                : ErrorResponse.of(status.getReasonPhrase(), e.getKind().name(), e.getMessage());
        return ResponseEntity.status(status).body(body);
    }

    // Raised by value types (SpecFields, JobIdFormat) on malformed input.
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(ErrorResponse.of(
                HttpStatus.BAD_REQUEST.getReasonPhrase(), JobCoreException.Kind.INVALID_REQUEST.name(),
                e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(ErrorResponse.of(
                HttpStatus.BAD_REQUEST.getReasonPhrase(), JobCoreException.Kind.INVALID_REQUEST.name(),
                "Malformed request body: " + e.getMostSpecificCause().getMessage()));
    }

    static HttpStatus statusFor(JobCoreException.Kind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            case INVALID_TRANSITION, IMMUTABLE_RECORD, SEQUENCE_CONFLICT, OPEN_CHANGE_ORDER -> HttpStatus.CONFLICT;
            case NOT_READY -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    }
}
