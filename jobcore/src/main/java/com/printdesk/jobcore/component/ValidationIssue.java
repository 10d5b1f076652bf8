package com.printdesk.jobcore.component;

/**
 * One problem found by {@link ComponentValidator}.
 *
 * @param code           stable machine-readable code
 * @param message        human-readable description
 * @param componentIndex position of the offending component in the validated
 *                       list, or null for issues about the set as a whole
 */
public record ValidationIssue(Code code, String message, Integer componentIndex) {

    public enum Code { MISSING_PRINT, MISSING_PROOF, VENDOR_ID_MISSING }
}
