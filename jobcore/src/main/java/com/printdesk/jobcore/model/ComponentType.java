package com.printdesk.jobcore.model;

/** Production step carried by a job. */
public enum ComponentType {
    PRINT,
    DATA,
    PROOF,
    MAILING,
    FINISHING,
    BINDERY,
    SHIPPING,
    SAMPLES,
    OTHER
}
