package com.printdesk.jobcore.model;

/** Top-level job classification: a mailing campaign or a plain print job. */
public enum JobMetaType {
    MAILING,
    JOB
}
