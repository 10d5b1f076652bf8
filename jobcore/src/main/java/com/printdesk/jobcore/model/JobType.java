package com.printdesk.jobcore.model;

/** Physical format of a non-mailing job. */
public enum JobType {
    FLAT,
    FOLDED,
    BOOKLET_SELF_COVER,
    BOOKLET_PLUS_COVER;

    public boolean isBooklet() {
        return this == BOOKLET_SELF_COVER || this == BOOKLET_PLUS_COVER;
    }
}
