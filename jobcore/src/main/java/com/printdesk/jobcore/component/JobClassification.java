package com.printdesk.jobcore.component;

import com.printdesk.jobcore.model.JobMetaType;
import com.printdesk.jobcore.model.JobType;
import com.printdesk.jobcore.model.MailFormat;

/**
 * Classification inputs for component suggestion and type-code derivation.
 *
 * All enum fields are optional. {@code envelopeComponents} is only meaningful
 * for ENVELOPE mailings and defaults to 1 when absent or not positive.
 */
public record JobClassification(
        JobMetaType jobMetaType,
        MailFormat  mailFormat,
        JobType     jobType,
        Integer     envelopeComponents,
        boolean     hasSamples,
        boolean     hasData,
        boolean     hasVersions
) {

    public static final JobClassification UNCLASSIFIED =
            new JobClassification(null, null, null, null, false, false, false);

    public static JobClassification mailing(MailFormat format, Integer envelopeComponents) {
        return new JobClassification(JobMetaType.MAILING, format, null, envelopeComponents,
                false, false, false);
    }

    public static JobClassification job(JobType type) {
        return new JobClassification(JobMetaType.JOB, null, type, null, false, false, false);
    }

    public boolean isMailing() {
        return jobMetaType == JobMetaType.MAILING;
    }

    /** Number of pieces inserted per envelope, never less than 1. */
    public int envelopePieces() {
        return envelopeComponents == null || envelopeComponents < 1 ? 1 : envelopeComponents;
    }
}
