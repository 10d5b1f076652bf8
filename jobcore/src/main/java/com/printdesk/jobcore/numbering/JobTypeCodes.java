package com.printdesk.jobcore.numbering;

import com.printdesk.jobcore.component.JobClassification;

/**
 * Derives the job type code embedded in a baseJobId.
 *
 * <pre>
 *   MS     self-mailer (also any mailing without a format)
 *   MP     postcard mailing
 *   ME{n}  envelope mailing with n inserted pieces (ME1, ME2, ...)
 *   FJ     flat job, and the fallback for anything unclassified
 *   HJ     folded job
 *   BJ     booklet job (self-cover or plus-cover)
 * </pre>
 */
public final class JobTypeCodes {

    private JobTypeCodes() {}

    public static String derive(JobClassification job) {
        if (job == null) return "FJ";

        if (job.isMailing()) {
            if (job.mailFormat() == null) return "MS";
            return switch (job.mailFormat()) {
                case SELF_MAILER -> "MS";
                case POSTCARD    -> "MP";
                case ENVELOPE    -> "ME" + job.envelopePieces();
            };
        }

        if (job.jobType() == null) return "FJ";
        return switch (job.jobType()) {
            case FLAT   -> "FJ";
            case FOLDED -> "HJ";
            case BOOKLET_SELF_COVER, BOOKLET_PLUS_COVER -> "BJ";
        };
    }
}
