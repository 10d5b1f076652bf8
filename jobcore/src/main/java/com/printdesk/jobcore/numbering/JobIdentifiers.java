package com.printdesk.jobcore.numbering;

/**
 * Identity assigned to a brand-new job.
 *
 * @param baseJobId   human-readable id, e.g. "BK000001"
 * @param masterSeq   value drawn from the master sequence
 * @param jobTypeCode classification code embedded in baseJobId
 */
public record JobIdentifiers(String baseJobId, long masterSeq, String jobTypeCode) {}
