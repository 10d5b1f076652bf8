package com.printdesk.jobcore.model;

/**
 * Lifecycle of a Job as seen by this service.
 *
 * A job is created in DRAFT. It may only move to ACTIVE once its component
 * set passes validation (at least one PRINT and one PROOF, vendor-owned
 * components carry a vendor id). Later states are driven by production
 * collaborators.
 */
public enum JobStatus {
    DRAFT,
    ACTIVE,
    COMPLETED,
    CANCELLED
}
