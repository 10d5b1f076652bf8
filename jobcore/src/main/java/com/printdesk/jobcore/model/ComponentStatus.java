package com.printdesk.jobcore.model;

/**
 * Production state of a single component. Seeded as PENDING; every later
 * transition belongs to the production board, not to this service.
 */
public enum ComponentStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETE,
    CANCELLED
}
