package com.printdesk.jobcore.model;

/**
 * Commercial pathway of a job.
 *
 *   P1  partner workflow (routingType = BRADFORD_JD)
 *   P2  single external vendor
 *   P3  more than one distinct vendor in the execution map
 */
public enum Pathway {
    P1,
    P2,
    P3
}
