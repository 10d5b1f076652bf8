package com.printdesk.jobcore.model;

/**
 * How production is routed.
 *
 * BRADFORD_JD is the partner workflow (broker -> Bradford -> JD); every
 * other job goes to one or more third-party vendors directly.
 */
public enum RoutingType {
    BRADFORD_JD,
    THIRD_PARTY_VENDOR
}
