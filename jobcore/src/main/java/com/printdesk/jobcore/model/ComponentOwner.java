package com.printdesk.jobcore.model;

/** Who performs a component: the shop itself or an external vendor. */
public enum ComponentOwner {
    INTERNAL,
    VENDOR
}
