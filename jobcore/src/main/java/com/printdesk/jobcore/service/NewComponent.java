package com.printdesk.jobcore.service;

import com.printdesk.jobcore.model.ComponentOwner;
import com.printdesk.jobcore.model.ComponentType;

/**
 * A component supplied by the caller instead of the suggested defaults.
 *
 * Rows copied from the legacy job sheet often only have a name and a
 * supplier code: a null {@code type} is inferred from the name, and a null
 * {@code owner} is derived from {@code legacySupplier}.
 */
public record NewComponent(
        ComponentType  type,
        String         name,
        String         description,
        ComponentOwner owner,
        String         vendorId,
        String         legacySupplier
) {}
