package com.printdesk.jobcore.component;

import com.printdesk.jobcore.model.ComponentType;

/**
 * Per-type requirement defaults, usable without any job context.
 *
 *   PRINT, PROOF     artwork required
 *   DATA, MAILING    data required
 *   everything else  neither
 */
public record ComponentDefaults(boolean artworkRequired, boolean dataRequired) {

    private static final ComponentDefaults ARTWORK = new ComponentDefaults(true, false);
    private static final ComponentDefaults DATA    = new ComponentDefaults(false, true);
    private static final ComponentDefaults NONE    = new ComponentDefaults(false, false);

    public static ComponentDefaults forType(ComponentType type) {
        if (type == null) return NONE;
        return switch (type) {
            case PRINT, PROOF  -> ARTWORK;
            case DATA, MAILING -> DATA;
            case FINISHING, BINDERY, SHIPPING, SAMPLES, OTHER -> NONE;
        };
    }
}
