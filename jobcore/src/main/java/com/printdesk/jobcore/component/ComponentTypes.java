package com.printdesk.jobcore.component;

import com.printdesk.jobcore.model.ComponentOwner;
import com.printdesk.jobcore.model.ComponentType;

import java.util.Locale;

/**
 * Mapping helpers for component rows imported from the legacy job sheet,
 * where only a free-text name and a supplier were recorded.
 */
public final class ComponentTypes {

    private ComponentTypes() {}

    /**
     * Infer a component type from a legacy name. First matching keyword group
     * wins; unknown names map to OTHER.
     */
    public static ComponentType inferFromName(String name) {
        if (name == null) return ComponentType.OTHER;
        String n = name.toLowerCase(Locale.ROOT);

        if (containsAny(n, "print", "letter", "postcard", "mailer")) return ComponentType.PRINT;
        if (containsAny(n, "data", "list", "cass", "ncoa"))         return ComponentType.DATA;
        if (n.contains("proof"))                                      return ComponentType.PROOF;
        if (containsAny(n, "mail", "postal", "drop"))               return ComponentType.MAILING;
        if (containsAny(n, "insert", "assembly", "fold", "finish")) return ComponentType.FINISHING;
        if (containsAny(n, "bind", "stitch", "saddle"))             return ComponentType.BINDERY;
        if (containsAny(n, "ship", "deliver"))                      return ComponentType.SHIPPING;
        if (n.contains("sample"))                                     return ComponentType.SAMPLES;
        return ComponentType.OTHER;
    }

    /**
     * Legacy supplier codes: JD is the in-house shop, everything else is a vendor.
     */
    public static ComponentOwner ownerForLegacySupplier(String supplier) {
        if (supplier == null) return ComponentOwner.INTERNAL;
        return switch (supplier.toUpperCase(Locale.ROOT)) {
            case "LAHLOUH", "THIRD_PARTY" -> ComponentOwner.VENDOR;
            default -> ComponentOwner.INTERNAL;
        };
    }

    private static boolean containsAny(String haystack, String... needles) {
        for (String needle : needles) {
            if (haystack.contains(needle)) return true;
        }
        return false;
    }
}
