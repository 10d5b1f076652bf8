package com.printdesk.jobcore.component;

import com.printdesk.jobcore.model.ComponentOwner;
import com.printdesk.jobcore.model.ComponentType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a job's component set:
 * <ul>
 *   <li>at least one PRINT component,</li>
 *   <li>at least one PROOF component,</li>
 *   <li>every VENDOR-owned component names its vendor.</li>
 * </ul>
 * Never throws and never mutates its input. Whether a non-empty result blocks
 * anything is the caller's decision.
 */
@Component
public class ComponentValidator {

    public List<ValidationIssue> validate(List<ComponentLine> components) {
        List<ComponentLine> lines = components == null ? List.of() : components;
        List<ValidationIssue> issues = new ArrayList<>();

        if (lines.stream().noneMatch(c -> c != null && c.type() == ComponentType.PRINT)) {
            issues.add(new ValidationIssue(ValidationIssue.Code.MISSING_PRINT,
                    "Missing PRINT component (required for all jobs)", null));
        }
        if (lines.stream().noneMatch(c -> c != null && c.type() == ComponentType.PROOF)) {
            issues.add(new ValidationIssue(ValidationIssue.Code.MISSING_PROOF,
                    "Missing PROOF component (required for all jobs)", null));
        }

        for (int i = 0; i < lines.size(); i++) {
            ComponentLine c = lines.get(i);
            if (c != null && c.owner() == ComponentOwner.VENDOR
                    && (c.vendorId() == null || c.vendorId().isBlank())) {
                String label = c.name() != null ? "'" + c.name() + "'" : "#" + i;
                issues.add(new ValidationIssue(ValidationIssue.Code.VENDOR_ID_MISSING,
                        "Vendor-owned component " + label + " is missing vendorId", i));
            }
        }
        return issues;
    }
}
