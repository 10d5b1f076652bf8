package com.printdesk.jobcore.component;

import com.printdesk.jobcore.model.ComponentOwner;
import com.printdesk.jobcore.model.ComponentType;
import com.printdesk.jobcore.model.JobMetaType;
import com.printdesk.jobcore.model.JobType;
import com.printdesk.jobcore.model.MailFormat;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives the default production components for a job from its classification.
 *
 * Pure: no I/O, no clock, no randomness. The same classification always
 * yields the same list in the same order. Rules are applied in this fixed
 * sequence, each appending with the next sortOrder:
 * <ol>
 *   <li>PRINT, always.</li>
 *   <li>DATA: list processing for mailings, variable data when hasData is set.</li>
 *   <li>FINISHING for envelope mailings (insertion of N pieces).</li>
 *   <li>BINDERY for folded or booklet jobs (non-mailing only).</li>
 *   <li>PROOF, always.</li>
 *   <li>MAILING for mailings.</li>
 *   <li>SAMPLES when hasSamples is set.</li>
 *   <li>SHIPPING, always last.</li>
 * </ol>
 * Every suggestion is INTERNAL; artwork/data flags come from {@link ComponentDefaults}.
 */
@Component
public class ComponentSuggestionEngine {

    public List<SuggestedComponent> suggest(JobClassification classification) {
        JobClassification job = classification == null ? JobClassification.UNCLASSIFIED : classification;
        List<SuggestedComponent> out = new ArrayList<>();

        add(out, ComponentType.PRINT, "Print Production", "Primary print production");

        if (job.isMailing()) {
            add(out, ComponentType.DATA, "Data Processing",
                    "Mailing list processing and CASS certification");
        } else if (job.hasData()) {
            add(out, ComponentType.DATA, "Variable Data", "Variable data processing");
        }

        if (job.mailFormat() == MailFormat.ENVELOPE) {
            int pieces = job.envelopePieces();
            add(out, ComponentType.FINISHING, "Insertion/Assembly",
                    "Insert " + pieces + " component" + (pieces > 1 ? "s" : "") + " into envelope");
        }

        // Bindery only applies to plain print jobs (an unset meta type counts as one).
        if (job.jobMetaType() == null || job.jobMetaType() == JobMetaType.JOB) {
            if (job.jobType() == JobType.FOLDED) {
                add(out, ComponentType.BINDERY, "Folding", "Folding operation");
            } else if (job.jobType() != null && job.jobType().isBooklet()) {
                add(out, ComponentType.BINDERY, "Bindery",
                        job.jobType() == JobType.BOOKLET_PLUS_COVER
                                ? "Saddle stitch with separate cover"
                                : "Saddle stitch self-cover");
            }
        }

        add(out, ComponentType.PROOF, "Proof", "Customer proof for approval");

        if (job.isMailing()) {
            add(out, ComponentType.MAILING, "Mailing Services", "Postal processing and drop-ship");
        }

        if (job.hasSamples()) {
            add(out, ComponentType.SAMPLES, "Samples", "Production samples for customer");
        }

        add(out, ComponentType.SHIPPING, "Shipping",
                job.isMailing() ? "Delivery to mail facility" : "Delivery to customer");

        return List.copyOf(out);
    }

    private static void add(List<SuggestedComponent> out, ComponentType type, String name, String description) {
        ComponentDefaults d = ComponentDefaults.forType(type);
        out.add(new SuggestedComponent(type, name, description, ComponentOwner.INTERNAL,
                d.artworkRequired(), d.dataRequired(), out.size()));
    }
}
