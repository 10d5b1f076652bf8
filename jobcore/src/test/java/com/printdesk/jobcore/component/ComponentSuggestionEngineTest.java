package com.printdesk.jobcore.component;

import com.printdesk.jobcore.model.ComponentOwner;
import com.printdesk.jobcore.model.ComponentType;
import com.printdesk.jobcore.model.JobMetaType;
import com.printdesk.jobcore.model.JobType;
import com.printdesk.jobcore.model.MailFormat;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.printdesk.jobcore.model.ComponentType.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ComponentSuggestionEngine is pure, so these tests need no Spring context
 * and no mocks.
 */
class ComponentSuggestionEngineTest {

    private final ComponentSuggestionEngine engine = new ComponentSuggestionEngine();

    // ------------------------------------------------------------------
    // Mailings
    // ------------------------------------------------------------------

    @Test
    void suggest_envelopeMailingWithThreePieces_followsRuleOrder() {
        List<SuggestedComponent> out = engine.suggest(JobClassification.mailing(MailFormat.ENVELOPE, 3));

        assertThat(out).extracting(SuggestedComponent::type)
                .containsExactly(PRINT, DATA, FINISHING, PROOF, MAILING, SHIPPING);
        assertThat(out.get(1).description()).isEqualTo("Mailing list processing and CASS certification");
        assertThat(out.get(2).description()).isEqualTo("Insert 3 components into envelope");
        assertThat(out.get(5).description()).isEqualTo("Delivery to mail facility");
    }

    @Test
    void suggest_envelopeMailingWithoutCount_insertsOnePiece() {
        List<SuggestedComponent> out = engine.suggest(JobClassification.mailing(MailFormat.ENVELOPE, null));

        assertThat(out).filteredOn(c -> c.type() == FINISHING)
                .singleElement()
                .extracting(SuggestedComponent::description)
                .isEqualTo("Insert 1 component into envelope");
    }

    @Test
    void suggest_postcardMailing_hasNoFinishing() {
        List<SuggestedComponent> out = engine.suggest(JobClassification.mailing(MailFormat.POSTCARD, null));

        assertThat(out).extracting(SuggestedComponent::type)
                .containsExactly(PRINT, DATA, PROOF, MAILING, SHIPPING);
    }

    @Test
    void suggest_mailingWithFoldedJobType_stillHasNoBindery() {
        JobClassification c = new JobClassification(JobMetaType.MAILING, MailFormat.SELF_MAILER,
                JobType.FOLDED, null, false, false, false);

        assertThat(engine.suggest(c)).extracting(SuggestedComponent::type).doesNotContain(BINDERY);
    }

    // ------------------------------------------------------------------
    // Print jobs
    // ------------------------------------------------------------------

    @Test
    void suggest_bookletPlusCover_binderyBeforeProof() {
        List<SuggestedComponent> out = engine.suggest(JobClassification.job(JobType.BOOKLET_PLUS_COVER));

        assertThat(out).extracting(SuggestedComponent::type)
                .containsExactly(PRINT, BINDERY, PROOF, SHIPPING);
        assertThat(out.get(1).description()).isEqualTo("Saddle stitch with separate cover");
        assertThat(out.get(3).description()).isEqualTo("Delivery to customer");
    }

    @Test
    void suggest_bookletSelfCover_distinguishedFromPlusCover() {
        List<SuggestedComponent> out = engine.suggest(JobClassification.job(JobType.BOOKLET_SELF_COVER));

        assertThat(out.get(1).type()).isEqualTo(BINDERY);
        assertThat(out.get(1).description()).isEqualTo("Saddle stitch self-cover");
    }

    @Test
    void suggest_foldedJob_addsFolding() {
        List<SuggestedComponent> out = engine.suggest(JobClassification.job(JobType.FOLDED));

        assertThat(out).extracting(SuggestedComponent::name)
                .containsExactly("Print Production", "Folding", "Proof", "Shipping");
    }

    @Test
    void suggest_flatJobWithDataAndSamples_addsVariableDataAndSamples() {
        JobClassification c = new JobClassification(JobMetaType.JOB, null, JobType.FLAT, null,
                true, true, false);

        List<SuggestedComponent> out = engine.suggest(c);

        assertThat(out).extracting(SuggestedComponent::type)
                .containsExactly(PRINT, DATA, PROOF, SAMPLES, SHIPPING);
        assertThat(out.get(1).name()).isEqualTo("Variable Data");
    }

    @Test
    void suggest_nullClassification_returnsMinimalSet() {
        assertThat(engine.suggest(null)).extracting(SuggestedComponent::type)
                .containsExactly(PRINT, PROOF, SHIPPING);
    }

    // ------------------------------------------------------------------
    // Defaults and determinism
    // ------------------------------------------------------------------

    @Test
    void suggest_everyComponentInternalWithTypeDefaultsAndSequentialSortOrder() {
        List<SuggestedComponent> out = engine.suggest(JobClassification.mailing(MailFormat.ENVELOPE, 2));

        for (int i = 0; i < out.size(); i++) {
            SuggestedComponent c = out.get(i);
            ComponentDefaults d = ComponentDefaults.forType(c.type());
            assertThat(c.owner()).isEqualTo(ComponentOwner.INTERNAL);
            assertThat(c.sortOrder()).isEqualTo(i);
            assertThat(c.artworkRequired()).isEqualTo(d.artworkRequired());
            assertThat(c.dataRequired()).isEqualTo(d.dataRequired());
        }
    }

    @Test
    void suggest_sameInputTwice_identicalOutput() {
        JobClassification c = new JobClassification(JobMetaType.MAILING, MailFormat.ENVELOPE, null, 4,
                true, true, true);

        assertThat(engine.suggest(c)).isEqualTo(engine.suggest(c));
    }

    @Test
    void suggest_resultIsImmutable() {
        List<SuggestedComponent> out = engine.suggest(JobClassification.UNCLASSIFIED);

        assertThatThrownBy(() -> out.add(out.get(0)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void suggest_printAlwaysFirstAndShippingAlwaysLast() {
        for (JobType type : JobType.values()) {
            List<SuggestedComponent> out = engine.suggest(JobClassification.job(type));
            assertThat(out.get(0).type()).isEqualTo(ComponentType.PRINT);
            assertThat(out.get(out.size() - 1).type()).isEqualTo(ComponentType.SHIPPING);
        }
    }
}
