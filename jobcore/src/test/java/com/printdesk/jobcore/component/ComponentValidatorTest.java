package com.printdesk.jobcore.component;

import com.printdesk.jobcore.model.ComponentOwner;
import com.printdesk.jobcore.model.ComponentType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ComponentValidatorTest {

    private final ComponentValidator validator = new ComponentValidator();

    @Test
    void validate_shippingOnly_reportsMissingPrintAndProof() {
        List<ValidationIssue> issues = validator.validate(List.of(
                new ComponentLine(ComponentType.SHIPPING, "Shipping", ComponentOwner.INTERNAL, null)));

        assertThat(issues).extracting(ValidationIssue::code)
                .containsExactly(ValidationIssue.Code.MISSING_PRINT, ValidationIssue.Code.MISSING_PROOF);
        assertThat(issues.get(0).message()).isEqualTo("Missing PRINT component (required for all jobs)");
    }

    @Test
    void validate_completeInternalSet_noIssues() {
        List<ValidationIssue> issues = validator.validate(List.of(
                new ComponentLine(ComponentType.PRINT, "Print Production", ComponentOwner.INTERNAL, null),
                new ComponentLine(ComponentType.PROOF, "Proof", ComponentOwner.INTERNAL, null)));

        assertThat(issues).isEmpty();
    }

    @Test
    void validate_vendorComponentsWithoutVendorId_oneIssueEach() {
        List<ValidationIssue> issues = validator.validate(List.of(
                new ComponentLine(ComponentType.PRINT, "Print Production", ComponentOwner.VENDOR, null),
                new ComponentLine(ComponentType.PROOF, "Proof", ComponentOwner.INTERNAL, null),
                new ComponentLine(ComponentType.MAILING, "Mailing Services", ComponentOwner.VENDOR, "  "),
                new ComponentLine(ComponentType.SHIPPING, "Shipping", ComponentOwner.VENDOR, "V-17")));

        assertThat(issues).extracting(ValidationIssue::code).containsOnly(ValidationIssue.Code.VENDOR_ID_MISSING);
        assertThat(issues).extracting(ValidationIssue::componentIndex).containsExactly(0, 2);
        assertThat(issues.get(0).message())
                .isEqualTo("Vendor-owned component 'Print Production' is missing vendorId");
    }

    @Test
    void validate_nullOrEmpty_reportsBothMissing() {
        assertThat(validator.validate(null)).hasSize(2);
        assertThat(validator.validate(List.of())).hasSize(2);
    }

    @Test
    void validate_doesNotMutateInput() {
        List<ComponentLine> input = new ArrayList<>(List.of(
                new ComponentLine(ComponentType.PRINT, "Print", ComponentOwner.VENDOR, null)));
        List<ComponentLine> before = List.copyOf(input);

        validator.validate(input);

        assertThat(input).isEqualTo(before);
    }

    @Test
    void validate_suggestedSetAlwaysPasses() {
        ComponentSuggestionEngine engine = new ComponentSuggestionEngine();

        List<ComponentLine> lines = engine.suggest(JobClassification.UNCLASSIFIED).stream()
                .map(ComponentLine::of)
                .toList();

        assertThat(validator.validate(lines)).isEmpty();
    }
}
