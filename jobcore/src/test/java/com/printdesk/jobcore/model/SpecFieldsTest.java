package com.printdesk.jobcore.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpecFieldsTest {

    private final ObjectMapper json = new ObjectMapper();

    @Test
    void construct_scalarValues_accepted() {
        SpecFields specs = SpecFields.of(Map.of("paper", "80# Matte", "quantity", 5000, "bleed", true));

        assertThat(specs.values()).containsEntry("quantity", 5000).hasSize(3);
    }

    @Test
    void construct_nestedValue_rejected() {
        assertThatThrownBy(() -> SpecFields.of(Map.of("inks", List.of("cyan", "magenta"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("inks");
    }

    @Test
    void construct_badFieldName_rejected() {
        assertThatThrownBy(() -> SpecFields.of(Map.of("1st", "x")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SpecFields.of(Map.of("has space", "x")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void values_cannotBeModified() {
        Map<String, Object> source = new HashMap<>(Map.of("quantity", 5000));
        SpecFields specs = SpecFields.of(source);
        source.put("quantity", 1);

        assertThat(specs.values()).containsEntry("quantity", 5000);
        assertThatThrownBy(() -> specs.values().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void apply_deltaOverridesAddsAndClears() {
        SpecFields base = SpecFields.of(Map.of("paper", "80# Matte", "quantity", 5000, "coating", "UV"));
        Map<String, Object> delta = new HashMap<>();
        delta.put("quantity", 7500);
        delta.put("coating", null);
        delta.put("foldType", "tri-fold");

        SpecFields merged = base.apply(SpecFields.of(delta));

        assertThat(merged.values())
                .containsEntry("paper", "80# Matte")
                .containsEntry("quantity", 7500)
                .containsEntry("foldType", "tri-fold")
                .doesNotContainKey("coating");
        assertThat(base.values()).containsEntry("quantity", 5000);
    }

    @Test
    void json_writtenAsPlainObject() throws Exception {
        SpecFields specs = SpecFields.of(Map.of("quantity", 5000));

        assertThat(json.writeValueAsString(specs)).isEqualTo("{\"quantity\":5000}");
        assertThat(json.readValue("{\"quantity\":5000}", SpecFields.class)).isEqualTo(specs);
    }

    @Test
    void converter_nullOrBlankColumn_isEmpty() {
        SpecFieldsConverter converter = new SpecFieldsConverter();

        assertThat(converter.convertToEntityAttribute(null)).isEqualTo(SpecFields.EMPTY);
        assertThat(converter.convertToEntityAttribute(" ")).isEqualTo(SpecFields.EMPTY);
        assertThat(converter.convertToDatabaseColumn(null)).isEqualTo("{}");
    }
}
