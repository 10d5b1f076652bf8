package com.printdesk.jobcore.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Map;

/**
 * Stores {@link SpecFields} as a JSON object in a TEXT column.
 */
@Converter
public class SpecFieldsConverter implements AttributeConverter<SpecFields, String> {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(SpecFields fields) {
        SpecFields value = fields == null ? SpecFields.EMPTY : fields;
        try {
            return JSON.writeValueAsString(value.values());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise spec fields", e);
        }
    }

    @Override
    public SpecFields convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) return SpecFields.EMPTY;
        try {
            return new SpecFields(JSON.readValue(column, MAP_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored spec fields are not a JSON object: " + column, e);
        }
    }
}
