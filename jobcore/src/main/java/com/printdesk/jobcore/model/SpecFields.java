package com.printdesk.jobcore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Flat set of named job specifications, e.g. {"paper": "80# Matte", "quantity": 5000}.
 *
 * Used both for a job's base specs and for the delta carried by a change order.
 * Values are restricted to JSON scalars (string, number, boolean). In a delta a
 * null value clears the field when the delta is applied.
 *
 * Serialised as a plain JSON object, both on the wire and in the database.
 */
public record SpecFields(Map<String, Object> values) {

    public static final SpecFields EMPTY = new SpecFields(Map.of());

    private static final Pattern FIELD_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_.-]{0,63}");

    public SpecFields {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (values != null) {
            for (Map.Entry<String, Object> e : values.entrySet()) {
                String key = e.getKey();
                Object value = e.getValue();
                if (key == null || !FIELD_NAME.matcher(key).matches()) {
                    throw new IllegalArgumentException("Invalid spec field name: '" + key + "'");
                }
                if (value != null && !(value instanceof String
                        || value instanceof Number
                        || value instanceof Boolean)) {
                    throw new IllegalArgumentException(
                            "Spec field '" + key + "' must be a string, number or boolean");
                }
                copy.put(key, value);
            }
        }
        values = Collections.unmodifiableMap(copy);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static SpecFields of(Map<String, Object> values) {
        return new SpecFields(values);
    }

    @JsonValue
    @Override
    public Map<String, Object> values() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Apply a delta on top of these fields. Keys present in the delta win;
     * a null value in the delta removes the key.
     */
    public SpecFields apply(SpecFields delta) {
        if (delta == null || delta.isEmpty()) return this;
        Map<String, Object> merged = new LinkedHashMap<>(values);
        delta.values().forEach((k, v) -> {
            if (v == null) merged.remove(k);
            else merged.put(k, v);
        });
        return new SpecFields(merged);
    }
}
