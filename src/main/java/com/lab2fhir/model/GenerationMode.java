package com.lab2fhir.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a bundle artifact came to be produced.
 */
public enum GenerationMode {
    INITIAL,
    REGENERATION;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static GenerationMode fromWireValue(String value) {
        if (value == null) {
            return null;
        }
        return GenerationMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
