package com.lab2fhir.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ValidationStatus {
    VALID,
    INVALID;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ValidationStatus fromWireValue(String value) {
        if (value == null) {
            return null;
        }
        return ValidationStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
