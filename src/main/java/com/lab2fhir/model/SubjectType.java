package com.lab2fhir.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of subject a patient profile describes.
 */
public enum SubjectType {
    HUMAN,
    VETERINARY;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SubjectType fromWireValue(String value) {
        if (value == null) {
            return null;
        }
        return SubjectType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
