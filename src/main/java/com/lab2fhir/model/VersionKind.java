package com.lab2fhir.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum VersionKind {
    ORIGINAL,
    CORRECTED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static VersionKind fromWireValue(String value) {
        if (value == null) {
            return null;
        }
        return VersionKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
