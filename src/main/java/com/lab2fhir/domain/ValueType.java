package com.lab2fhir.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ValueType {
    NUMERIC,
    QUALITATIVE,
    OPERATOR_NUMERIC;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ValueType fromWireValue(String value) {
        if (value == null) {
            return null;
        }
        return ValueType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
