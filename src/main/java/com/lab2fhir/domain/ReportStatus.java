package com.lab2fhir.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle states of an uploaded lab report.
 */
public enum ReportStatus {
    UPLOADED,
    PARSING,
    REVIEW_PENDING,
    EDITING,
    GENERATING_BUNDLE,
    REGENERATING_BUNDLE,
    COMPLETED,
    FAILED,
    DUPLICATE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ReportStatus fromWireValue(String value) {
        if (value == null) {
            return null;
        }
        return ReportStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
