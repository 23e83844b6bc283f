package com.lab2fhir.domain;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks a structured payload before it is stored as a version.
 * <p>
 * Never throws for bad content; all problems are collected into the returned {@link ValidationOutcome}.
 */
public class LabDataPayloadValidator {

    static final int MAX_ANALYTE_NAME_LENGTH = 500;
    static final int MAX_ANALYTE_CODE_LENGTH = 200;
    static final int MAX_UNIT_LENGTH = 100;
    static final int MAX_REFERENCE_RANGE_LENGTH = 500;
    static final int MAX_QUALITATIVE_LENGTH = 500;

    private final Clock clock;

    public LabDataPayloadValidator(Clock clock) {
        this.clock = clock;
    }

    public ValidationOutcome validate(LabDataPayload payload) {
        List<PayloadFieldError> errors = new ArrayList<>();
        if (payload == null) {
            errors.add(new PayloadFieldError("$", "payload is required"));
            return ValidationOutcome.of(errors);
        }
        if (isBlank(payload.getSchemaVersion())) {
            errors.add(new PayloadFieldError("schema_version", "schema_version is required"));
        }
        List<LabMeasurement> measurements = payload.getMeasurements();
        if (measurements == null || measurements.isEmpty()) {
            errors.add(new PayloadFieldError("measurements", "at least one measurement is required"));
            return ValidationOutcome.of(errors);
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        for (int i = 0; i < measurements.size(); i++) {
            validateMeasurement(measurements.get(i), "measurements[" + i + "]", now, errors);
        }
        return ValidationOutcome.of(errors);
    }

    private void validateMeasurement(LabMeasurement m, String path, OffsetDateTime now, List<PayloadFieldError> errors) {
        if (m == null) {
            errors.add(new PayloadFieldError(path, "measurement must not be null"));
            return;
        }
        if (isBlank(m.getOriginalAnalyteName())) {
            errors.add(new PayloadFieldError(path + ".original_analyte_name", "analyte name is required"));
        } else {
            checkLength(m.getOriginalAnalyteName(), MAX_ANALYTE_NAME_LENGTH, path + ".original_analyte_name", errors);
        }
        checkLength(m.getNormalizedAnalyteCode(), MAX_ANALYTE_CODE_LENGTH, path + ".normalized_analyte_code", errors);
        checkLength(m.getOriginalUnit(), MAX_UNIT_LENGTH, path + ".original_unit", errors);
        checkLength(m.getNormalizedUnit(), MAX_UNIT_LENGTH, path + ".normalized_unit", errors);
        checkLength(m.getReferenceRangeText(), MAX_REFERENCE_RANGE_LENGTH, path + ".reference_range_text", errors);

        ValueType valueType = m.getValueType();
        if (valueType == null) {
            errors.add(new PayloadFieldError(path + ".value_type", "value_type is required"));
        } else if (valueType == ValueType.QUALITATIVE) {
            if (isBlank(m.getQualitativeValue())) {
                errors.add(new PayloadFieldError(path + ".qualitative_value",
                        "qualitative_value is required for qualitative measurements"));
            } else {
                checkLength(m.getQualitativeValue(), MAX_QUALITATIVE_LENGTH, path + ".qualitative_value", errors);
            }
        } else {
            Double value = m.getNumericValue();
            if (value == null) {
                errors.add(new PayloadFieldError(path + ".numeric_value",
                        "numeric_value is required for " + valueType.wireValue() + " measurements"));
            } else if (value.isNaN() || value.isInfinite()) {
                errors.add(new PayloadFieldError(path + ".numeric_value", "numeric_value must be finite"));
            }
            if (valueType == ValueType.OPERATOR_NUMERIC && m.getOperator() == null) {
                errors.add(new PayloadFieldError(path + ".operator",
                        "operator is required for operator_numeric measurements"));
            }
        }

        OffsetDateTime collected = m.getCollectionDatetime();
        if (collected == null) {
            errors.add(new PayloadFieldError(path + ".collection_datetime", "collection_datetime is required"));
        } else {
            if (collected.isAfter(now)) {
                errors.add(new PayloadFieldError(path + ".collection_datetime",
                        "collection_datetime must not be in the future"));
            }
            if (m.getResultDatetime() != null && m.getResultDatetime().isBefore(collected)) {
                errors.add(new PayloadFieldError(path + ".result_datetime",
                        "result_datetime must not precede collection_datetime"));
            }
        }
    }

    private static void checkLength(String value, int max, String field, List<PayloadFieldError> errors) {
        if (value != null && value.length() > max) {
            errors.add(new PayloadFieldError(field, "must be at most " + max + " characters"));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
