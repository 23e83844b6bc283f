package com.lab2fhir.domain;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LabDataPayloadValidatorTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2024, 2, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    private final LabDataPayloadValidator validator =
            new LabDataPayloadValidator(Clock.fixed(Instant.from(NOW), ZoneOffset.UTC));

    @Test
    void acceptsWellFormedPayload() {
        LabDataPayload payload = payload(
                numeric("Glucose", 95.0),
                LabMeasurement.builder()
                        .originalAnalyteName("CRP")
                        .valueType(ValueType.OPERATOR_NUMERIC)
                        .operator(ComparisonOperator.LESS_THAN)
                        .numericValue(0.1)
                        .originalUnit("mg/dl")
                        .collectionDatetime(NOW.minusDays(3))
                        .build(),
                LabMeasurement.builder()
                        .originalAnalyteName("HIV screen")
                        .valueType(ValueType.QUALITATIVE)
                        .qualitativeValue("Negative")
                        .collectionDatetime(NOW.minusDays(3))
                        .build());

        ValidationOutcome outcome = validator.validate(payload);

        assertThat(outcome.isValid()).isTrue();
        assertThat(outcome.getErrors()).isEmpty();
    }

    @Test
    void rejectsEmptyMeasurementList() {
        LabDataPayload payload = LabDataPayload.builder().schemaVersion("1.0").build();

        ValidationOutcome outcome = validator.validate(payload);

        assertThat(outcome.isValid()).isFalse();
        assertThat(outcome.getErrors()).extracting(PayloadFieldError::getField).containsExactly("measurements");
    }

    @Test
    void reportsFieldPathForEachValueKindRule() {
        LabMeasurement missingNumber = numeric("Glucose", null);
        LabMeasurement missingOperator = numeric("CRP", 0.1).toBuilder().valueType(ValueType.OPERATOR_NUMERIC).build();
        LabMeasurement blankQualitative = LabMeasurement.builder()
                .originalAnalyteName("Culture")
                .valueType(ValueType.QUALITATIVE)
                .qualitativeValue("  ")
                .collectionDatetime(NOW.minusHours(1))
                .build();

        ValidationOutcome outcome = validator.validate(payload(missingNumber, missingOperator, blankQualitative));

        assertThat(outcome.getErrors()).extracting(PayloadFieldError::getField).containsExactly(
                "measurements[0].numeric_value",
                "measurements[1].operator",
                "measurements[2].qualitative_value");
    }

    @Test
    void rejectsFutureCollectionTime() {
        LabMeasurement future = numeric("Glucose", 95.0).toBuilder().collectionDatetime(NOW.plusMinutes(1)).build();

        ValidationOutcome outcome = validator.validate(payload(future));

        assertThat(outcome.getErrors()).extracting(PayloadFieldError::getField)
                .containsExactly("measurements[0].collection_datetime");
    }

    @Test
    void rejectsNonFiniteNumbersAndMissingValueType() {
        LabMeasurement nan = numeric("Glucose", Double.NaN);
        LabMeasurement untyped = numeric("Sodium", 140.0).toBuilder().valueType(null).build();

        ValidationOutcome outcome = validator.validate(payload(nan, untyped));

        assertThat(outcome.getErrors()).extracting(PayloadFieldError::getField)
                .containsExactly("measurements[0].numeric_value", "measurements[1].value_type");
    }

    @Test
    void enforcesLengthLimits() {
        LabMeasurement longUnit = numeric("Glucose", 95.0).toBuilder().originalUnit("x".repeat(101)).build();

        ValidationOutcome outcome = validator.validate(payload(longUnit));

        assertThat(outcome.getErrors()).extracting(PayloadFieldError::getField)
                .containsExactly("measurements[0].original_unit");
    }

    @Test
    void requiresSchemaVersion() {
        LabDataPayload payload = payload(numeric("Glucose", 95.0));
        payload.setSchemaVersion(" ");

        assertThat(validator.validate(payload).getErrors()).extracting(PayloadFieldError::getField)
                .containsExactly("schema_version");
    }

    private static LabMeasurement numeric(String analyte, Double value) {
        return LabMeasurement.builder()
                .originalAnalyteName(analyte)
                .valueType(ValueType.NUMERIC)
                .numericValue(value)
                .originalUnit("mg/dL")
                .collectionDatetime(NOW.minusDays(1))
                .build();
    }

    private static LabDataPayload payload(LabMeasurement... measurements) {
        return LabDataPayload.builder()
                .schemaVersion("1.0")
                .measurements(new ArrayList<>(List.of(measurements)))
                .build();
    }
}
