package com.lab2fhir.domain;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * One analyte result inside a structured payload.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LabMeasurement {
    private String originalAnalyteName;
    private String normalizedAnalyteCode;
    private ValueType valueType;
    private Double numericValue;
    private ComparisonOperator operator;
    private String qualitativeValue;
    private String originalUnit;
    @JsonAlias("normalized_unit_ucum")
    private String normalizedUnit;
    private String referenceRangeText;
    private OffsetDateTime collectionDatetime;
    private OffsetDateTime resultDatetime;

    /**
     * Unit used for identity and output: the normalized unit when present, else the raw one.
     */
    public String effectiveUnit() {
        return normalizedUnit != null && !normalizedUnit.isBlank() ? normalizedUnit : originalUnit;
    }

    /**
     * Analyte label used for identity: the normalized code when present, else the printed name.
     */
    public String effectiveAnalyte() {
        return normalizedAnalyteCode != null && !normalizedAnalyteCode.isBlank()
                ? normalizedAnalyteCode
                : originalAnalyteName;
    }
}
