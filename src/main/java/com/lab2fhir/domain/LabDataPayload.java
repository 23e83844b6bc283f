package com.lab2fhir.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Structured representation of a lab report, produced by extraction or by a manual correction.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LabDataPayload {

    public static final String CURRENT_SCHEMA_VERSION = "1.0";

    private String schemaVersion;
    private String subjectIdentifier;
    private OffsetDateTime reportDate;
    private String orderingProvider;
    private String performingLab;
    @Builder.Default
    private List<LabMeasurement> measurements = new ArrayList<>();
}
