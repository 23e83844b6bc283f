package com.lab2fhir.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lab2fhir.domain.LabDataPayload;
import com.lab2fhir.domain.PayloadFieldError;
import com.lab2fhir.model.StructuredVersion;
import com.lab2fhir.model.ValidationStatus;
import com.lab2fhir.model.VersionKind;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record StructuredVersionResponse(
        @JsonProperty("id") UUID id,
        @JsonProperty("report_id") UUID reportId,
        @JsonProperty("version_number") Integer versionNumber,
        @JsonProperty("version_type") VersionKind versionKind,
        @JsonProperty("schema_version") String schemaVersion,
        @JsonProperty("payload") LabDataPayload payload,
        @JsonProperty("validation_status") ValidationStatus validationStatus,
        @JsonProperty("validation_errors") List<PayloadFieldError> validationErrors,
        @JsonProperty("created_by") String createdBy,
        @JsonProperty("created_at") OffsetDateTime createdAt
) {
    public static StructuredVersionResponse from(StructuredVersion version, LabDataPayload payload,
                                                 List<PayloadFieldError> validationErrors) {
        return new StructuredVersionResponse(version.getId(), version.getReportId(), version.getVersionNumber(),
                version.getVersionKind(), version.getSchemaVersion(), payload, version.getValidationStatus(),
                validationErrors, version.getCreatedBy(), version.getCreatedAt());
    }
}
