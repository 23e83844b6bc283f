package com.lab2fhir.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lab2fhir.model.PatientProfile;
import com.lab2fhir.model.SubjectType;

import java.time.OffsetDateTime;
import java.util.UUID;

public record PatientResponse(
        @JsonProperty("id") UUID id,
        @JsonProperty("external_subject_id") String externalSubjectId,
        @JsonProperty("display_name") String displayName,
        @JsonProperty("subject_type") SubjectType subjectType,
        @JsonProperty("created_at") OffsetDateTime createdAt,
        @JsonProperty("updated_at") OffsetDateTime updatedAt
) {
    public static PatientResponse from(PatientProfile patient) {
        return new PatientResponse(patient.getId(), patient.getExternalSubjectId(), patient.getDisplayName(),
                patient.getSubjectType(), patient.getCreatedAt(), patient.getUpdatedAt());
    }
}
