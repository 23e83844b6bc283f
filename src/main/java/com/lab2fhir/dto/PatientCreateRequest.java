package com.lab2fhir.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lab2fhir.model.SubjectType;

public record PatientCreateRequest(
        @JsonProperty("external_subject_id") String externalSubjectId,
        @JsonProperty("display_name") String displayName,
        @JsonProperty("subject_type") SubjectType subjectType
) {
}
