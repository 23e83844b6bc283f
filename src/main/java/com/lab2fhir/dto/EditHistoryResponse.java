package com.lab2fhir.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lab2fhir.model.EditHistoryEntry;

import java.time.OffsetDateTime;
import java.util.UUID;

public record EditHistoryResponse(
        @JsonProperty("id") UUID id,
        @JsonProperty("version_id") UUID versionId,
        @JsonProperty("field_path") String fieldPath,
        @JsonProperty("old_value") String oldValue,
        @JsonProperty("new_value") String newValue,
        @JsonProperty("edited_by") String editedBy,
        @JsonProperty("edited_at") OffsetDateTime editedAt
) {
    public static EditHistoryResponse from(EditHistoryEntry entry) {
        return new EditHistoryResponse(entry.getId(), entry.getVersionId(), entry.getFieldPath(),
                entry.getOldValue(), entry.getNewValue(), entry.getEditedBy(), entry.getEditedAt());
    }
}
