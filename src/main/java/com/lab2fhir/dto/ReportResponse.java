package com.lab2fhir.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lab2fhir.domain.ReportStateMachine;
import com.lab2fhir.domain.ReportStatus;
import com.lab2fhir.model.LabReport;

import java.time.OffsetDateTime;
import java.util.Set;
import java.util.UUID;

/**
 * Report view with status metadata, so clients need not hard-code the lifecycle table.
 */
public record ReportResponse(
        @JsonProperty("id") UUID id,
        @JsonProperty("patient_id") UUID patientId,
        @JsonProperty("original_filename") String originalFilename,
        @JsonProperty("media_type") String mediaType,
        @JsonProperty("file_hash_sha256") String contentHash,
        @JsonProperty("status") ReportStatus status,
        @JsonProperty("error_code") String errorCode,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("is_duplicate_of_report_id") UUID duplicateOfReportId,
        @JsonProperty("created_at") OffsetDateTime createdAt,
        @JsonProperty("updated_at") OffsetDateTime updatedAt,
        @JsonProperty("status_metadata") StatusMetadata statusMetadata
) {

    public record StatusMetadata(
            @JsonProperty("is_processing") boolean processing,
            @JsonProperty("is_user_actionable") boolean userActionable,
            @JsonProperty("is_success") boolean success,
            @JsonProperty("is_error") boolean error,
            @JsonProperty("is_terminal") boolean terminal,
            @JsonProperty("allowed_transitions") Set<ReportStatus> allowedTransitions
    ) {
        public static StatusMetadata of(ReportStatus status) {
            return new StatusMetadata(
                    ReportStateMachine.isProcessing(status),
                    ReportStateMachine.isUserActionable(status),
                    ReportStateMachine.isSuccess(status),
                    ReportStateMachine.isError(status),
                    ReportStateMachine.isTerminal(status),
                    ReportStateMachine.allowedTransitions(status));
        }
    }

    public static ReportResponse from(LabReport report) {
        return new ReportResponse(report.getId(), report.getPatientId(), report.getOriginalFilename(),
                report.getMediaType(), report.getContentHash(), report.getStatus(), report.getErrorCode(),
                report.getErrorMessage(), report.getDuplicateOfReportId(), report.getCreatedAt(),
                report.getUpdatedAt(), StatusMetadata.of(report.getStatus()));
    }
}
