package com.lab2fhir.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lab2fhir.model.BundleArtifact;
import com.lab2fhir.model.GenerationMode;

import java.time.OffsetDateTime;
import java.util.UUID;

public record BundleArtifactResponse(
        @JsonProperty("id") UUID id,
        @JsonProperty("report_id") UUID reportId,
        @JsonProperty("artifact_number") Integer artifactNumber,
        @JsonProperty("parsed_version_id") UUID structuredVersionId,
        @JsonProperty("bundle_hash_sha256") String contentHash,
        @JsonProperty("generation_mode") GenerationMode generationMode,
        @JsonProperty("generated_at") OffsetDateTime generatedAt
) {
    public static BundleArtifactResponse from(BundleArtifact artifact) {
        return new BundleArtifactResponse(artifact.getId(), artifact.getReportId(), artifact.getArtifactNumber(),
                artifact.getStructuredVersionId(), artifact.getContentHash(),
                artifact.getGenerationMode(), artifact.getGeneratedAt());
    }
}
