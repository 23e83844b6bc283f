package com.lab2fhir.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lab2fhir.service.BundleGenerationResult;

public record BundleGenerationResponse(
        @JsonProperty("artifact") BundleArtifactResponse artifact,
        @JsonProperty("report") ReportResponse report,
        @JsonProperty("previous_bundle_hash_sha256") String previousContentHash,
        @JsonProperty("content_changed") boolean contentChanged
) {
    public static BundleGenerationResponse from(BundleGenerationResult result) {
        return new BundleGenerationResponse(
                BundleArtifactResponse.from(result.getArtifact()),
                ReportResponse.from(result.getReport()),
                result.getPreviousContentHash(),
                result.isContentChanged());
    }
}
