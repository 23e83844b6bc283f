package com.lab2fhir.service;

import com.lab2fhir.model.BundleArtifact;
import com.lab2fhir.model.LabReport;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A freshly stored artifact together with what it replaced, so callers can tell
 * whether regeneration changed anything.
 */
@Getter
@AllArgsConstructor
public class BundleGenerationResult {
    private final BundleArtifact artifact;
    private final LabReport report;
    private final String previousContentHash;

    public boolean isContentChanged() {
        return previousContentHash == null || !previousContentHash.equals(artifact.getContentHash());
    }
}
