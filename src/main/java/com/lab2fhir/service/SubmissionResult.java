package com.lab2fhir.service;

import com.lab2fhir.model.LabReport;

import java.util.UUID;

/**
 * Outcome of handing document bytes to the dedup gate. A duplicate is a normal result, not an error.
 */
public final class SubmissionResult {

    private final LabReport report;
    private final UUID canonicalReportId;
    private final String contentHash;

    private SubmissionResult(LabReport report, UUID canonicalReportId, String contentHash) {
        this.report = report;
        this.canonicalReportId = canonicalReportId;
        this.contentHash = contentHash;
    }

    public static SubmissionResult accepted(LabReport report) {
        return new SubmissionResult(report, report.getId(), report.getContentHash());
    }

    public static SubmissionResult duplicate(LabReport duplicateReport, UUID canonicalReportId, String contentHash) {
        return new SubmissionResult(duplicateReport, canonicalReportId, contentHash);
    }

    public boolean isDuplicate() {
        return report.isDuplicate();
    }

    /**
     * The newly created report: canonical when accepted, the audit record when a duplicate.
     */
    public LabReport getReport() {
        return report;
    }

    public UUID getCanonicalReportId() {
        return canonicalReportId;
    }

    public String getContentHash() {
        return contentHash;
    }
}
