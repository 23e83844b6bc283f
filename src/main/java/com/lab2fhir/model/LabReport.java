package com.lab2fhir.model;

import com.lab2fhir.domain.ReportStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One uploaded lab report document. The status column is written only through
 * {@link com.lab2fhir.service.ReportTransitionService}.
 */
@Entity
@Table(name = "lab_reports", indexes = {
        @Index(name = "ix_lab_reports_content_hash", columnList = "content_hash"),
        @Index(name = "ix_lab_reports_patient_id", columnList = "patient_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LabReport {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "patient_id", nullable = false, updatable = false)
    private UUID patientId;

    @Column(name = "original_filename", nullable = false, length = 500)
    private String originalFilename;

    @Column(name = "media_type", nullable = false, length = 100)
    private String mediaType;

    @Column(name = "content_hash", nullable = false, updatable = false, length = 64)
    private String contentHash;

    // Set only on canonical reports; the unique constraint backs up the dedup gate across processes.
    @Column(name = "canonical_content_hash", unique = true, updatable = false, length = 64)
    private String canonicalContentHash;

    @Column(name = "storage_uri", length = 1000)
    private String storageUri;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private ReportStatus status;

    @Column(name = "error_code", length = 64)
    private String errorCode;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "duplicate_of_report_id", updatable = false)
    private UUID duplicateOfReportId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public boolean isDuplicate() {
        return duplicateOfReportId != null;
    }
}
