package com.lab2fhir.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Immutable snapshot of a report's structured content. Corrections append a new row.
 */
@Entity
@Table(name = "structured_versions", uniqueConstraints = {
        @UniqueConstraint(name = "uq_structured_versions_report_number", columnNames = {"report_id", "version_number"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StructuredVersion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "report_id", nullable = false, updatable = false)
    private UUID reportId;

    @Column(name = "version_number", nullable = false, updatable = false)
    private Integer versionNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "version_kind", nullable = false, updatable = false, length = 20)
    private VersionKind versionKind;

    @Column(name = "schema_version", nullable = false, updatable = false, length = 20)
    private String schemaVersion;

    @Column(name = "payload_json", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String payloadJson;

    @Enumerated(EnumType.STRING)
    @Column(name = "validation_status", nullable = false, updatable = false, length = 20)
    private ValidationStatus validationStatus;

    @Column(name = "validation_errors_json", updatable = false, columnDefinition = "TEXT")
    private String validationErrorsJson;

    @Column(name = "created_by", nullable = false, updatable = false, length = 200)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
