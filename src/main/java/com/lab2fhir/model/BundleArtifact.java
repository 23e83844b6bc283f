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
 * A generated FHIR transaction bundle. Regeneration appends a new artifact; rows are never overwritten.
 * {@code generatedAt} is metadata and is not part of {@code bundleJson} or its hash; {@code artifactNumber}
 * orders a report's artifacts.
 */
@Entity
@Table(name = "bundle_artifacts", uniqueConstraints = {
        @UniqueConstraint(name = "uq_bundle_artifacts_report_number", columnNames = {"report_id", "artifact_number"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BundleArtifact {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "report_id", nullable = false, updatable = false)
    private UUID reportId;

    @Column(name = "artifact_number", nullable = false, updatable = false)
    private Integer artifactNumber;

    @Column(name = "structured_version_id", nullable = false, updatable = false)
    private UUID structuredVersionId;

    @Column(name = "bundle_json", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String bundleJson;

    @Column(name = "content_hash", nullable = false, updatable = false, length = 64)
    private String contentHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "generation_mode", nullable = false, updatable = false, length = 20)
    private GenerationMode generationMode;

    @Column(name = "generated_at", nullable = false, updatable = false)
    private OffsetDateTime generatedAt;
}
