package com.lab2fhir.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "edit_history")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EditHistoryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "version_id", nullable = false, updatable = false)
    private UUID versionId;

    @Column(name = "field_path", nullable = false, updatable = false, length = 500)
    private String fieldPath;

    @Column(name = "old_value", updatable = false, columnDefinition = "TEXT")
    private String oldValue;

    @Column(name = "new_value", updatable = false, columnDefinition = "TEXT")
    private String newValue;

    @Column(name = "edited_by", nullable = false, updatable = false, length = 200)
    private String editedBy;

    @Column(name = "edited_at", nullable = false, updatable = false)
    private OffsetDateTime editedAt;
}
