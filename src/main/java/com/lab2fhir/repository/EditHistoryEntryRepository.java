package com.lab2fhir.repository;

import com.lab2fhir.model.EditHistoryEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface EditHistoryEntryRepository extends JpaRepository<EditHistoryEntry, UUID> {
    List<EditHistoryEntry> findAllByVersionIdOrderByEditedAtAscFieldPathAsc(UUID versionId);
}
