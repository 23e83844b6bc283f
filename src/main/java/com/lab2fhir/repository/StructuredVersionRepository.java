package com.lab2fhir.repository;

import com.lab2fhir.model.StructuredVersion;
import com.lab2fhir.model.ValidationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface StructuredVersionRepository extends JpaRepository<StructuredVersion, UUID> {

    long countByReportId(UUID reportId);

    /**
     * Highest numbered version with the given validation status.
     */
    Optional<StructuredVersion> findFirstByReportIdAndValidationStatusOrderByVersionNumberDesc(UUID reportId,
                                                                                               ValidationStatus status);

    Optional<StructuredVersion> findByReportIdAndVersionNumber(UUID reportId, Integer versionNumber);

    List<StructuredVersion> findAllByReportIdOrderByVersionNumberAsc(UUID reportId);
}
