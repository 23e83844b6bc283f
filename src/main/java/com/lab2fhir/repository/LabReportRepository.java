package com.lab2fhir.repository;

import com.lab2fhir.domain.ReportStatus;
import com.lab2fhir.model.LabReport;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LabReportRepository extends JpaRepository<LabReport, UUID> {

    /**
     * The canonical (first accepted) report for a content hash, if any.
     */
    Optional<LabReport> findByCanonicalContentHash(String canonicalContentHash);

    List<LabReport> findAllByPatientIdOrderByCreatedAtDesc(UUID patientId);

    List<LabReport> findAllByOrderByCreatedAtDesc();

    /**
     * Conditional status write. Returns 0 when the stored status no longer equals {@code expectedStatus}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update LabReport r set r.status = :newStatus, r.errorCode = :errorCode, r.errorMessage = :errorMessage, "
            + "r.updatedAt = :updatedAt where r.id = :id and r.status = :expectedStatus")
    int updateStatusIfMatches(@Param("id") UUID id,
                              @Param("expectedStatus") ReportStatus expectedStatus,
                              @Param("newStatus") ReportStatus newStatus,
                              @Param("errorCode") String errorCode,
                              @Param("errorMessage") String errorMessage,
                              @Param("updatedAt") OffsetDateTime updatedAt);
}
