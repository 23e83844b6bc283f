package com.lab2fhir.repository;

import com.lab2fhir.model.BundleArtifact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BundleArtifactRepository extends JpaRepository<BundleArtifact, UUID> {
    long countByReportId(UUID reportId);
    Optional<BundleArtifact> findFirstByReportIdOrderByArtifactNumberDesc(UUID reportId);
    List<BundleArtifact> findAllByReportIdOrderByArtifactNumberDesc(UUID reportId);
}
