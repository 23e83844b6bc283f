package com.lab2fhir.repository;

import com.lab2fhir.model.PatientProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PatientProfileRepository extends JpaRepository<PatientProfile, UUID> {
    Optional<PatientProfile> findByExternalSubjectId(String externalSubjectId);
    boolean existsByExternalSubjectId(String externalSubjectId);
    List<PatientProfile> findAllByOrderByCreatedAtDesc();
}
