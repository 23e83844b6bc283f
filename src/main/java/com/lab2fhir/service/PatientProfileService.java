package com.lab2fhir.service;

import com.lab2fhir.model.PatientProfile;
import com.lab2fhir.model.SubjectType;
import com.lab2fhir.repository.PatientProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class PatientProfileService {

    private static final Logger logger = LoggerFactory.getLogger(PatientProfileService.class);

    static final int MAX_FIELD_LENGTH = 200;

    private final PatientProfileRepository patientRepository;
    private final Clock clock;

    public PatientProfileService(PatientProfileRepository patientRepository, Clock clock) {
        this.patientRepository = patientRepository;
        this.clock = clock;
    }

    /**
     * Registers a subject. The external subject id is unique and feeds the FHIR Patient id.
     */
    @Transactional
    public PatientProfile create(String externalSubjectId, String displayName, SubjectType subjectType) {
        String subjectId = requireText("external_subject_id", externalSubjectId);
        String name = requireText("display_name", displayName);
        if (patientRepository.existsByExternalSubjectId(subjectId)) {
            throw new PipelineException(ErrorCode.CONFLICT,
                    "Patient with external subject id '" + subjectId + "' already exists",
                    Map.of("external_subject_id", subjectId));
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        try {
            PatientProfile saved = patientRepository.saveAndFlush(PatientProfile.builder()
                    .externalSubjectId(subjectId)
                    .displayName(name)
                    .subjectType(subjectType != null ? subjectType : SubjectType.HUMAN)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
            logger.info("Created patient profile {} for subject {}", saved.getId(), subjectId);
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new PipelineException(ErrorCode.CONFLICT,
                    "Patient with external subject id '" + subjectId + "' already exists",
                    Map.of("external_subject_id", subjectId), e);
        }
    }

    @Transactional(readOnly = true)
    public PatientProfile get(UUID patientId) {
        return patientRepository.findById(patientId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.PATIENT_NOT_FOUND, "Patient", patientId));
    }

    @Transactional(readOnly = true)
    public List<PatientProfile> list() {
        return patientRepository.findAllByOrderByCreatedAtDesc();
    }

    private static String requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new PayloadValidationException(field, field + " is required");
        }
        String trimmed = value.trim();
        if (trimmed.length() > MAX_FIELD_LENGTH) {
            throw new PayloadValidationException(field, field + " must be at most " + MAX_FIELD_LENGTH + " characters");
        }
        return trimmed;
    }
}
