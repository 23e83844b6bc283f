package com.lab2fhir.service;

import com.lab2fhir.domain.ReportStateMachine;
import com.lab2fhir.domain.ReportStatus;
import com.lab2fhir.model.LabReport;
import com.lab2fhir.repository.LabReportRepository;
import com.lab2fhir.repository.PatientProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Admits each distinct document (by SHA-256 of its bytes) as a canonical report at most once.
 * Later uploads of the same bytes, from any patient, are recorded as terminal duplicates pointing at
 * the canonical report.
 */
@Service
public class DedupGateService {

    private static final Logger logger = LoggerFactory.getLogger(DedupGateService.class);

    private final LabReportRepository reportRepository;
    private final PatientProfileRepository patientRepository;
    private final ContentHashingService hashingService;
    private final SourceDocumentStore documentStore;
    private final ReportLockManager lockManager;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final List<String> acceptedMediaTypes;

    public DedupGateService(LabReportRepository reportRepository,
                            PatientProfileRepository patientRepository,
                            ContentHashingService hashingService,
                            SourceDocumentStore documentStore,
                            ReportLockManager lockManager,
                            TransactionTemplate transactionTemplate,
                            Clock clock,
                            @Value("${app.ingestion.accepted-media-types:application/pdf}") List<String> acceptedMediaTypes) {
        this.reportRepository = reportRepository;
        this.patientRepository = patientRepository;
        this.hashingService = hashingService;
        this.documentStore = documentStore;
        this.lockManager = lockManager;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.acceptedMediaTypes = acceptedMediaTypes.stream()
                .map(t -> t.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }

    public SubmissionResult submit(byte[] content, String filename, String mediaType, UUID patientId) {
        if (content == null || content.length == 0) {
            throw new PayloadValidationException("file", "uploaded file is empty");
        }
        String normalizedType = mediaType == null ? "" : mediaType.trim().toLowerCase(Locale.ROOT);
        if (!acceptedMediaTypes.contains(normalizedType)) {
            throw new PipelineException(ErrorCode.INVALID_FILE_TYPE,
                    "Unsupported media type '" + mediaType + "'; accepted: " + acceptedMediaTypes);
        }
        if (patientId == null || !patientRepository.existsById(patientId)) {
            throw new NotFoundException(ErrorCode.PATIENT_NOT_FOUND, "Patient", patientId);
        }

        String contentHash = hashingService.hash(content);
        String safeName = filename == null || filename.isBlank() ? contentHash : filename;
        return lockManager.withContentLock(contentHash, () -> {
            try {
                return transactionTemplate.execute(status ->
                        admit(content, safeName, normalizedType, patientId, contentHash));
            } catch (DataIntegrityViolationException e) {
                // another process committed the canonical report first; the retry sees it
                logger.warn("Canonical insert for hash {} lost a race, retrying as duplicate", contentHash);
                return transactionTemplate.execute(status ->
                        admit(content, safeName, normalizedType, patientId, contentHash));
            }
        });
    }

    private SubmissionResult admit(byte[] content, String filename, String mediaType, UUID patientId, String contentHash) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Optional<LabReport> canonical = reportRepository.findByCanonicalContentHash(contentHash);
        if (canonical.isPresent()) {
            ReportStateMachine.validateTransition(ReportStatus.UPLOADED, ReportStatus.DUPLICATE);
            LabReport existing = canonical.get();
            LabReport duplicate = reportRepository.saveAndFlush(LabReport.builder()
                    .patientId(patientId)
                    .originalFilename(filename)
                    .mediaType(mediaType)
                    .contentHash(contentHash)
                    .storageUri(existing.getStorageUri())
                    .status(ReportStatus.DUPLICATE)
                    .duplicateOfReportId(existing.getId())
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
            logger.info("Upload {} is a duplicate of report {} (hash {})", duplicate.getId(), existing.getId(), contentHash);
            return SubmissionResult.duplicate(duplicate, existing.getId(), contentHash);
        }

        String storageUri = documentStore.store(contentHash, content, mediaType);
        LabReport report = reportRepository.saveAndFlush(LabReport.builder()
                .patientId(patientId)
                .originalFilename(filename)
                .mediaType(mediaType)
                .contentHash(contentHash)
                .canonicalContentHash(contentHash)
                .storageUri(storageUri)
                .status(ReportStatus.UPLOADED)
                .createdAt(now)
                .updatedAt(now)
                .build());
        logger.info("Accepted report {} for patient {} (hash {})", report.getId(), patientId, contentHash);
        return SubmissionResult.accepted(report);
    }
}
