package com.lab2fhir.service;

import com.lab2fhir.domain.FieldChange;
import com.lab2fhir.domain.LabDataPayload;
import com.lab2fhir.domain.LabDataPayloadValidator;
import com.lab2fhir.domain.ReportStateMachine;
import com.lab2fhir.domain.ReportStatus;
import com.lab2fhir.domain.ValidationOutcome;
import com.lab2fhir.model.BundleArtifact;
import com.lab2fhir.model.GenerationMode;
import com.lab2fhir.model.LabReport;
import com.lab2fhir.model.PatientProfile;
import com.lab2fhir.model.StructuredVersion;
import com.lab2fhir.model.VersionKind;
import com.lab2fhir.repository.BundleArtifactRepository;
import com.lab2fhir.repository.LabReportRepository;
import com.lab2fhir.repository.PatientProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Drives a report through its lifecycle.
 * <p>
 * Each operation holds the report's lock for its whole duration and commits every step before
 * releasing it. This is the only place that decides a report has failed; collaborators signal
 * typed exceptions and the report is moved to {@code failed} with the error code before the
 * exception is rethrown.
 */
@Service
public class ReportPipelineService {

    private static final Logger logger = LoggerFactory.getLogger(ReportPipelineService.class);

    public static final String SYSTEM_AUTHOR = "system";

    private final DedupGateService dedupGate;
    private final ReportTransitionService transitionService;
    private final VersionLedgerService ledger;
    private final BundleAssemblerService assembler;
    private final LabDataPayloadValidator validator;
    private final LabReportRepository reportRepository;
    private final PatientProfileRepository patientRepository;
    private final BundleArtifactRepository artifactRepository;
    private final ReportLockManager lockManager;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public ReportPipelineService(DedupGateService dedupGate,
                                 ReportTransitionService transitionService,
                                 VersionLedgerService ledger,
                                 BundleAssemblerService assembler,
                                 LabDataPayloadValidator validator,
                                 LabReportRepository reportRepository,
                                 PatientProfileRepository patientRepository,
                                 BundleArtifactRepository artifactRepository,
                                 ReportLockManager lockManager,
                                 TransactionTemplate transactionTemplate,
                                 Clock clock) {
        this.dedupGate = dedupGate;
        this.transitionService = transitionService;
        this.ledger = ledger;
        this.assembler = assembler;
        this.validator = validator;
        this.reportRepository = reportRepository;
        this.patientRepository = patientRepository;
        this.artifactRepository = artifactRepository;
        this.lockManager = lockManager;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    public SubmissionResult submit(byte[] content, String filename, String mediaType, UUID patientId) {
        return dedupGate.submit(content, filename, mediaType, patientId);
    }

    /**
     * Stores the extraction result for an uploaded (or previously failed) report as its next
     * {@code original} version and hands the report over for review.
     * An invalid payload fails the report and is not stored.
     */
    public LabReport advance(UUID reportId, LabDataPayload payload, String author) {
        return lockManager.withReportLock(reportId, () -> {
            LabReport report = loadReport(reportId);
            LabReport parsing = transactionTemplate.execute(status ->
                    transitionService.transition(report, ReportStatus.PARSING));

            ValidationOutcome outcome = validator.validate(payload);
            if (!outcome.isValid()) {
                PayloadValidationException rejection =
                        new PayloadValidationException(ErrorCode.SCHEMA_VALIDATION_FAILED, outcome);
                logger.warn("Rejected structured payload for report {}: {}", reportId, outcome.summary());
                markFailed(reportId, ErrorCode.SCHEMA_VALIDATION_FAILED, rejection.getMessage(), rejection);
                throw rejection;
            }

            String createdBy = author == null || author.isBlank() ? SYSTEM_AUTHOR : author;
            try {
                return transactionTemplate.execute(status -> {
                    ledger.appendVersion(parsing, payload, VersionKind.ORIGINAL, outcome, createdBy);
                    return transitionService.transition(parsing, ReportStatus.REVIEW_PENDING);
                });
            } catch (RuntimeException e) {
                logger.error("Parsing step failed for report {}: {}", reportId, e.getMessage(), e);
                markFailed(reportId, ErrorCode.PARSING_FAILED, e.getMessage(), e);
                throw e;
            }
        });
    }

    public LabReport startEditing(UUID reportId) {
        return lockManager.withReportLock(reportId, () -> {
            LabReport report = loadReport(reportId);
            return transactionTemplate.execute(status -> transitionService.transition(report, ReportStatus.EDITING));
        });
    }

    /**
     * Applies a manual correction. The edited payload is validated first; an invalid payload is
     * rejected without touching the report. When nothing differs from the latest valid version that
     * version is returned unchanged. Otherwise a {@code corrected} version is appended with one
     * edit history entry per changed leaf and the report goes back to review.
     */
    public StructuredVersion correct(UUID reportId, LabDataPayload editedPayload, String author) {
        if (author == null || author.isBlank()) {
            throw new PayloadValidationException("edited_by", "author is required for corrections");
        }
        return lockManager.withReportLock(reportId, () -> {
            LabReport report = loadReport(reportId);
            boolean alreadyEditing = report.getStatus() == ReportStatus.EDITING;
            if (!alreadyEditing) {
                ReportStateMachine.validateTransition(report.getStatus(), ReportStatus.EDITING);
            }

            ValidationOutcome outcome = validator.validate(editedPayload);
            if (!outcome.isValid()) {
                logger.warn("Rejected correction for report {}: {}", reportId, outcome.summary());
                throw new PayloadValidationException(ErrorCode.VALIDATION_ERROR, outcome);
            }

            return transactionTemplate.execute(status -> {
                StructuredVersion previous = ledger.latestValid(reportId)
                        .orElseThrow(() -> new NotFoundException(ErrorCode.PARSED_DATA_NOT_FOUND,
                                "Valid structured version", reportId));
                List<FieldChange> changes = ledger.diff(ledger.readPayload(previous), editedPayload);
                if (changes.isEmpty()) {
                    logger.info("Correction for report {} changes nothing; keeping version {}",
                            reportId, previous.getVersionNumber());
                    return previous;
                }

                LabReport editing = alreadyEditing
                        ? report
                        : transitionService.transition(report, ReportStatus.EDITING);
                StructuredVersion corrected = ledger.appendVersion(editing, editedPayload,
                        VersionKind.CORRECTED, outcome, author);
                for (FieldChange change : changes) {
                    ledger.recordEdit(corrected.getId(), change.getFieldPath(),
                            change.getOldValue(), change.getNewValue(), author);
                }
                transitionService.transition(editing, ReportStatus.REVIEW_PENDING);
                logger.info("Recorded {} field edits on report {} as version {}",
                        changes.size(), reportId, corrected.getVersionNumber());
                return corrected;
            });
        });
    }

    /**
     * Assembles and stores a bundle from the latest valid version.
     *
     * @param mode {@code null} picks regeneration for completed reports and initial generation otherwise
     */
    public BundleGenerationResult generateBundle(UUID reportId, GenerationMode mode) {
        return lockManager.withReportLock(reportId, () -> {
            LabReport report = loadReport(reportId);
            GenerationMode effectiveMode = mode != null
                    ? mode
                    : report.getStatus() == ReportStatus.COMPLETED ? GenerationMode.REGENERATION : GenerationMode.INITIAL;
            ReportStatus target = effectiveMode == GenerationMode.INITIAL
                    ? ReportStatus.GENERATING_BUNDLE
                    : ReportStatus.REGENERATING_BUNDLE;
            LabReport generating = transactionTemplate.execute(status -> transitionService.transition(report, target));

            try {
                return transactionTemplate.execute(status -> assembleAndStore(generating, effectiveMode));
            } catch (PipelineException e) {
                logger.error("Bundle generation failed for report {}: {}", reportId, e.getMessage());
                markFailed(reportId, e.getErrorCode(), e.getMessage(), e);
                throw e;
            } catch (RuntimeException e) {
                logger.error("Bundle generation failed for report {}", reportId, e);
                BundleGenerationException failure =
                        new BundleGenerationException("Bundle generation failed for report " + reportId, e);
                markFailed(reportId, ErrorCode.BUNDLE_GENERATION_FAILED, e.getMessage(), failure);
                throw failure;
            }
        });
    }

    private BundleGenerationResult assembleAndStore(LabReport report, GenerationMode mode) {
        PatientProfile patient = patientRepository.findById(report.getPatientId())
                .orElseThrow(() -> new NotFoundException(ErrorCode.PATIENT_NOT_FOUND, "Patient", report.getPatientId()));
        StructuredVersion version = ledger.latestValid(report.getId())
                .orElseThrow(() -> new NotFoundException(ErrorCode.PARSED_DATA_NOT_FOUND,
                        "Valid structured version", report.getId()));
        String previousHash = artifactRepository.findFirstByReportIdOrderByArtifactNumberDesc(report.getId())
                .map(BundleArtifact::getContentHash)
                .orElse(null);

        AssembledBundle bundle = assembler.assemble(report, patient, ledger.readPayload(version));
        int artifactNumber = Math.toIntExact(artifactRepository.countByReportId(report.getId()) + 1);
        BundleArtifact artifact = artifactRepository.save(BundleArtifact.builder()
                .reportId(report.getId())
                .artifactNumber(artifactNumber)
                .structuredVersionId(version.getId())
                .bundleJson(bundle.getJson())
                .contentHash(bundle.getContentHash())
                .generationMode(mode)
                .generatedAt(OffsetDateTime.now(clock))
                .build());
        LabReport completed = transitionService.transition(report, ReportStatus.COMPLETED);
        logger.info("Stored {} bundle {} for report {} from version {} (changed: {})", mode.wireValue(),
                artifact.getId(), report.getId(), version.getVersionNumber(),
                previousHash == null || !previousHash.equals(bundle.getContentHash()));
        return new BundleGenerationResult(artifact, completed, previousHash);
    }

    // Leaves the report in failed with the error recorded; problems doing so are attached to the original failure.
    private void markFailed(UUID reportId, ErrorCode errorCode, String message, RuntimeException failure) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                LabReport current = loadReport(reportId);
                if (ReportStateMachine.canTransition(current.getStatus(), ReportStatus.FAILED)) {
                    transitionService.transition(current, ReportStatus.FAILED, errorCode, message);
                }
            });
        } catch (RuntimeException e) {
            logger.error("Could not mark report {} as failed", reportId, e);
            failure.addSuppressed(e);
        }
    }

    private LabReport loadReport(UUID reportId) {
        return reportRepository.findById(reportId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.REPORT_NOT_FOUND, "Report", reportId));
    }
}
