package com.lab2fhir.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lab2fhir.domain.FieldChange;
import com.lab2fhir.domain.LabDataPayload;
import com.lab2fhir.domain.LabMeasurement;
import com.lab2fhir.domain.PayloadDiff;
import com.lab2fhir.domain.PayloadFieldError;
import com.lab2fhir.domain.ValidationOutcome;
import com.lab2fhir.model.EditHistoryEntry;
import com.lab2fhir.model.LabReport;
import com.lab2fhir.model.StructuredVersion;
import com.lab2fhir.model.ValidationStatus;
import com.lab2fhir.model.VersionKind;
import com.lab2fhir.repository.EditHistoryEntryRepository;
import com.lab2fhir.repository.StructuredVersionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Append-only store of structured versions and their field level edit history.
 * Callers serialize appends per report (see {@link ReportLockManager}).
 */
@Service
public class VersionLedgerService {

    private static final Logger logger = LoggerFactory.getLogger(VersionLedgerService.class);

    private final StructuredVersionRepository versionRepository;
    private final EditHistoryEntryRepository editHistoryRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public VersionLedgerService(StructuredVersionRepository versionRepository,
                                EditHistoryEntryRepository editHistoryRepository,
                                ObjectMapper objectMapper,
                                Clock clock) {
        this.versionRepository = versionRepository;
        this.editHistoryRepository = editHistoryRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Stores {@code payload} verbatim as the next version of the report.
     * The number is {@code 1 + count(existing)}; nothing is numbered until it is persisted.
     */
    @Transactional
    public StructuredVersion appendVersion(LabReport report, LabDataPayload payload, VersionKind kind,
                                           ValidationOutcome outcome, String author) {
        if (report.isDuplicate()) {
            throw new PipelineException(ErrorCode.CONFLICT,
                    "Report " + report.getId() + " is a duplicate and cannot hold structured data");
        }
        int nextNumber = Math.toIntExact(versionRepository.countByReportId(report.getId()) + 1);
        StructuredVersion version = StructuredVersion.builder()
                .reportId(report.getId())
                .versionNumber(nextNumber)
                .versionKind(kind)
                .schemaVersion(payload.getSchemaVersion() != null
                        ? payload.getSchemaVersion()
                        : LabDataPayload.CURRENT_SCHEMA_VERSION)
                .payloadJson(writeJson(payload))
                .validationStatus(outcome.isValid() ? ValidationStatus.VALID : ValidationStatus.INVALID)
                .validationErrorsJson(outcome.isValid() ? null : writeJson(outcome.getErrors()))
                .createdBy(author)
                .createdAt(OffsetDateTime.now(clock))
                .build();
        StructuredVersion saved = versionRepository.save(version);
        logger.info("Appended {} version {} ({}) to report {}", kind.wireValue(), nextNumber,
                saved.getValidationStatus().wireValue(), report.getId());
        return saved;
    }

    /**
     * Highest numbered version whose validation outcome is valid.
     */
    @Transactional(readOnly = true)
    public Optional<StructuredVersion> latestValid(UUID reportId) {
        return versionRepository.findFirstByReportIdAndValidationStatusOrderByVersionNumberDesc(
                reportId, ValidationStatus.VALID);
    }

    @Transactional
    public EditHistoryEntry recordEdit(UUID versionId, String fieldPath, String oldValue, String newValue, String author) {
        EditHistoryEntry entry = EditHistoryEntry.builder()
                .versionId(versionId)
                .fieldPath(fieldPath)
                .oldValue(oldValue)
                .newValue(newValue)
                .editedBy(author)
                .editedAt(OffsetDateTime.now(clock))
                .build();
        return editHistoryRepository.save(entry);
    }

    /**
     * Changed leaves between two payloads. Timestamps compare as instants, so the same moment
     * written with another offset is not a change; changed timestamps are reported in UTC.
     */
    public List<FieldChange> diff(LabDataPayload previous, LabDataPayload current) {
        return PayloadDiff.diff(objectMapper.valueToTree(inUtc(previous)), objectMapper.valueToTree(inUtc(current)));
    }

    /**
     * The payload as it was appended, timestamps keeping the offset they were written with.
     */
    public LabDataPayload readPayload(StructuredVersion version) {
        try {
            return objectMapper.readerFor(LabDataPayload.class)
                    .without(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
                    .readValue(version.getPayloadJson());
        } catch (JsonProcessingException e) {
            throw new PipelineException(ErrorCode.INTERNAL_ERROR,
                    "Stored payload of version " + version.getId() + " is unreadable", null, e);
        }
    }

    public List<PayloadFieldError> readValidationErrors(StructuredVersion version) {
        if (version.getValidationErrorsJson() == null) {
            return List.of();
        }
        try {
            return objectMapper.readValue(version.getValidationErrorsJson(), new TypeReference<List<PayloadFieldError>>() {
            });
        } catch (JsonProcessingException e) {
            throw new PipelineException(ErrorCode.INTERNAL_ERROR,
                    "Stored validation errors of version " + version.getId() + " are unreadable", null, e);
        }
    }

    @Transactional(readOnly = true)
    public List<StructuredVersion> listVersions(UUID reportId) {
        return versionRepository.findAllByReportIdOrderByVersionNumberAsc(reportId);
    }

    @Transactional(readOnly = true)
    public List<EditHistoryEntry> listEdits(UUID reportId, int versionNumber) {
        StructuredVersion version = versionRepository.findByReportIdAndVersionNumber(reportId, versionNumber)
                .orElseThrow(() -> new NotFoundException(ErrorCode.PARSED_DATA_NOT_FOUND,
                        "Structured version", reportId + "/v" + versionNumber));
        return editHistoryRepository.findAllByVersionIdOrderByEditedAtAscFieldPathAsc(version.getId());
    }

    private static LabDataPayload inUtc(LabDataPayload payload) {
        if (payload == null) {
            return null;
        }
        List<LabMeasurement> measurements = payload.getMeasurements() == null
                ? null
                : payload.getMeasurements().stream()
                        .map(m -> m == null ? null : m.toBuilder()
                                .collectionDatetime(utc(m.getCollectionDatetime()))
                                .resultDatetime(utc(m.getResultDatetime()))
                                .build())
                        .collect(Collectors.toList());
        return payload.toBuilder()
                .reportDate(utc(payload.getReportDate()))
                .measurements(measurements)
                .build();
    }

    private static OffsetDateTime utc(OffsetDateTime value) {
        return value == null ? null : value.withOffsetSameInstant(ZoneOffset.UTC);
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PipelineException(ErrorCode.INTERNAL_ERROR, "Failed to serialize structured payload", null, e);
        }
    }
}
