package com.lab2fhir.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.lab2fhir.domain.FieldChange;
import com.lab2fhir.domain.LabDataPayload;
import com.lab2fhir.domain.LabMeasurement;
import com.lab2fhir.domain.ReportStatus;
import com.lab2fhir.domain.ValidationOutcome;
import com.lab2fhir.domain.ValueType;
import com.lab2fhir.model.EditHistoryEntry;
import com.lab2fhir.model.LabReport;
import com.lab2fhir.model.StructuredVersion;
import com.lab2fhir.model.ValidationStatus;
import com.lab2fhir.model.VersionKind;
import com.lab2fhir.repository.EditHistoryEntryRepository;
import com.lab2fhir.repository.StructuredVersionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VersionLedgerServiceTest {

    private static final OffsetDateTime COLLECTED = OffsetDateTime.of(2024, 1, 15, 8, 0, 0, 0, ZoneOffset.UTC);

    @Mock
    private StructuredVersionRepository versionRepository;

    @Mock
    private EditHistoryEntryRepository editHistoryRepository;

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private VersionLedgerService ledger;
    private LabReport report;

    @BeforeEach
    void setUp() {
        ledger = new VersionLedgerService(versionRepository, editHistoryRepository, objectMapper,
                Clock.fixed(Instant.parse("2024-02-01T12:00:00Z"), ZoneOffset.UTC));
        report = LabReport.builder().id(UUID.randomUUID()).status(ReportStatus.PARSING).build();
    }

    @Test
    void numbersVersionsFromCountOfExistingOnes() {
        List<StructuredVersion> stored = new ArrayList<>();
        when(versionRepository.countByReportId(report.getId())).thenAnswer(invocation -> (long) stored.size());
        when(versionRepository.save(any(StructuredVersion.class))).thenAnswer(invocation -> {
            StructuredVersion version = invocation.getArgument(0);
            stored.add(version);
            return version;
        });

        ledger.appendVersion(report, payload(95.0), VersionKind.ORIGINAL, ValidationOutcome.valid(), "system");
        ledger.appendVersion(report, payload(96.0), VersionKind.CORRECTED,
                ValidationOutcome.invalid("measurements[0].numeric_value", "bad"), "alice");
        ledger.appendVersion(report, payload(97.0), VersionKind.CORRECTED, ValidationOutcome.valid(), "alice");

        assertThat(stored).extracting(StructuredVersion::getVersionNumber).containsExactly(1, 2, 3);
        assertThat(stored.get(1).getValidationStatus()).isEqualTo(ValidationStatus.INVALID);
        assertThat(stored.get(1).getValidationErrorsJson()).contains("measurements[0].numeric_value");
        assertThat(stored.get(0).getValidationErrorsJson()).isNull();
        assertThat(stored.get(0).getPayloadJson()).contains("\"collection_datetime\":\"2024-01-15T08:00:00Z\"");
    }

    @Test
    void storedPayloadReadsBackUnchanged() {
        when(versionRepository.countByReportId(report.getId())).thenReturn(0L);
        when(versionRepository.save(any(StructuredVersion.class))).thenAnswer(invocation -> invocation.getArgument(0));
        LabDataPayload payload = payload(95.0);

        StructuredVersion version = ledger.appendVersion(report, payload, VersionKind.ORIGINAL,
                ValidationOutcome.valid(), "system");

        assertThat(ledger.readPayload(version)).isEqualTo(payload);
        assertThat(version.getSchemaVersion()).isEqualTo("1.0");
        assertThat(ledger.readValidationErrors(version)).isEmpty();
    }

    @Test
    void duplicateReportsCannotHoldVersions() {
        LabReport duplicate = LabReport.builder()
                .id(UUID.randomUUID())
                .status(ReportStatus.DUPLICATE)
                .duplicateOfReportId(UUID.randomUUID())
                .build();

        assertThatThrownBy(() -> ledger.appendVersion(duplicate, payload(95.0), VersionKind.ORIGINAL,
                ValidationOutcome.valid(), "system"))
                .isInstanceOf(PipelineException.class);
        verify(versionRepository, never()).save(any());
    }

    @Test
    void latestValidAsksForHighestValidVersion() {
        StructuredVersion v2 = StructuredVersion.builder().versionNumber(2).validationStatus(ValidationStatus.VALID).build();
        when(versionRepository.findFirstByReportIdAndValidationStatusOrderByVersionNumberDesc(
                report.getId(), ValidationStatus.VALID)).thenReturn(Optional.of(v2));

        assertThat(ledger.latestValid(report.getId())).contains(v2);
    }

    @Test
    void diffListsChangedMeasurementFields() {
        LabDataPayload before = payload(95.0);
        LabDataPayload after = payload(100.0);
        after.getMeasurements().get(0).setOriginalUnit("mmol/L");

        List<FieldChange> changes = ledger.diff(before, after);

        assertThat(changes).containsExactlyInAnyOrder(
                new FieldChange("measurements[0].numeric_value", "95.0", "100.0"),
                new FieldChange("measurements[0].original_unit", "mg/dL", "mmol/L"));
    }

    @Test
    void sameInstantInAnotherOffsetIsNotAChange() {
        LabDataPayload before = payload(95.0);
        LabDataPayload after = payload(95.0);
        after.getMeasurements().get(0).setCollectionDatetime(COLLECTED.withOffsetSameInstant(ZoneOffset.ofHours(2)));
        after.setReportDate(OffsetDateTime.parse("2024-01-16T01:00:00+01:00"));
        before.setReportDate(OffsetDateTime.parse("2024-01-16T00:00:00Z"));

        assertThat(ledger.diff(before, after)).isEmpty();
    }

    @Test
    void changedTimestampIsReportedInUtc() {
        LabDataPayload before = payload(95.0);
        LabDataPayload after = payload(95.0);
        after.getMeasurements().get(0).setCollectionDatetime(OffsetDateTime.parse("2024-01-15T12:00:00+02:00"));

        assertThat(ledger.diff(before, after)).containsExactly(new FieldChange(
                "measurements[0].collection_datetime", "2024-01-15T08:00:00Z", "2024-01-15T10:00:00Z"));
    }

    @Test
    void storedPayloadKeepsTheOffsetItWasWrittenWith() {
        when(versionRepository.countByReportId(report.getId())).thenReturn(0L);
        when(versionRepository.save(any(StructuredVersion.class))).thenAnswer(invocation -> invocation.getArgument(0));
        LabDataPayload payload = payload(95.0);
        OffsetDateTime local = OffsetDateTime.parse("2024-01-15T10:00:00+02:00");
        payload.getMeasurements().get(0).setCollectionDatetime(local);

        StructuredVersion version = ledger.appendVersion(report, payload, VersionKind.ORIGINAL,
                ValidationOutcome.valid(), "system");

        assertThat(version.getPayloadJson()).contains("\"collection_datetime\":\"2024-01-15T10:00:00+02:00\"");
        assertThat(ledger.readPayload(version).getMeasurements().get(0).getCollectionDatetime()).isEqualTo(local);
    }

    @Test
    void recordEditStoresOneEntry() {
        UUID versionId = UUID.randomUUID();
        when(editHistoryRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

        EditHistoryEntry entry = ledger.recordEdit(versionId, "measurements[0].numeric_value", "95.0", "100.0", "alice");

        assertThat(entry.getVersionId()).isEqualTo(versionId);
        assertThat(entry.getEditedBy()).isEqualTo("alice");
        assertThat(entry.getEditedAt()).isEqualTo(OffsetDateTime.parse("2024-02-01T12:00:00Z"));
    }

    private static LabDataPayload payload(double value) {
        return LabDataPayload.builder()
                .schemaVersion("1.0")
                .measurements(new ArrayList<>(List.of(LabMeasurement.builder()
                        .originalAnalyteName("Glucose")
                        .valueType(ValueType.NUMERIC)
                        .numericValue(value)
                        .originalUnit("mg/dL")
                        .collectionDatetime(COLLECTED)
                        .build())))
                .build();
    }
}
