package com.lab2fhir.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.io.BaseEncoding;
import com.lab2fhir.domain.AnalyteNormalizer;
import com.lab2fhir.domain.LabDataPayload;
import com.lab2fhir.domain.LabMeasurement;
import com.lab2fhir.model.LabReport;
import com.lab2fhir.model.PatientProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Projects a structured payload into a FHIR R4 transaction bundle.
 * <p>
 * Output is a pure function of the payload, the patient's identifying fields and the report's
 * immutable document fields: every resource id is content derived, map keys are serialized in
 * sorted order and no wall-clock value is included. Identical inputs therefore give a
 * byte-identical bundle and the same content hash.
 */
@Service
public class BundleAssemblerService {

    private static final Logger logger = LoggerFactory.getLogger(BundleAssemblerService.class);

    static final String SUBJECT_ID_SYSTEM = "urn:lab2fhir:subject-id";
    static final String FILE_HASH_SYSTEM = "urn:lab2fhir:file-sha256";
    static final String ANALYTE_SYSTEM = "urn:lab2fhir:analyte";
    static final String LOINC_SYSTEM = "http://loinc.org";
    static final String UCUM_SYSTEM = "http://unitsofmeasure.org";
    static final String OBSERVATION_CATEGORY_SYSTEM = "http://terminology.hl7.org/CodeSystem/observation-category";
    static final String DIAGNOSTIC_SERVICE_SYSTEM = "http://terminology.hl7.org/CodeSystem/v2-0074";
    static final String LAB_REPORT_LOINC = "11502-2";
    static final String LAB_REPORT_DISPLAY = "Laboratory report";

    private final DeterministicIdGenerator idGenerator;
    private final AnalyteCodeCatalog codeCatalog;
    private final ContentHashingService hashingService;
    private final ObjectMapper canonicalMapper;

    public BundleAssemblerService(DeterministicIdGenerator idGenerator,
                                  AnalyteCodeCatalog codeCatalog,
                                  ContentHashingService hashingService,
                                  ObjectMapper objectMapper) {
        this.idGenerator = idGenerator;
        this.codeCatalog = codeCatalog;
        this.hashingService = hashingService;
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.INDENT_OUTPUT, false);
    }

    /**
     * Builds the bundle: Patient, DocumentReference, DiagnosticReport, then one Observation per
     * measurement in payload order.
     */
    public AssembledBundle assemble(LabReport report, PatientProfile patient, LabDataPayload payload) {
        if (patient == null) {
            throw new NotFoundException(ErrorCode.PATIENT_NOT_FOUND, "Patient", report.getPatientId());
        }
        if (payload == null || payload.getMeasurements() == null || payload.getMeasurements().isEmpty()) {
            throw new NotFoundException(ErrorCode.PARSED_DATA_NOT_FOUND, "Structured measurements", report.getId());
        }
        String subjectId = patient.getExternalSubjectId();
        String patientId = idGenerator.patientId(subjectId);
        String patientRef = "Patient/" + patientId;

        Map<String, Object> patientResource = buildPatient(patientId, patient);
        Map<String, Object> documentReference = buildDocumentReference(report, patientRef);

        List<Map<String, Object>> observations = new ArrayList<>();
        for (LabMeasurement measurement : payload.getMeasurements()) {
            observations.add(buildObservation(measurement, subjectId, patientRef, (String) documentReference.get("id")));
        }
        Map<String, Object> diagnosticReport = buildDiagnosticReport(report, payload, subjectId, patientRef, observations);

        List<Map<String, Object>> ordered = new ArrayList<>();
        ordered.add(patientResource);
        ordered.add(documentReference);
        ordered.add(diagnosticReport);
        ordered.addAll(observations);

        List<Map<String, Object>> entries = new ArrayList<>();
        List<String> resourceIds = new ArrayList<>();
        for (Map<String, Object> resource : ordered) {
            String reference = resource.get("resourceType") + "/" + resource.get("id");
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("fullUrl", reference);
            entry.put("resource", resource);
            entry.put("request", Map.of("method", "PUT", "url", reference));
            entries.add(entry);
            resourceIds.add((String) resource.get("id"));
        }

        Map<String, Object> bundle = new LinkedHashMap<>();
        bundle.put("resourceType", "Bundle");
        bundle.put("type", "transaction");
        bundle.put("entry", entries);

        String json = serialize(bundle);
        String contentHash = hashingService.hash(json);
        logger.info("Assembled bundle for report {} with {} observations, hash {}",
                report.getId(), observations.size(), contentHash);
        return new AssembledBundle(json, contentHash, resourceIds);
    }

    private Map<String, Object> buildPatient(String patientId, PatientProfile patient) {
        Map<String, Object> resource = new LinkedHashMap<>();
        resource.put("resourceType", "Patient");
        resource.put("id", patientId);
        resource.put("identifier", List.of(Map.of(
                "system", SUBJECT_ID_SYSTEM,
                "value", patient.getExternalSubjectId())));
        resource.put("name", List.of(Map.of("text", patient.getDisplayName())));
        return resource;
    }

    private Map<String, Object> buildDocumentReference(LabReport report, String patientRef) {
        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("contentType", report.getMediaType());
        attachment.put("title", report.getOriginalFilename());
        attachment.put("hash", hexToBase64(report.getContentHash()));

        Map<String, Object> resource = new LinkedHashMap<>();
        resource.put("resourceType", "DocumentReference");
        resource.put("id", idGenerator.documentReferenceId(report.getContentHash()));
        resource.put("status", "current");
        resource.put("docStatus", "final");
        resource.put("identifier", List.of(Map.of(
                "system", FILE_HASH_SYSTEM,
                "value", report.getContentHash())));
        resource.put("type", labReportConcept());
        resource.put("subject", Map.of("reference", patientRef));
        resource.put("content", List.of(Map.of("attachment", attachment)));
        return resource;
    }

    private Map<String, Object> buildObservation(LabMeasurement measurement, String subjectId,
                                                 String patientRef, String documentReferenceId) {
        String analyte = AnalyteNormalizer.normalizeAnalyteName(measurement.effectiveAnalyte());
        String unit = AnalyteNormalizer.normalizeUnit(measurement.effectiveUnit());
        if (measurement.getValueType() == null) {
            throw new BundleGenerationException("Measurement " + measurement.getOriginalAnalyteName()
                    + " has no value type");
        }

        Object identityValue;
        Map<String, Object> resource = new LinkedHashMap<>();
        resource.put("resourceType", "Observation");
        resource.put("status", "final");
        resource.put("category", List.of(Map.of("coding", List.of(Map.of(
                "system", OBSERVATION_CATEGORY_SYSTEM,
                "code", "laboratory",
                "display", "Laboratory")))));
        resource.put("code", analyteConcept(analyte, measurement));
        resource.put("subject", Map.of("reference", patientRef));
        resource.put("derivedFrom", List.of(Map.of("reference", "DocumentReference/" + documentReferenceId)));
        resource.put("effectiveDateTime", DeterministicIdGenerator.canonicalize(measurement.getCollectionDatetime()));
        OffsetDateTime issued = measurement.getResultDatetime() != null
                ? measurement.getResultDatetime()
                : measurement.getCollectionDatetime();
        resource.put("issued", DeterministicIdGenerator.canonicalize(issued));

        switch (measurement.getValueType()) {
            case NUMERIC:
                identityValue = requireNumeric(measurement);
                resource.put("valueQuantity", quantity(measurement.getNumericValue(), unit, null));
                break;
            case OPERATOR_NUMERIC:
                identityValue = requireNumeric(measurement);
                if (measurement.getOperator() == null) {
                    throw new BundleGenerationException("Operator numeric measurement "
                            + measurement.getOriginalAnalyteName() + " has no operator");
                }
                String symbol = measurement.getOperator().getSymbol();
                resource.put("valueQuantity", quantity(measurement.getNumericValue(), unit, symbol));
                String annotation = symbol + DeterministicIdGenerator.canonicalize(measurement.getNumericValue())
                        + (unit != null ? " " + unit : "");
                resource.put("interpretation", List.of(Map.of("text", annotation)));
                break;
            case QUALITATIVE:
                identityValue = measurement.getQualitativeValue();
                resource.put("valueString", measurement.getQualitativeValue());
                break;
            default:
                throw new BundleGenerationException("Unsupported value type " + measurement.getValueType());
        }

        if (measurement.getReferenceRangeText() != null && !measurement.getReferenceRangeText().isBlank()) {
            resource.put("referenceRange", List.of(Map.of("text", measurement.getReferenceRangeText())));
        }
        resource.put("id", idGenerator.observationId(subjectId, measurement.getCollectionDatetime(),
                analyte, identityValue, unit));
        return resource;
    }

    private Map<String, Object> buildDiagnosticReport(LabReport report, LabDataPayload payload, String subjectId,
                                                      String patientRef, List<Map<String, Object>> observations) {
        Map<String, Object> resource = new LinkedHashMap<>();
        resource.put("resourceType", "DiagnosticReport");
        resource.put("id", idGenerator.diagnosticReportId(subjectId, payload.getReportDate(), report.getContentHash()));
        resource.put("status", "final");
        resource.put("category", List.of(Map.of("coding", List.of(Map.of(
                "system", DIAGNOSTIC_SERVICE_SYSTEM,
                "code", "LAB",
                "display", "Laboratory")))));
        resource.put("code", labReportConcept());
        resource.put("subject", Map.of("reference", patientRef));
        effectiveDate(payload).ifPresent(date ->
                resource.put("effectiveDateTime", DeterministicIdGenerator.canonicalize(date)));
        if (payload.getPerformingLab() != null && !payload.getPerformingLab().isBlank()) {
            resource.put("performer", List.of(Map.of("display", payload.getPerformingLab())));
        }
        List<Map<String, Object>> results = new ArrayList<>();
        for (Map<String, Object> observation : observations) {
            results.add(Map.of("reference", "Observation/" + observation.get("id")));
        }
        resource.put("result", results);
        return resource;
    }

    // Report date when known, otherwise the earliest collection time.
    private static Optional<OffsetDateTime> effectiveDate(LabDataPayload payload) {
        if (payload.getReportDate() != null) {
            return Optional.of(payload.getReportDate());
        }
        return payload.getMeasurements().stream()
                .map(LabMeasurement::getCollectionDatetime)
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder());
    }

    private Map<String, Object> analyteConcept(String normalizedAnalyte, LabMeasurement measurement) {
        Optional<AnalyteCodeCatalog.LoincCode> loinc = codeCatalog.lookup(normalizedAnalyte);
        if (loinc.isEmpty()) {
            loinc = codeCatalog.lookup(AnalyteNormalizer.normalizeAnalyteName(measurement.getOriginalAnalyteName()));
        }
        Map<String, Object> coding = new LinkedHashMap<>();
        if (loinc.isPresent()) {
            coding.put("system", LOINC_SYSTEM);
            coding.put("code", loinc.get().getCode());
            coding.put("display", loinc.get().getDisplay());
        } else {
            coding.put("system", ANALYTE_SYSTEM);
            coding.put("code", normalizedAnalyte);
            coding.put("display", measurement.getOriginalAnalyteName());
        }
        Map<String, Object> concept = new LinkedHashMap<>();
        concept.put("coding", List.of(coding));
        concept.put("text", measurement.getOriginalAnalyteName());
        return concept;
    }

    private static Map<String, Object> labReportConcept() {
        return Map.of("coding", List.of(Map.of(
                "system", LOINC_SYSTEM,
                "code", LAB_REPORT_LOINC,
                "display", LAB_REPORT_DISPLAY)));
    }

    private static Map<String, Object> quantity(Double value, String unit, String comparator) {
        Map<String, Object> quantity = new LinkedHashMap<>();
        quantity.put("value", value);
        if (comparator != null) {
            quantity.put("comparator", comparator);
        }
        if (unit != null) {
            quantity.put("unit", unit);
            quantity.put("system", UCUM_SYSTEM);
            quantity.put("code", unit);
        }
        return quantity;
    }

    private static Double requireNumeric(LabMeasurement measurement) {
        Double value = measurement.getNumericValue();
        if (value == null || value.isNaN() || value.isInfinite()) {
            throw new BundleGenerationException("Measurement " + measurement.getOriginalAnalyteName()
                    + " has no finite numeric value");
        }
        return value;
    }

    static String hexToBase64(String hex) {
        return BaseEncoding.base64().encode(BaseEncoding.base16().lowerCase().decode(hex));
    }

    private String serialize(Map<String, Object> bundle) {
        try {
            return canonicalMapper.writeValueAsString(bundle);
        } catch (JsonProcessingException e) {
            throw new BundleGenerationException("Failed to serialize bundle", e);
        }
    }
}
