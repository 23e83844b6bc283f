package com.lab2fhir.controller;

import com.lab2fhir.domain.ReportStatus;
import com.lab2fhir.model.LabReport;
import com.lab2fhir.service.ErrorCode;
import com.lab2fhir.service.NotFoundException;
import com.lab2fhir.service.PipelineException;
import com.lab2fhir.service.ReportPipelineService;
import com.lab2fhir.service.ReportQueryService;
import com.lab2fhir.service.SubmissionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ReportControllerTest {

    private static final String HASH = "2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824";

    @Mock
    private ReportPipelineService pipelineService;

    @Mock
    private ReportQueryService queryService;

    private MockMvc mockMvc;
    private final UUID patientId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ReportController(pipelineService, queryService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void acceptedUploadReturnsCreatedReport() throws Exception {
        LabReport report = LabReport.builder()
                .id(UUID.randomUUID())
                .patientId(patientId)
                .originalFilename("cbc.pdf")
                .mediaType("application/pdf")
                .contentHash(HASH)
                .status(ReportStatus.UPLOADED)
                .build();
        when(pipelineService.submit(any(byte[].class), eq("cbc.pdf"), eq("application/pdf"), eq(patientId)))
                .thenReturn(SubmissionResult.accepted(report));

        mockMvc.perform(multipart("/api/reports").file(pdf()).param("patientId", patientId.toString()))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("uploaded"))
                .andExpect(jsonPath("$.file_hash_sha256").value(HASH))
                .andExpect(jsonPath("$.status_metadata.is_user_actionable").value(false))
                .andExpect(jsonPath("$.status_metadata.allowed_transitions.length()").value(3));
    }

    @Test
    void duplicateUploadIsConflictNamingExistingReport() throws Exception {
        UUID existingId = UUID.randomUUID();
        LabReport duplicate = LabReport.builder()
                .id(UUID.randomUUID())
                .patientId(patientId)
                .contentHash(HASH)
                .status(ReportStatus.DUPLICATE)
                .duplicateOfReportId(existingId)
                .build();
        when(pipelineService.submit(any(byte[].class), any(), any(), eq(patientId)))
                .thenReturn(SubmissionResult.duplicate(duplicate, existingId, HASH));

        mockMvc.perform(multipart("/api/reports").file(pdf()).param("patientId", patientId.toString()))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("duplicate_upload"))
                .andExpect(jsonPath("$.error.details.existing_report_id").value(existingId.toString()))
                .andExpect(jsonPath("$.error.details.duplicate_report_id").value(duplicate.getId().toString()))
                .andExpect(jsonPath("$.error.details.file_hash").value(HASH));
    }

    @Test
    void unsupportedMediaTypeUsesErrorEnvelope() throws Exception {
        when(pipelineService.submit(any(byte[].class), any(), any(), eq(patientId)))
                .thenThrow(new PipelineException(ErrorCode.INVALID_FILE_TYPE, "Unsupported media type: text/plain"));

        mockMvc.perform(multipart("/api/reports").file(pdf()).param("patientId", patientId.toString()))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.error.code").value("invalid_file_type"));
    }

    @Test
    void missingPatientIdIsBadRequest() throws Exception {
        mockMvc.perform(multipart("/api/reports").file(pdf()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("validation_error"));
    }

    @Test
    void unknownReportIsNotFound() throws Exception {
        UUID reportId = UUID.randomUUID();
        when(queryService.getReport(reportId))
                .thenThrow(new NotFoundException(ErrorCode.REPORT_NOT_FOUND, "Report", reportId));

        mockMvc.perform(get("/api/reports/{reportId}", reportId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("report_not_found"));
    }

    @Test
    void unexpectedFailureIsOpaque() throws Exception {
        UUID reportId = UUID.randomUUID();
        when(queryService.getReport(reportId)).thenThrow(new IllegalStateException("connection pool exhausted"));

        mockMvc.perform(get("/api/reports/{reportId}", reportId))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error.code").value("internal_error"))
                .andExpect(jsonPath("$.error.message").value("An unexpected error occurred"));
    }

    private static MockMultipartFile pdf() {
        return new MockMultipartFile("file", "cbc.pdf", "application/pdf", "%PDF-1.4 cbc".getBytes());
    }
}
