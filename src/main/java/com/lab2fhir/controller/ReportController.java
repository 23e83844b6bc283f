package com.lab2fhir.controller;

import com.lab2fhir.dto.ApiErrorResponse;
import com.lab2fhir.dto.ReportResponse;
import com.lab2fhir.model.LabReport;
import com.lab2fhir.service.ErrorCode;
import com.lab2fhir.service.ReportPipelineService;
import com.lab2fhir.service.ReportQueryService;
import com.lab2fhir.service.StorageException;
import com.lab2fhir.service.SubmissionResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/reports")
@Tag(name = "Reports", description = "Upload lab report documents and inspect their lifecycle")
public class ReportController {

    private static final Logger logger = LoggerFactory.getLogger(ReportController.class);

    private final ReportPipelineService pipelineService;
    private final ReportQueryService queryService;

    public ReportController(ReportPipelineService pipelineService, ReportQueryService queryService) {
        this.pipelineService = pipelineService;
        this.queryService = queryService;
    }

    /**
     * Uploads a document. Byte-identical content that was already accepted is recorded as a
     * duplicate and answered with 409 naming the existing report.
     */
    @Operation(summary = "Upload a lab report document")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Report accepted"),
            @ApiResponse(responseCode = "404", description = "Patient not found"),
            @ApiResponse(responseCode = "409", description = "Identical document already uploaded"),
            @ApiResponse(responseCode = "415", description = "Unsupported media type"),
            @ApiResponse(responseCode = "422", description = "Empty file")
    })
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> uploadReport(
            @Parameter(description = "Report document", required = true)
            @RequestPart("file") MultipartFile file,
            @Parameter(description = "Owning patient profile ID", required = true)
            @RequestParam("patientId") UUID patientId) {
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new StorageException("Failed to read uploaded file", e);
        }
        SubmissionResult result = pipelineService.submit(content, file.getOriginalFilename(),
                file.getContentType(), patientId);
        if (result.isDuplicate()) {
            logger.info("Rejected duplicate upload for patient {}; existing report {}",
                    patientId, result.getCanonicalReportId());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("existing_report_id", result.getCanonicalReportId().toString());
            details.put("duplicate_report_id", result.getReport().getId().toString());
            details.put("file_hash", result.getContentHash());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiErrorResponse.of(
                    ErrorCode.DUPLICATE_UPLOAD.code(),
                    "This file has already been uploaded as report " + result.getCanonicalReportId(),
                    details));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(ReportResponse.from(result.getReport()));
    }

    @Operation(summary = "List reports, optionally for one patient")
    @GetMapping
    public List<ReportResponse> listReports(
            @Parameter(description = "Filter by patient profile ID")
            @RequestParam(value = "patientId", required = false) UUID patientId) {
        return queryService.listReports(patientId).stream()
                .map(ReportResponse::from)
                .collect(Collectors.toList());
    }

    @Operation(summary = "Get a report with its status metadata")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Report returned"),
            @ApiResponse(responseCode = "404", description = "Report not found")
    })
    @GetMapping("/{reportId}")
    public ReportResponse getReport(@PathVariable UUID reportId) {
        return ReportResponse.from(queryService.getReport(reportId));
    }

    @Operation(summary = "Download the uploaded source document")
    @GetMapping("/{reportId}/document")
    public ResponseEntity<byte[]> downloadDocument(@PathVariable UUID reportId) {
        LabReport report = queryService.getReport(reportId);
        byte[] content = queryService.loadDocument(report);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(report.getMediaType()))
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(report.getOriginalFilename())
                        .build()
                        .toString())
                .body(content);
    }
}
