package com.lab2fhir.controller;

import com.lab2fhir.domain.LabDataPayload;
import com.lab2fhir.dto.EditHistoryResponse;
import com.lab2fhir.dto.ReportResponse;
import com.lab2fhir.dto.StructuredVersionResponse;
import com.lab2fhir.model.StructuredVersion;
import com.lab2fhir.service.ReportPipelineService;
import com.lab2fhir.service.ReportQueryService;
import com.lab2fhir.service.VersionLedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/reports/{reportId}")
@Tag(name = "Parsed data", description = "Structured versions, corrections and edit history")
public class ParsedDataController {

    private final ReportPipelineService pipelineService;
    private final ReportQueryService queryService;
    private final VersionLedgerService ledger;

    public ParsedDataController(ReportPipelineService pipelineService,
                                ReportQueryService queryService,
                                VersionLedgerService ledger) {
        this.pipelineService = pipelineService;
        this.queryService = queryService;
        this.ledger = ledger;
    }

    /**
     * Entry point for the extraction collaborator: stores its output as the next original version.
     */
    @Operation(summary = "Submit extracted structured data for a report")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Stored; report awaits review"),
            @ApiResponse(responseCode = "409", description = "Report cannot enter parsing from its current status"),
            @ApiResponse(responseCode = "422", description = "Payload failed validation; report marked failed")
    })
    @PostMapping("/parsed-data")
    public ReportResponse submitParsedData(
            @PathVariable UUID reportId,
            @RequestBody LabDataPayload payload,
            @Parameter(description = "Author recorded on the version")
            @RequestHeader(value = "X-Edited-By", required = false) String author) {
        return ReportResponse.from(pipelineService.advance(reportId, payload, author));
    }

    @Operation(summary = "Move a report into editing")
    @PostMapping("/editing")
    public ReportResponse startEditing(@PathVariable UUID reportId) {
        return ReportResponse.from(pipelineService.startEditing(reportId));
    }

    @Operation(summary = "Save a manual correction as a new version")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Corrected version (or the unchanged latest one)"),
            @ApiResponse(responseCode = "404", description = "Report or valid version not found"),
            @ApiResponse(responseCode = "409", description = "Report cannot be edited in its current status"),
            @ApiResponse(responseCode = "422", description = "Edited payload failed validation")
    })
    @PutMapping("/parsed-data")
    public StructuredVersionResponse correctParsedData(
            @PathVariable UUID reportId,
            @RequestBody LabDataPayload payload,
            @Parameter(description = "Who made the edit", required = true)
            @RequestHeader(value = "X-Edited-By", required = false) String author) {
        return toResponse(pipelineService.correct(reportId, payload, author));
    }

    @Operation(summary = "Latest valid structured version")
    @GetMapping("/parsed-data")
    public StructuredVersionResponse latestParsedData(@PathVariable UUID reportId) {
        return toResponse(queryService.latestValidVersion(reportId));
    }

    @Operation(summary = "All structured versions, oldest first")
    @GetMapping("/parsed-data/versions")
    public List<StructuredVersionResponse> listVersions(@PathVariable UUID reportId) {
        return queryService.listVersions(reportId).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    @Operation(summary = "Field level edits that produced a version")
    @GetMapping("/parsed-data/versions/{versionNumber}/edits")
    public List<EditHistoryResponse> listEdits(@PathVariable UUID reportId, @PathVariable int versionNumber) {
        return queryService.listEdits(reportId, versionNumber).stream()
                .map(EditHistoryResponse::from)
                .collect(Collectors.toList());
    }

    private StructuredVersionResponse toResponse(StructuredVersion version) {
        return StructuredVersionResponse.from(version, ledger.readPayload(version), ledger.readValidationErrors(version));
    }
}
