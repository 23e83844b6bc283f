package com.lab2fhir.controller;

import com.lab2fhir.dto.BundleArtifactResponse;
import com.lab2fhir.dto.BundleGenerationResponse;
import com.lab2fhir.model.BundleArtifact;
import com.lab2fhir.model.GenerationMode;
import com.lab2fhir.service.PayloadValidationException;
import com.lab2fhir.service.ReportPipelineService;
import com.lab2fhir.service.ReportQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/reports/{reportId}/bundles")
@Tag(name = "Bundles", description = "FHIR bundle generation and download")
public class BundleController {

    static final MediaType FHIR_JSON = MediaType.parseMediaType("application/fhir+json");

    private final ReportPipelineService pipelineService;
    private final ReportQueryService queryService;

    public BundleController(ReportPipelineService pipelineService, ReportQueryService queryService) {
        this.pipelineService = pipelineService;
        this.queryService = queryService;
    }

    @Operation(summary = "Generate a FHIR bundle from the latest valid version",
            description = "Without a mode, completed reports are regenerated and others generate for the first time.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Bundle stored"),
            @ApiResponse(responseCode = "404", description = "No valid structured version; report marked failed"),
            @ApiResponse(responseCode = "409", description = "Report cannot generate from its current status"),
            @ApiResponse(responseCode = "500", description = "Bundle assembly failed; report marked failed")
    })
    @PostMapping
    public BundleGenerationResponse generateBundle(
            @PathVariable UUID reportId,
            @Parameter(description = "initial or regeneration")
            @RequestParam(value = "mode", required = false) String mode) {
        return BundleGenerationResponse.from(pipelineService.generateBundle(reportId, parseMode(mode)));
    }

    @Operation(summary = "List generated bundle artifacts, newest first")
    @GetMapping
    public List<BundleArtifactResponse> listBundles(@PathVariable UUID reportId) {
        return queryService.listArtifacts(reportId).stream()
                .map(BundleArtifactResponse::from)
                .collect(Collectors.toList());
    }

    @Operation(summary = "Download the latest bundle as FHIR JSON")
    @GetMapping("/latest/download")
    public ResponseEntity<String> downloadLatest(@PathVariable UUID reportId) {
        BundleArtifact artifact = queryService.latestArtifact(reportId);
        return ResponseEntity.ok()
                .contentType(FHIR_JSON)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename("bundle-" + reportId + ".json")
                        .build()
                        .toString())
                .header(HttpHeaders.ETAG, "\"" + artifact.getContentHash() + "\"")
                .body(artifact.getBundleJson());
    }

    private static GenerationMode parseMode(String mode) {
        if (mode == null || mode.isBlank()) {
            return null;
        }
        try {
            return GenerationMode.fromWireValue(mode);
        } catch (IllegalArgumentException e) {
            throw new PayloadValidationException("mode", "mode must be 'initial' or 'regeneration'");
        }
    }
}
