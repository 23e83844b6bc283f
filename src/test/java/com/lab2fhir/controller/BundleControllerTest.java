package com.lab2fhir.controller;

import com.lab2fhir.domain.ReportStatus;
import com.lab2fhir.model.BundleArtifact;
import com.lab2fhir.model.GenerationMode;
import com.lab2fhir.model.LabReport;
import com.lab2fhir.service.BundleGenerationResult;
import com.lab2fhir.service.ReportPipelineService;
import com.lab2fhir.service.ReportQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class BundleControllerTest {

    @Mock
    private ReportPipelineService pipelineService;

    @Mock
    private ReportQueryService queryService;

    private MockMvc mockMvc;
    private final UUID reportId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new BundleController(pipelineService, queryService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void regenerationReportsWhetherContentChanged() throws Exception {
        BundleArtifact artifact = artifact("abc");
        LabReport completed = LabReport.builder().id(reportId).status(ReportStatus.COMPLETED).build();
        when(pipelineService.generateBundle(reportId, GenerationMode.REGENERATION))
                .thenReturn(new BundleGenerationResult(artifact, completed, "abc"));

        mockMvc.perform(post("/api/reports/{reportId}/bundles", reportId).param("mode", "regeneration"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content_changed").value(false))
                .andExpect(jsonPath("$.previous_bundle_hash_sha256").value("abc"));
    }

    @Test
    void unknownModeIsRejectedBeforeGeneration() throws Exception {
        mockMvc.perform(post("/api/reports/{reportId}/bundles", reportId).param("mode", "partial"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error.code").value("validation_error"));
        verifyNoInteractions(pipelineService);
    }

    @Test
    void downloadServesFhirJsonWithHashAsEtag() throws Exception {
        when(queryService.latestArtifact(reportId)).thenReturn(artifact("def"));

        mockMvc.perform(get("/api/reports/{reportId}/bundles/latest/download", reportId))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("application/fhir+json"))
                .andExpect(header().string("ETag", "\"def\""))
                .andExpect(content().string("{\"resourceType\":\"Bundle\"}"));
    }

    private BundleArtifact artifact(String hash) {
        return BundleArtifact.builder()
                .id(UUID.randomUUID())
                .reportId(reportId)
                .structuredVersionId(UUID.randomUUID())
                .bundleJson("{\"resourceType\":\"Bundle\"}")
                .contentHash(hash)
                .generationMode(GenerationMode.REGENERATION)
                .generatedAt(OffsetDateTime.of(2024, 2, 1, 12, 0, 0, 0, ZoneOffset.UTC))
                .build();
    }
}
