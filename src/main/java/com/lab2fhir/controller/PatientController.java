package com.lab2fhir.controller;

import com.lab2fhir.dto.PatientCreateRequest;
import com.lab2fhir.dto.PatientResponse;
import com.lab2fhir.service.PatientProfileService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/patients")
@Tag(name = "Patients", description = "Subjects that lab reports belong to")
public class PatientController {

    private final PatientProfileService patientService;

    public PatientController(PatientProfileService patientService) {
        this.patientService = patientService;
    }

    @Operation(summary = "Create a patient profile")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Patient created"),
            @ApiResponse(responseCode = "409", description = "External subject id already registered"),
            @ApiResponse(responseCode = "422", description = "Missing or invalid fields")
    })
    @PostMapping
    public ResponseEntity<PatientResponse> createPatient(@RequestBody PatientCreateRequest request) {
        PatientResponse created = PatientResponse.from(patientService.create(
                request.externalSubjectId(), request.displayName(), request.subjectType()));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "List patient profiles, newest first")
    @GetMapping
    public List<PatientResponse> listPatients() {
        return patientService.list().stream().map(PatientResponse::from).collect(Collectors.toList());
    }

    @Operation(summary = "Get a patient profile")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Patient returned"),
            @ApiResponse(responseCode = "404", description = "Patient not found")
    })
    @GetMapping("/{patientId}")
    public PatientResponse getPatient(
            @Parameter(description = "Patient profile ID", required = true)
            @PathVariable UUID patientId) {
        return PatientResponse.from(patientService.get(patientId));
    }
}
