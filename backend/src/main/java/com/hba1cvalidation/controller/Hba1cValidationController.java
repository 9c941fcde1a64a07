package com.hba1cvalidation.controller;

import com.hba1cvalidation.dto.BatchDTO;
import com.hba1cvalidation.dto.ModelDTO;
import com.hba1cvalidation.dto.ValidationDTO;
import com.hba1cvalidation.service.Hba1cValidationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * HbA1c validation REST API
 *
 * Payloads are flat snake_case lab panels; see /api/example-request.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
@Tag(name = "HbA1c Validation", description = "Reliability assessment of HbA1c results")
public class Hba1cValidationController {

    private final Hba1cValidationService validationService;

    @GetMapping("/health")
    @Operation(summary = "Service and model readiness")
    public ResponseEntity<ModelDTO.HealthResponse> health() {
        return ResponseEntity.ok(validationService.health());
    }

    @PostMapping("/validate-hba1c")
    @Operation(summary = "Assess whether an HbA1c result is reliable")
    public ResponseEntity<ValidationDTO.AssessmentResponse> validateHba1c(
            @RequestBody(required = false) Map<String, Object> patient) {
        return ResponseEntity.ok(validationService.assess(patient));
    }

    @PostMapping("/detect-anomaly")
    @Operation(summary = "Score how unusual a lab profile is")
    public ResponseEntity<ValidationDTO.AnomalyResponse> detectAnomaly(
            @RequestBody(required = false) Map<String, Object> patient) {
        return ResponseEntity.ok(validationService.detectAnomaly(patient));
    }

    @PostMapping("/predict-disorder")
    @Operation(summary = "Predict the most likely blood disorder")
    public ResponseEntity<ValidationDTO.DisorderResponse> predictDisorder(
            @RequestBody(required = false) Map<String, Object> patient) {
        return ResponseEntity.ok(validationService.predictDisorder(patient));
    }

    @PostMapping("/correct-hba1c")
    @Operation(summary = "Estimate the HbA1c corrected for RBC lifespan")
    public ResponseEntity<ValidationDTO.CorrectionResponse> correctHba1c(
            @RequestBody(required = false) Map<String, Object> patient) {
        return ResponseEntity.ok(validationService.correctHba1c(patient));
    }

    @PostMapping("/batch-validate")
    @Operation(summary = "Assess a batch of HbA1c results")
    public ResponseEntity<BatchDTO.Response> batchValidate(@RequestBody(required = false) BatchDTO.Request request) {
        return ResponseEntity.ok(validationService.batchAssess(request));
    }

    @GetMapping("/model-info")
    @Operation(summary = "Describe the trained models")
    public ResponseEntity<ModelDTO.ModelInfoResponse> modelInfo() {
        return ResponseEntity.ok(validationService.modelInfo());
    }

    @GetMapping("/example-request")
    @Operation(summary = "Example payload with required and optional fields")
    public ResponseEntity<ModelDTO.ExampleRequestResponse> exampleRequest() {
        return ResponseEntity.ok(validationService.exampleRequest());
    }
}
