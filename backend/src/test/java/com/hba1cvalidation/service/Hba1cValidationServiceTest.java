package com.hba1cvalidation.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import com.hba1cvalidation.dto.BatchDTO;
import com.hba1cvalidation.dto.ModelDTO;
import com.hba1cvalidation.dto.ValidationDTO;
import com.hba1cvalidation.exception.InvalidRecordException;
import com.hba1cvalidation.exception.ModelNotTrainedException;
import com.hba1cvalidation.ml.AnomalyResult;
import com.hba1cvalidation.ml.AssessmentResult;
import com.hba1cvalidation.ml.ClinicalDecisionSupport;
import com.hba1cvalidation.ml.DisorderPrediction;
import com.hba1cvalidation.ml.Hba1cCorrection;
import com.hba1cvalidation.ml.ReliabilityCondition;
import com.hba1cvalidation.ml.ReliabilityVerdict;
import com.hba1cvalidation.model.DisorderCategory;

@ExtendWith(MockitoExtension.class)
@DisplayName("Hba1cValidationService Tests")
class Hba1cValidationServiceTest {

    @Mock
    private ModelRegistry registry;

    @Mock
    private ClinicalDecisionSupport cds;

    @Spy
    private PatientRecordMapper recordMapper = new PatientRecordMapper();

    @Spy
    private AssessmentMapper assessmentMapper = new AssessmentMapper();

    @InjectMocks
    private Hba1cValidationService validationService;

    private static Map<String, Object> payload(String patientId) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("patient_id", patientId);
        payload.put("hba1c", 6.5);
        payload.put("fasting_glucose", 120);
        payload.put("haemoglobin", 13.2);
        return payload;
    }

    private static AssessmentResult assessment(String patientId, boolean reliable) {
        Map<DisorderCategory, Double> probabilities = new EnumMap<>(DisorderCategory.class);
        for (DisorderCategory category : DisorderCategory.values()) {
            probabilities.put(category, category == DisorderCategory.NONE ? 0.8 : 0.05);
        }
        ReliabilityVerdict verdict = reliable
                ? ReliabilityVerdict.builder().reliable(true).reason("ok").build()
                : ReliabilityVerdict.builder()
                        .violation(ReliabilityCondition.SIGNIFICANT_CORRECTION)
                        .reason("Estimated correction of -0.45 points exceeds 0.30")
                        .build();
        return AssessmentResult.builder()
                .patientId(patientId)
                .anomaly(AnomalyResult.builder().anomalyScore(0.41234).threshold(1.9).anomalous(false)
                        .featuresAssessed(3).build())
                .disorder(DisorderPrediction.builder().predictedCategory(DisorderCategory.NONE)
                        .probabilities(probabilities).confidence(0.8).build())
                .correction(Hba1cCorrection.builder().reportedHba1c(6.5).correctedHba1c(6.05).delta(-0.45)
                        .rbcLifespanDays(120).lifespanSource(Hba1cCorrection.LifespanSource.POPULATION_DEFAULT)
                        .rationale("r").build())
                .verdict(verdict)
                .recommendation("rec")
                .labCoverage(0.0)
                .optionalLabsPresent(0)
                .build();
    }

    @Nested
    @DisplayName("assess()")
    class AssessTests {

        @Test
        @DisplayName("Should map the assessment to the wire format")
        void shouldMapAssessment() {
            // Arrange
            when(registry.requireReady()).thenReturn(cds);
            when(cds.assessTestResult(any())).thenReturn(assessment("P1", false));

            // Act
            ValidationDTO.AssessmentResponse response = validationService.assess(payload("P1"));

            // Assert
            assertTrue(response.isSuccess());
            assertNotNull(response.getTimestamp());
            ValidationDTO.Assessment assessment = response.getAssessment();
            assertEquals("P1", assessment.getPatientId());
            assertFalse(assessment.getTestValidity().getIsReliable());
            assertEquals(List.of("significant_correction"), assessment.getTestValidity().getViolations());
            assertEquals(0.4123, assessment.getAnomalyDetection().getAnomalyScore());
            assertEquals("none", assessment.getDisorderPrediction().getPredictedDisorder());
            assertEquals(List.of("none", "iron_deficiency", "thalassemia", "sickle_cell", "g6pd"),
                    List.copyOf(assessment.getDisorderPrediction().getProbabilities().keySet()));
            assertEquals(-0.45, assessment.getHba1cCorrection().getDelta());
            assertEquals("population_default", assessment.getHba1cCorrection().getLifespanSource());
        }

        @Test
        @DisplayName("Should reject requests while models are initializing")
        void shouldRejectWhileInitializing() {
            // Arrange
            when(registry.requireReady()).thenThrow(new ModelNotTrainedException("initializing"));

            // Act & Assert
            assertThrows(ModelNotTrainedException.class, () -> validationService.assess(payload("P1")));
            verifyNoInteractions(cds);
        }

        @Test
        @DisplayName("Should reject a record with a missing required field before inference")
        void shouldRejectMissingField() {
            // Arrange
            when(registry.requireReady()).thenReturn(cds);
            Map<String, Object> payload = payload("P1");
            payload.remove("fasting_glucose");

            // Act
            InvalidRecordException ex = assertThrows(InvalidRecordException.class,
                    () -> validationService.assess(payload));

            // Assert
            assertEquals(List.of("fasting_glucose"), ex.getFields());
            verify(cds, never()).assessTestResult(any());
        }
    }

    @Nested
    @DisplayName("batchAssess()")
    class BatchTests {

        @Test
        @DisplayName("Should assess every record and count outcomes")
        void shouldCountOutcomes() {
            // Arrange
            when(registry.requireReady()).thenReturn(cds);
            when(cds.assessTestResult(argThat(r -> r != null && r.getPatientId().equals("A"))))
                    .thenReturn(assessment("A", true));
            when(cds.assessTestResult(argThat(r -> r != null && r.getPatientId().equals("B"))))
                    .thenReturn(assessment("B", false));
            Map<String, Object> invalid = payload("C");
            invalid.remove("hba1c");
            BatchDTO.Request request = BatchDTO.Request.builder()
                    .patients(List.of(payload("A"), payload("B"), invalid))
                    .build();

            // Act
            BatchDTO.Response response = validationService.batchAssess(request);

            // Assert
            assertEquals(3, response.getTotalPatients());
            assertEquals(3, response.getProcessed());
            assertEquals(1, response.getUnreliableTests());
            assertEquals(1, response.getFailed());
            assertEquals(response.getTotalPatients(), response.getResults().size());
            BatchDTO.Item failed = response.getResults().get(2);
            assertFalse(failed.isSuccess());
            assertEquals("C", failed.getPatientId());
            assertEquals("INVALID_RECORD", failed.getErrorType());
            assertEquals("Missing required fields: hba1c", failed.getError());
        }

        @Test
        @DisplayName("Should keep going after an unexpected failure")
        void shouldIsolateUnexpectedFailures() {
            // Arrange
            when(registry.requireReady()).thenReturn(cds);
            when(cds.assessTestResult(any()))
                    .thenThrow(new IllegalStateException("boom"))
                    .thenReturn(assessment("B", true));
            BatchDTO.Request request = BatchDTO.Request.builder()
                    .patients(List.of(payload("A"), payload("B")))
                    .build();

            // Act
            BatchDTO.Response response = validationService.batchAssess(request);

            // Assert
            assertEquals(1, response.getFailed());
            assertEquals("INTERNAL_ERROR", response.getResults().get(0).getErrorType());
            assertTrue(response.getResults().get(1).isSuccess());
        }

        @Test
        @DisplayName("Should reject an empty batch with a descriptive error")
        void shouldRejectEmptyBatch() {
            // Arrange
            when(registry.requireReady()).thenReturn(cds);

            // Act
            InvalidRecordException ex = assertThrows(InvalidRecordException.class,
                    () -> validationService.batchAssess(BatchDTO.Request.builder().patients(List.of()).build()));

            // Assert
            assertEquals(List.of("patients"), ex.getFields());
            assertTrue(ex.getMessage().startsWith("No patient data provided"));
        }
    }

    @Nested
    @DisplayName("health() and exampleRequest()")
    class InfoTests {

        @Test
        @DisplayName("Should report initializing without models")
        void shouldReportInitializing() {
            // Arrange
            when(registry.current()).thenReturn(ModelState.initializing());

            // Act
            ModelDTO.HealthResponse health = validationService.health();

            // Assert
            assertEquals("initializing", health.getStatus());
            assertFalse(health.isModelsLoaded());
            assertNull(health.getError());
            assertEquals(Hba1cValidationService.SERVICE_NAME, health.getService());
        }

        @Test
        @DisplayName("Should report a latched failure")
        void shouldReportFailure() {
            when(registry.current()).thenReturn(ModelState.failed("singular covariance"));

            ModelDTO.HealthResponse health = validationService.health();

            assertEquals("failed", health.getStatus());
            assertEquals("singular covariance", health.getError());
        }

        @Test
        @DisplayName("Should describe the required and optional fields")
        void shouldDescribeExampleRequest() {
            // Act
            ModelDTO.ExampleRequestResponse example = validationService.exampleRequest();

            // Assert
            assertEquals(PatientRecordMapper.REQUIRED_FIELDS, example.getRequiredFields());
            assertTrue(example.getOptionalFields().contains("rbc_lifespan_days"));
            assertTrue(example.getExampleRequest().keySet().containsAll(example.getRequiredFields()));
            assertDoesNotThrow(() -> recordMapper.toRecord(example.getExampleRequest()));
        }
    }
}
