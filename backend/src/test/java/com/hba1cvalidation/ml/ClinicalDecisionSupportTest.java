package com.hba1cvalidation.ml;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.hba1cvalidation.exception.InvalidRecordException;
import com.hba1cvalidation.exception.ModelNotTrainedException;
import com.hba1cvalidation.model.DisorderCategory;
import com.hba1cvalidation.model.LabField;
import com.hba1cvalidation.model.PatientRecord;

/**
 * End-to-end scenarios on the seeded model suite.
 */
@DisplayName("ClinicalDecisionSupport Tests")
class ClinicalDecisionSupportTest {

    private final ClinicalDecisionSupport cds = TrainedModels.decisionSupport();

    @Nested
    @DisplayName("Before initialization")
    class UninitializedTests {

        private final ClinicalDecisionSupport fresh = new ClinicalDecisionSupport(
                ModelHyperparameters.defaults(), ReliabilityThresholds.defaults());

        @Test
        @DisplayName("Should reject every inference call")
        void shouldRejectInference() {
            PatientRecord record = TrainedModels.typicalNormalRecord();

            assertFalse(fresh.isReady());
            assertEquals(0, fresh.getTrainingDataSize());
            assertThrows(ModelNotTrainedException.class, () -> fresh.assessTestResult(record));
            assertThrows(ModelNotTrainedException.class, () -> fresh.detectAnomaly(record));
            assertThrows(ModelNotTrainedException.class, () -> fresh.predictDisorder(record));
            assertThrows(ModelNotTrainedException.class, () -> fresh.correctHba1c(record));
        }

        @Test
        @DisplayName("Should reject an empty training corpus")
        void shouldRejectEmptyCorpus() {
            assertThrows(IllegalArgumentException.class, () -> fresh.initializeModels(List.of()));
            assertFalse(fresh.isReady());
        }
    }

    @Nested
    @DisplayName("assessTestResult()")
    class AssessTests {

        @Test
        @DisplayName("Should mark the iron deficiency example unreliable")
        void shouldFlagIronDeficiencyExample() {
            // Act
            AssessmentResult result = cds.assessTestResult(TrainedModels.ironDeficiencyRecord());

            // Assert
            assertEquals("P12345", result.getPatientId());
            assertEquals(DisorderCategory.IRON_DEFICIENCY, result.getDisorder().getPredictedCategory());
            assertNotEquals(0.0, result.getCorrection().getDelta());
            assertFalse(result.isReliable());
            assertTrue(result.getVerdict().violates(ReliabilityCondition.SUSPECTED_DISORDER));
            assertTrue(result.getRecommendations().stream().anyMatch(r -> r.contains("ferritin")));
        }

        @Test
        @DisplayName("Should flag the sparse iron deficiency record from imputed labs")
        void shouldFlagSparseIronDeficiencyRecord() {
            // Act
            AssessmentResult result = cds.assessTestResult(TrainedModels.sparseIronDeficiencyRecord());

            // Assert
            assertEquals("P12345", result.getPatientId());
            assertEquals(3, result.getOptionalLabsPresent());
            assertEquals(DisorderCategory.IRON_DEFICIENCY, result.getDisorder().getPredictedCategory());
            assertEquals(Hba1cCorrection.LifespanSource.OBSERVED, result.getCorrection().getLifespanSource());
            assertNotEquals(0.0, result.getCorrection().getDelta());
            assertFalse(result.isReliable());
        }

        @Test
        @DisplayName("Should mark a typical result reliable")
        void shouldAcceptTypicalResult() {
            // Act
            AssessmentResult result = cds.assessTestResult(TrainedModels.typicalNormalRecord());

            // Assert
            assertEquals(DisorderCategory.NONE, result.getDisorder().getPredictedCategory());
            assertFalse(result.getAnomaly().isAnomalous());
            assertTrue(Math.abs(result.getCorrection().getDelta()) < 0.3);
            assertTrue(result.isReliable(), () -> String.join("; ", result.getVerdict().getReasoning()));
            assertEquals(1.0, result.getLabCoverage());
            assertTrue(result.getDataQualityNotes().isEmpty());
        }

        @Test
        @DisplayName("Should cite the anomaly when the profile is anomalous")
        void shouldCiteAnomaly() {
            // Act
            AssessmentResult result = cds.assessTestResult(TrainedModels.extremeHemolysisRecord());

            // Assert
            assertTrue(result.getAnomaly().isAnomalous());
            assertFalse(result.isReliable());
            assertTrue(result.getVerdict().getReasoning().stream().anyMatch(r -> r.startsWith("Anomalous")));
        }

        @Test
        @DisplayName("Should succeed on required fields only and note the sparse panel")
        void shouldHandleRequiredOnly() {
            // Arrange
            PatientRecord record = PatientRecord.builder()
                    .patientId("R1").hba1c(6.4).fastingGlucose(125).haemoglobin(13.1).build();

            // Act
            AssessmentResult result = cds.assessTestResult(record);

            // Assert
            assertEquals(0, result.getOptionalLabsPresent());
            assertEquals(0.0, result.getLabCoverage());
            assertTrue(result.getDataQualityNotes().stream().anyMatch(n -> n.startsWith("Low lab coverage")));
            assertTrue(result.getDataQualityNotes().contains("Gender not supplied"));
        }

        @Test
        @DisplayName("Should report ignored optional fields")
        void shouldReportIgnoredFields() {
            // Arrange
            PatientRecord record = TrainedModels.typicalNormalRecord().toBuilder().ignoredField("ferritin").build();

            // Act
            AssessmentResult result = cds.assessTestResult(record);

            // Assert
            assertTrue(result.getDataQualityNotes().get(0).contains("ferritin"));
        }

        @Test
        @DisplayName("Should use the predicted category for an absent lifespan")
        void shouldUsePredictedLifespan() {
            // Arrange
            PatientRecord full = TrainedModels.ironDeficiencyRecord();
            PatientRecord.PatientRecordBuilder builder = full.toBuilder().clearLabs();
            for (LabField field : LabField.values()) {
                if (field != LabField.RBC_LIFESPAN_DAYS) {
                    full.lab(field).ifPresent(v -> builder.lab(field, v));
                }
            }

            // Act
            AssessmentResult result = cds.assessTestResult(builder.build());

            // Assert
            assertEquals(result.getDisorder().getPredictedCategory().getTypicalLifespanDays(),
                    result.getCorrection().getRbcLifespanDays());
            assertEquals(Hba1cCorrection.LifespanSource.PREDICTED_DISORDER, result.getCorrection().getLifespanSource());
        }

        @Test
        @DisplayName("Should propagate invalid required fields unchanged")
        void shouldPropagateInvalidRecord() {
            PatientRecord record = TrainedModels.typicalNormalRecord().toBuilder().haemoglobin(-1).build();

            InvalidRecordException ex = assertThrows(InvalidRecordException.class, () -> cds.assessTestResult(record));
            assertEquals(List.of("haemoglobin"), ex.getFields());
        }

        @Test
        @DisplayName("Should be deterministic across repeated calls")
        void shouldBeDeterministic() {
            PatientRecord record = TrainedModels.ironDeficiencyRecord();

            assertEquals(cds.assessTestResult(record), cds.assessTestResult(record));
        }
    }

    @Nested
    @DisplayName("correctHba1c()")
    class CorrectTests {

        @Test
        @DisplayName("Should match the assessment correction when lifespan is absent")
        void shouldMatchAssessmentWithoutLifespan() {
            // Arrange
            PatientRecord record = PatientRecord.builder()
                    .patientId("P20001").hba1c(7.2).fastingGlucose(120).haemoglobin(9.5)
                    .lab(LabField.FERRITIN, 12.0)
                    .lab(LabField.MCV, 75.0)
                    .lab(LabField.MCH, 25.0)
                    .lab(LabField.SERUM_IRON, 30.0)
                    .lab(LabField.TRANSFERRIN_SATURATION, 15.0)
                    .lab(LabField.TIBC, 450.0)
                    .build();

            // Act
            Hba1cCorrection standalone = cds.correctHba1c(record);
            AssessmentResult assessed = cds.assessTestResult(record);

            // Assert
            assertEquals(Hba1cCorrection.LifespanSource.PREDICTED_DISORDER, standalone.getLifespanSource());
            assertEquals(assessed.getCorrection().getRbcLifespanDays(), standalone.getRbcLifespanDays());
            assertEquals(assessed.getCorrection().getDelta(), standalone.getDelta(), 1e-12);
            assertEquals(assessed.getCorrection(), standalone);
        }

        @Test
        @DisplayName("Should keep an observed lifespan")
        void shouldKeepObservedLifespan() {
            Hba1cCorrection correction = cds.correctHba1c(TrainedModels.sparseIronDeficiencyRecord());

            assertEquals(Hba1cCorrection.LifespanSource.OBSERVED, correction.getLifespanSource());
            assertEquals(90.0, correction.getRbcLifespanDays());
        }
    }

    @Test
    @DisplayName("Should report the training corpus size")
    void shouldReportTrainingSize() {
        assertTrue(cds.isReady());
        assertEquals(TrainedModels.TRAINING_SIZE, cds.getTrainingDataSize());
        assertTrue(cds.currentSuite().isPresent());
    }
}
