package com.hba1cvalidation.ml;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.hba1cvalidation.exception.ModelNotTrainedException;
import com.hba1cvalidation.model.DisorderCategory;
import com.hba1cvalidation.model.LabField;
import com.hba1cvalidation.model.PatientRecord;
import com.hba1cvalidation.model.TrainingExample;

@DisplayName("DisorderClassifier Tests")
class DisorderClassifierTest {

    private final DisorderClassifier classifier = TrainedModels.suite().getDisorderClassifier();

    @Nested
    @DisplayName("predictDisorder()")
    class PredictTests {

        @Test
        @DisplayName("Should recognise the iron deficiency example")
        void shouldRecogniseIronDeficiency() {
            // Act
            DisorderPrediction prediction = classifier.predictDisorder(TrainedModels.ironDeficiencyRecord());

            // Assert
            assertEquals(DisorderCategory.IRON_DEFICIENCY, prediction.getPredictedCategory());
            assertTrue(prediction.getConfidence() >= 0.6);
            assertTrue(prediction.isActionable(0.6));
        }

        @Test
        @DisplayName("Should predict no disorder for a typical panel")
        void shouldPredictNoneForTypicalPanel() {
            // Act
            DisorderPrediction prediction = classifier.predictDisorder(TrainedModels.typicalNormalRecord());

            // Assert
            assertEquals(DisorderCategory.NONE, prediction.getPredictedCategory());
            assertFalse(prediction.isActionable(0.6));
        }

        @Test
        @DisplayName("Should return probabilities for every category summing to one")
        void shouldReturnNormalizedProbabilities() {
            // Act
            DisorderPrediction prediction = classifier.predictDisorder(TrainedModels.ironDeficiencyRecord());

            // Assert
            assertEquals(DisorderCategory.values().length, prediction.getProbabilities().size());
            double sum = prediction.getProbabilities().values().stream().mapToDouble(Double::doubleValue).sum();
            assertEquals(1.0, sum, 1e-9);
            assertEquals(prediction.getConfidence(), prediction.probabilityOf(prediction.getPredictedCategory()));
        }

        @Test
        @DisplayName("Should succeed when only the required fields are supplied")
        void shouldHandleRequiredOnly() {
            PatientRecord record = PatientRecord.builder()
                    .patientId("R1").hba1c(6.0).fastingGlucose(105).haemoglobin(12.5).build();

            assertNotNull(classifier.predictDisorder(record).getPredictedCategory());
        }

        @Test
        @DisplayName("Should reach good accuracy on a held-out corpus")
        void shouldGeneralise() {
            // Arrange
            List<TrainingExample> holdout = new SyntheticPatientGenerator(4242L).generate(300);

            // Act
            long correct = holdout.stream()
                    .filter(e -> classifier.predictDisorder(e.getRecord()).getPredictedCategory() == e.getLabel())
                    .count();

            // Assert
            assertTrue(correct / 300.0 > 0.8, "accuracy " + correct / 300.0);
        }
    }

    @Nested
    @DisplayName("fit()")
    class FitTests {

        @Test
        @DisplayName("Should produce identical forests for the same seed")
        void shouldBeDeterministicForSeed() {
            // Arrange
            List<TrainingExample> corpus = new SyntheticPatientGenerator(11L).generate(200);
            FeatureVectorizer vectorizer = FeatureVectorizer.fit(corpus.stream().map(TrainingExample::getRecord).toList());
            ModelHyperparameters params = ModelHyperparameters.builder().forestTrees(10).seed(3L).build();
            DisorderClassifier first = new DisorderClassifier(vectorizer, params);
            DisorderClassifier second = new DisorderClassifier(vectorizer, params);

            // Act
            first.fit(corpus);
            second.fit(corpus);

            // Assert
            PatientRecord probe = TrainedModels.ironDeficiencyRecord().toBuilder().lab(LabField.MCV, 82.0).build();
            assertEquals(first.predictDisorder(probe), second.predictDisorder(probe));
        }

        @Test
        @DisplayName("Should refuse to predict before it is fitted")
        void shouldRefuseBeforeFit() {
            DisorderClassifier unfitted = new DisorderClassifier(TrainedModels.suite().getVectorizer(),
                    ModelHyperparameters.defaults());

            assertThrows(ModelNotTrainedException.class,
                    () -> unfitted.predictDisorder(TrainedModels.typicalNormalRecord()));
        }
    }
}
