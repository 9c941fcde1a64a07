package com.hba1cvalidation.ml;

import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.hba1cvalidation.model.DisorderCategory;
import com.hba1cvalidation.model.LabField;
import com.hba1cvalidation.model.TrainingExample;

@DisplayName("SyntheticPatientGenerator Tests")
class SyntheticPatientGeneratorTest {

    @Nested
    @DisplayName("Reproducibility")
    class ReproducibilityTests {

        @Test
        @DisplayName("Should generate the same corpus for the same seed")
        void shouldBeDeterministicForSeed() {
            // Act
            List<TrainingExample> first = new SyntheticPatientGenerator(7L).generate(50);
            List<TrainingExample> second = new SyntheticPatientGenerator(7L).generate(50);

            // Assert
            assertEquals(first, second);
        }

        @Test
        @DisplayName("Should reject a non-positive count")
        void shouldRejectNonPositiveCount() {
            assertThrows(IllegalArgumentException.class, () -> new SyntheticPatientGenerator(1L).generate(0));
        }

        @Test
        @DisplayName("Should reject a missing rate of one")
        void shouldRejectInvalidMissingRate() {
            assertThrows(IllegalArgumentException.class, () -> new SyntheticPatientGenerator(1L, 1.0));
        }
    }

    @Nested
    @DisplayName("Corpus shape")
    class CorpusTests {

        private final List<TrainingExample> corpus = TrainedModels.corpus();

        @Test
        @DisplayName("Should follow the category prior")
        void shouldFollowCategoryPrior() {
            // Arrange
            Map<DisorderCategory, Integer> counts = new EnumMap<>(DisorderCategory.class);
            corpus.forEach(e -> counts.merge(e.getLabel(), 1, Integer::sum));

            // Assert
            for (DisorderCategory category : DisorderCategory.values()) {
                double share = counts.getOrDefault(category, 0) / (double) corpus.size();
                assertEquals(category.getPrevalence(), share, 0.05, category.getCode());
            }
        }

        @Test
        @DisplayName("Should always supply the required fields within range")
        void shouldSupplyRequiredFields() {
            for (TrainingExample example : corpus) {
                assertDoesNotThrow(() -> FeatureVectorizer.validateRequired(example.getRecord()));
                assertEquals(example.getLabel(), example.getRecord().disorder().orElseThrow());
            }
        }

        @Test
        @DisplayName("Should blank optional fields at roughly the configured rate")
        void shouldBlankOptionalFields() {
            // Arrange
            long supplied = corpus.stream().mapToLong(e -> e.getRecord().presentLabCount()).sum();
            double possible = corpus.size() * (double) LabField.values().length;

            // Assert
            assertEquals(1.0 - SyntheticPatientGenerator.DEFAULT_MISSING_RATE, supplied / possible, 0.02);
        }

        @Test
        @DisplayName("Should make iron deficiency read falsely high and hemolysis falsely low")
        void shouldBiasMeasuredHba1cByCategory() {
            assertTrue(meanResidual(DisorderCategory.IRON_DEFICIENCY) < -0.05);
            assertTrue(meanResidual(DisorderCategory.SICKLE_CELL) > 0.5);
            assertEquals(0.0, meanResidual(DisorderCategory.NONE), 0.05);
        }

        @Test
        @DisplayName("Should give iron deficiency low ferritin")
        void shouldGiveIronDeficiencyLowFerritin() {
            double ferritin = corpus.stream()
                    .filter(e -> e.getLabel() == DisorderCategory.IRON_DEFICIENCY)
                    .map(e -> e.getRecord().lab(LabField.FERRITIN))
                    .filter(OptionalDouble::isPresent)
                    .mapToDouble(OptionalDouble::getAsDouble)
                    .max()
                    .orElseThrow();

            assertTrue(ferritin <= 30.0);
        }

        private double meanResidual(DisorderCategory category) {
            return corpus.stream()
                    .filter(e -> e.getLabel() == category)
                    .mapToDouble(TrainingExample::correctionResidual)
                    .average()
                    .orElseThrow();
        }
    }
}
