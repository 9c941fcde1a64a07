package com.hba1cvalidation.ml;

import com.hba1cvalidation.exception.ModelNotTrainedException;
import com.hba1cvalidation.model.LabField;
import com.hba1cvalidation.model.PatientRecord;
import com.hba1cvalidation.model.TrainingExample;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the three models over a patient record and decides whether its HbA1c
 * can be trusted.
 *
 * Models are fitted together and published as one immutable {@link ModelSuite};
 * a caller always sees either no models or a complete, consistent set.
 */
@Slf4j
public class ClinicalDecisionSupport {

    private final ModelHyperparameters params;
    private final ReliabilityThresholds thresholds;
    private final AtomicReference<ModelSuite> suite = new AtomicReference<>();

    public ClinicalDecisionSupport(ModelHyperparameters params, ReliabilityThresholds thresholds) {
        this.params = params;
        this.thresholds = thresholds;
    }

    public void initializeModels(List<TrainingExample> examples) {
        if (examples == null || examples.isEmpty()) {
            throw new IllegalArgumentException("Training corpus is empty");
        }
        long started = System.currentTimeMillis();
        FeatureVectorizer vectorizer = FeatureVectorizer.fit(
            examples.stream().map(TrainingExample::getRecord).toList());

        AnomalyDetector anomalyDetector = new AnomalyDetector(vectorizer, params);
        anomalyDetector.fit(examples);
        DisorderClassifier disorderClassifier = new DisorderClassifier(vectorizer, params);
        disorderClassifier.fit(examples);
        HbA1cCorrector corrector = new HbA1cCorrector(vectorizer, params);
        corrector.fit(examples);

        suite.set(new ModelSuite(vectorizer, anomalyDetector, disorderClassifier, corrector,
            examples.size(), Instant.now()));
        log.info("Models initialized on {} examples in {} ms", examples.size(),
            System.currentTimeMillis() - started);
    }

    public boolean isReady() {
        return suite.get() != null;
    }

    public AssessmentResult assessTestResult(PatientRecord record) {
        ModelSuite models = requireSuite();
        FeatureVector vector = models.getVectorizer().vectorize(record);

        AnomalyResult anomaly = models.getAnomalyDetector().detectAnomaly(vector);
        DisorderPrediction disorder = models.getDisorderClassifier().predictDisorder(vector);
        Hba1cCorrection correction = models.getHba1cCorrector()
            .predictCorrectedHba1c(record, vector, Optional.of(disorder.getPredictedCategory()));
        ReliabilityVerdict verdict = ReliabilityRule.evaluate(anomaly, disorder, correction, thresholds);

        int labsPresent = usableLabCount(vector);
        double coverage = (double) labsPresent / LabField.values().length;

        AssessmentResult result = AssessmentResult.builder()
            .patientId(record.getPatientId())
            .anomaly(anomaly)
            .disorder(disorder)
            .correction(correction)
            .verdict(verdict)
            .recommendations(RecommendationPolicy.recommend(anomaly, disorder, correction, verdict,
                coverage, thresholds))
            .labCoverage(coverage)
            .optionalLabsPresent(labsPresent)
            .dataQualityNotes(dataQualityNotes(record, disorder, correction, labsPresent, coverage))
            .build();

        log.debug("Assessed {}: reliable={}, category={}, delta={}", record.getPatientId(),
            verdict.isReliable(), disorder.getPredictedCategory().getCode(),
            String.format(Locale.ROOT, "%.3f", correction.getDelta()));
        return result;
    }

    public AnomalyResult detectAnomaly(PatientRecord record) {
        return requireSuite().getAnomalyDetector().detectAnomaly(record);
    }

    public DisorderPrediction predictDisorder(PatientRecord record) {
        return requireSuite().getDisorderClassifier().predictDisorder(record);
    }

    /**
     * Standalone correction. An absent lifespan is imputed from the classifier's
     * prediction, so the result matches the correction inside a full assessment.
     */
    public Hba1cCorrection correctHba1c(PatientRecord record) {
        ModelSuite models = requireSuite();
        FeatureVector vector = models.getVectorizer().vectorize(record);
        DisorderPrediction disorder = models.getDisorderClassifier().predictDisorder(vector);
        return models.getHba1cCorrector()
            .predictCorrectedHba1c(record, vector, Optional.of(disorder.getPredictedCategory()));
    }

    public Optional<ModelSuite> currentSuite() {
        return Optional.ofNullable(suite.get());
    }

    public int getTrainingDataSize() {
        ModelSuite models = suite.get();
        return models == null ? 0 : models.getTrainingSize();
    }

    public ReliabilityThresholds getThresholds() {
        return thresholds;
    }

    private ModelSuite requireSuite() {
        ModelSuite models = suite.get();
        if (models == null) {
            throw new ModelNotTrainedException("Models have not been initialized");
        }
        return models;
    }

    private static int usableLabCount(FeatureVector vector) {
        int count = 0;
        for (LabField field : LabField.values()) {
            if (vector.isPresent(FeatureVectorizer.valueIndex(field))) {
                count++;
            }
        }
        return count;
    }

    private List<String> dataQualityNotes(PatientRecord record, DisorderPrediction disorder,
                                          Hba1cCorrection correction, int labsPresent, double coverage) {
        List<String> notes = new ArrayList<>();
        if (!record.getIgnoredFields().isEmpty()) {
            notes.add("Ignored unusable optional fields: " + String.join(", ", record.getIgnoredFields()));
        }
        if (coverage < thresholds.getLowCoverageFraction()) {
            notes.add(String.format(Locale.ROOT,
                "Low lab coverage: %d of %d optional labs supplied; absent values were imputed",
                labsPresent, LabField.values().length));
        }
        if (correction.getLifespanSource() == Hba1cCorrection.LifespanSource.PREDICTED_DISORDER) {
            notes.add(String.format(Locale.ROOT,
                "RBC lifespan not supplied; %.0f days assumed from the predicted category (%s)",
                correction.getRbcLifespanDays(), disorder.getPredictedCategory().getCode()));
        }
        if (record.gender().isEmpty()) {
            notes.add("Gender not supplied");
        }
        return notes;
    }
}
