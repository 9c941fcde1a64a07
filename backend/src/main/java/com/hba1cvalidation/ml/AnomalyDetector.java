package com.hba1cvalidation.ml;

import com.hba1cvalidation.exception.ModelNotTrainedException;
import com.hba1cvalidation.model.DisorderCategory;
import com.hba1cvalidation.model.PatientRecord;
import com.hba1cvalidation.model.TrainingExample;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Scores how far a lab profile lies from the expected (disorder-free) profile.
 *
 * The model is a shrinkage covariance over the standardized value block of the
 * feature vector. A record is scored on the values it actually supplied: the
 * squared Mahalanobis distance over that marginal is mapped to standard-normal
 * units with the Wilson-Hilferty transform, so records with different numbers
 * of supplied labs are comparable and an absent lab can never raise the score.
 * The threshold is the configured quantile of the training scores.
 */
@Slf4j
public class AnomalyDetector {

    public static final String MODEL_TYPE = "Mahalanobis Distance (shrinkage covariance)";

    private static final double SIGNIFICANT_DEVIATION = 2.0;
    private static final int FALLBACK_FACTORS = 3;
    private static final double RIDGE = 1e-6;

    private final FeatureVectorizer vectorizer;
    private final double quantile;
    private final double shrinkage;

    private volatile Artifact artifact;

    public AnomalyDetector(FeatureVectorizer vectorizer, ModelHyperparameters params) {
        this.vectorizer = vectorizer;
        this.quantile = params.getAnomalyQuantile();
        this.shrinkage = params.getAnomalyShrinkage();
    }

    public boolean isTrained() {
        return artifact != null;
    }

    public void fit(List<TrainingExample> examples) {
        List<FeatureVector> vectors = new ArrayList<>();
        for (TrainingExample example : examples) {
            if (example.getLabel() == DisorderCategory.NONE) {
                vectors.add(vectorizer.vectorize(example.getRecord()));
            }
        }
        if (vectors.size() < 2 * FeatureVectorizer.VALUE_COUNT) {
            log.warn("Only {} expected-profile examples, fitting anomaly model on all {} examples",
                vectors.size(), examples.size());
            vectors.clear();
            examples.forEach(e -> vectors.add(vectorizer.vectorize(e.getRecord())));
        }
        if (vectors.size() < 2) {
            throw new IllegalArgumentException("At least two examples are required to fit the anomaly model");
        }

        double[] mean = presentMeans(vectors);
        double[][] covariance = shrunkCovariance(vectors, mean);

        Artifact fitted = new Artifact(mean, covariance, Double.NaN, vectors.size());
        double[] scores = new double[vectors.size()];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = fitted.score(vectors.get(i)).zScore;
        }
        Arrays.sort(scores);
        int index = Math.min(scores.length - 1, Math.max(0, (int) Math.ceil(quantile * scores.length) - 1));
        double threshold = scores[index];

        artifact = new Artifact(mean, covariance, threshold, vectors.size());
        log.info("Anomaly detector fitted on {} profiles, threshold {} at quantile {}",
            vectors.size(), String.format("%.3f", threshold), quantile);
    }

    public AnomalyResult detectAnomaly(PatientRecord record) {
        requireTrained();
        return detectAnomaly(vectorizer.vectorize(record));
    }

    public AnomalyResult detectAnomaly(FeatureVector vector) {
        Artifact model = requireTrained();
        Score score = model.score(vector);
        boolean anomalous = score.zScore > model.threshold;

        return AnomalyResult.builder()
            .anomalyScore(score.zScore)
            .threshold(model.threshold)
            .anomalous(anomalous)
            .contributingFactors(contributingFactors(model, score, anomalous))
            .featuresAssessed(score.indices.length)
            .build();
    }

    public int getTrainingSize() {
        Artifact model = artifact;
        return model == null ? 0 : model.trainingSize;
    }

    private Artifact requireTrained() {
        Artifact model = artifact;
        if (model == null) {
            throw new ModelNotTrainedException("Anomaly detector has not been trained");
        }
        return model;
    }

    private static List<String> contributingFactors(Artifact model, Score score, boolean anomalous) {
        if (!anomalous) {
            return List.of();
        }
        List<String> names = FeatureVectorizer.valueNames();
        int k = score.indices.length;
        double[] deviation = new double[k];
        double[] contribution = new double[k];
        List<Integer> significant = new ArrayList<>();
        for (int i = 0; i < k; i++) {
            int column = score.indices[i];
            deviation[i] = Math.abs(score.delta[i]) / Math.sqrt(model.covariance[column][column]);
            contribution[i] = score.delta[i] * score.solved[i];
            if (deviation[i] >= SIGNIFICANT_DEVIATION) {
                significant.add(i);
            }
        }
        List<Integer> chosen;
        if (!significant.isEmpty()) {
            significant.sort(Comparator.comparingDouble(i -> -deviation[i]));
            chosen = significant;
        } else {
            // unusual combination rather than any single extreme value
            chosen = new ArrayList<>();
            for (int i = 0; i < k; i++) {
                if (contribution[i] > 0.0) {
                    chosen.add(i);
                }
            }
            chosen.sort(Comparator.comparingDouble(i -> -contribution[i]));
            chosen = chosen.subList(0, Math.min(FALLBACK_FACTORS, chosen.size()));
        }
        List<String> factors = new ArrayList<>(chosen.size());
        chosen.forEach(i -> factors.add(names.get(score.indices[i])));
        return factors;
    }

    private static double[] presentMeans(List<FeatureVector> vectors) {
        int width = FeatureVectorizer.VALUE_COUNT;
        double[] sums = new double[width];
        int[] counts = new int[width];
        for (FeatureVector v : vectors) {
            for (int j = 0; j < width; j++) {
                if (v.isPresent(j)) {
                    sums[j] += v.get(j);
                    counts[j]++;
                }
            }
        }
        double[] mean = new double[width];
        for (int j = 0; j < width; j++) {
            mean[j] = counts[j] == 0 ? 0.0 : sums[j] / counts[j];
        }
        return mean;
    }

    private double[][] shrunkCovariance(List<FeatureVector> vectors, double[] mean) {
        int width = mean.length;
        double[][] cov = new double[width][width];
        double[] centred = new double[width];
        for (FeatureVector v : vectors) {
            for (int j = 0; j < width; j++) {
                // absent values sit at the mean and add nothing
                centred[j] = v.isPresent(j) ? v.get(j) - mean[j] : 0.0;
            }
            for (int a = 0; a < width; a++) {
                for (int b = a; b < width; b++) {
                    cov[a][b] += centred[a] * centred[b];
                }
            }
        }
        int denominator = vectors.size() - 1;
        for (int a = 0; a < width; a++) {
            for (int b = a; b < width; b++) {
                double value = cov[a][b] / denominator;
                if (a != b) {
                    value *= 1.0 - shrinkage;
                }
                cov[a][b] = value;
                cov[b][a] = value;
            }
            cov[a][a] += RIDGE;
        }
        return cov;
    }

    private static final class Score {
        final int[] indices;
        final double[] delta;
        final double[] solved;
        final double zScore;

        Score(int[] indices, double[] delta, double[] solved, double zScore) {
            this.indices = indices;
            this.delta = delta;
            this.solved = solved;
            this.zScore = zScore;
        }
    }

    private static final class Artifact {
        final double[] mean;
        final double[][] covariance;
        final double threshold;
        final int trainingSize;

        Artifact(double[] mean, double[][] covariance, double threshold, int trainingSize) {
            this.mean = mean;
            this.covariance = covariance;
            this.threshold = threshold;
            this.trainingSize = trainingSize;
        }

        Score score(FeatureVector vector) {
            int[] indices = new int[FeatureVectorizer.VALUE_COUNT];
            int k = 0;
            for (int j = 0; j < FeatureVectorizer.VALUE_COUNT; j++) {
                if (vector.isPresent(j)) {
                    indices[k++] = j;
                }
            }
            indices = Arrays.copyOf(indices, k);
            double[] delta = new double[k];
            for (int i = 0; i < k; i++) {
                delta[i] = vector.get(indices[i]) - mean[indices[i]];
            }
            double[] solved = LinearAlgebra.solve(LinearAlgebra.submatrix(covariance, indices), delta);
            double distanceSquared = 0.0;
            for (int i = 0; i < k; i++) {
                distanceSquared += delta[i] * solved[i];
            }
            return new Score(indices, delta, solved, wilsonHilferty(Math.max(0.0, distanceSquared), k));
        }

        /** Maps a chi-square statistic with k degrees of freedom to an approximate standard normal deviate. */
        private static double wilsonHilferty(double chiSquare, int k) {
            double variance = 2.0 / (9.0 * k);
            return (Math.cbrt(chiSquare / k) - (1.0 - variance)) / Math.sqrt(variance);
        }
    }
}
