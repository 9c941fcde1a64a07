package com.hba1cvalidation.ml;

import lombok.Builder;
import lombok.Value;

/**
 * Fitting parameters shared by the three sub-models.
 */
@Value
@Builder
public class ModelHyperparameters {

    @Builder.Default
    long seed = 42L;

    @Builder.Default
    int forestTrees = 100;

    @Builder.Default
    int forestMaxDepth = 12;

    @Builder.Default
    int forestMinSamplesLeaf = 1;

    @Builder.Default
    int boostingStages = 150;

    @Builder.Default
    double boostingLearningRate = 0.1;

    @Builder.Default
    int boostingMaxDepth = 3;

    @Builder.Default
    int boostingMinSamplesLeaf = 5;

    /** Share of expected-profile training scores that fall below the anomaly threshold. */
    @Builder.Default
    double anomalyQuantile = 0.975;

    /** Weight pulling the covariance towards its diagonal. */
    @Builder.Default
    double anomalyShrinkage = 0.1;

    public static ModelHyperparameters defaults() {
        return ModelHyperparameters.builder().build();
    }
}
