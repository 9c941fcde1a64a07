package com.hba1cvalidation.config;

import com.hba1cvalidation.ml.ClinicalDecisionSupport;
import com.hba1cvalidation.ml.ModelHyperparameters;
import com.hba1cvalidation.ml.ReliabilityThresholds;
import com.hba1cvalidation.ml.SyntheticPatientGenerator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Model and training configuration
 *
 * A negative seed gives a randomized training corpus on every start.
 */
@Configuration
public class ModelConfig {

    @Value("${hba1c.training.seed:42}")
    private long seed;

    @Value("${hba1c.training.missing-rate:0.15}")
    private double missingRate;

    @Value("${hba1c.model.forest.trees:100}")
    private int forestTrees;

    @Value("${hba1c.model.forest.max-depth:12}")
    private int forestMaxDepth;

    @Value("${hba1c.model.forest.min-samples-leaf:1}")
    private int forestMinSamplesLeaf;

    @Value("${hba1c.model.boosting.stages:150}")
    private int boostingStages;

    @Value("${hba1c.model.boosting.learning-rate:0.1}")
    private double boostingLearningRate;

    @Value("${hba1c.model.boosting.max-depth:3}")
    private int boostingMaxDepth;

    @Value("${hba1c.model.boosting.min-samples-leaf:5}")
    private int boostingMinSamplesLeaf;

    @Value("${hba1c.model.anomaly.quantile:0.975}")
    private double anomalyQuantile;

    @Value("${hba1c.model.anomaly.shrinkage:0.1}")
    private double anomalyShrinkage;

    @Value("${hba1c.reliability.min-actionable-confidence:0.6}")
    private double minActionableConfidence;

    @Value("${hba1c.reliability.max-insignificant-delta:0.3}")
    private double maxInsignificantDelta;

    @Value("${hba1c.reliability.low-coverage-fraction:0.25}")
    private double lowCoverageFraction;

    @Bean
    public ModelHyperparameters modelHyperparameters() {
        return ModelHyperparameters.builder()
            .seed(seed)
            .forestTrees(forestTrees)
            .forestMaxDepth(forestMaxDepth)
            .forestMinSamplesLeaf(forestMinSamplesLeaf)
            .boostingStages(boostingStages)
            .boostingLearningRate(boostingLearningRate)
            .boostingMaxDepth(boostingMaxDepth)
            .boostingMinSamplesLeaf(boostingMinSamplesLeaf)
            .anomalyQuantile(anomalyQuantile)
            .anomalyShrinkage(anomalyShrinkage)
            .build();
    }

    @Bean
    public ReliabilityThresholds reliabilityThresholds() {
        return ReliabilityThresholds.builder()
            .minActionableConfidence(minActionableConfidence)
            .maxInsignificantDelta(maxInsignificantDelta)
            .lowCoverageFraction(lowCoverageFraction)
            .build();
    }

    @Bean
    public SyntheticPatientGenerator syntheticPatientGenerator() {
        return new SyntheticPatientGenerator(seed < 0 ? null : seed, missingRate);
    }

    @Bean
    public ClinicalDecisionSupport clinicalDecisionSupport(ModelHyperparameters hyperparameters,
                                                           ReliabilityThresholds thresholds) {
        return new ClinicalDecisionSupport(hyperparameters, thresholds);
    }
}
