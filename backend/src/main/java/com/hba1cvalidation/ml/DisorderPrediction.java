package com.hba1cvalidation.ml;

import com.hba1cvalidation.model.DisorderCategory;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class DisorderPrediction {

    DisorderCategory predictedCategory;

    /** Probability per category, in declaration order, summing to 1. */
    Map<DisorderCategory, Double> probabilities;

    double confidence;

    public double probabilityOf(DisorderCategory category) {
        return probabilities.getOrDefault(category, 0.0);
    }

    /**
     * A disorder call confident enough to act on.
     */
    public boolean isActionable(double minConfidence) {
        return predictedCategory.isDisorder() && confidence >= minConfidence;
    }
}
