package com.hba1cvalidation.ml;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AnomalyResult {

    /** Distance from the expected lab profile in standard-normal units; higher is more unusual. */
    double anomalyScore;

    double threshold;

    boolean anomalous;

    /** Field names driving the score, strongest first. */
    @Singular
    List<String> contributingFactors;

    /** Number of supplied values the score was computed over. */
    int featuresAssessed;
}
