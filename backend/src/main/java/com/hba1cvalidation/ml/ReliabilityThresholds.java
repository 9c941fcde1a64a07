package com.hba1cvalidation.ml;

import lombok.Builder;
import lombok.Value;

/**
 * Decision thresholds of the reliability rule.
 */
@Value
@Builder
public class ReliabilityThresholds {

    /** Confidence at which a predicted disorder makes the HbA1c result untrustworthy. */
    @Builder.Default
    double minActionableConfidence = 0.6;

    /** Largest correction, in HbA1c percentage points, that still counts as insignificant. */
    @Builder.Default
    double maxInsignificantDelta = 0.3;

    /** Share of optional labs below which the panel is flagged as sparse. */
    @Builder.Default
    double lowCoverageFraction = 0.25;

    public static ReliabilityThresholds defaults() {
        return ReliabilityThresholds.builder().build();
    }
}
