package com.hba1cvalidation.ml;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Full assessment of one HbA1c result.
 */
@Value
@Builder
public class AssessmentResult {

    String patientId;

    AnomalyResult anomaly;

    DisorderPrediction disorder;

    Hba1cCorrection correction;

    ReliabilityVerdict verdict;

    @Singular
    List<String> recommendations;

    /** Share of optional labs that were supplied and usable, 0..1. */
    double labCoverage;

    int optionalLabsPresent;

    @Singular
    List<String> dataQualityNotes;

    public boolean isReliable() {
        return verdict.isReliable();
    }
}
