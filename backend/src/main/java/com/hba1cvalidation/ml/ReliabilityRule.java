package com.hba1cvalidation.ml;

import java.util.Locale;

/**
 * Combines the three model outputs into a single verdict.
 *
 * A result is reliable only when the lab profile is within the expected range,
 * no disorder is predicted with actionable confidence, and the estimated
 * correction is insignificant.
 */
public final class ReliabilityRule {

    private ReliabilityRule() {
    }

    public static ReliabilityVerdict evaluate(AnomalyResult anomaly, DisorderPrediction disorder,
                                              Hba1cCorrection correction, ReliabilityThresholds thresholds) {
        ReliabilityVerdict.ReliabilityVerdictBuilder verdict = ReliabilityVerdict.builder();

        if (anomaly.getAnomalyScore() > anomaly.getThreshold()) {
            String factors = anomaly.getContributingFactors().isEmpty()
                ? ""
                : " (driven by " + String.join(", ", anomaly.getContributingFactors()) + ")";
            verdict.violation(ReliabilityCondition.ANOMALOUS_PROFILE)
                .reason(String.format(Locale.ROOT,
                    "Anomalous lab profile: score %.2f exceeds threshold %.2f%s",
                    anomaly.getAnomalyScore(), anomaly.getThreshold(), factors));
        }

        if (disorder.isActionable(thresholds.getMinActionableConfidence())) {
            verdict.violation(ReliabilityCondition.SUSPECTED_DISORDER)
                .reason(String.format(Locale.ROOT,
                    "Suspected %s with %.0f%% confidence (actionable at %.0f%%)",
                    disorder.getPredictedCategory().getCode(), disorder.getConfidence() * 100,
                    thresholds.getMinActionableConfidence() * 100));
        }

        if (Math.abs(correction.getDelta()) > thresholds.getMaxInsignificantDelta()) {
            verdict.violation(ReliabilityCondition.SIGNIFICANT_CORRECTION)
                .reason(String.format(Locale.ROOT,
                    "Estimated correction of %+.2f points exceeds %.2f (reported %.2f, corrected %.2f)",
                    correction.getDelta(), thresholds.getMaxInsignificantDelta(),
                    correction.getReportedHba1c(), correction.getCorrectedHba1c()));
        }

        ReliabilityVerdict partial = verdict.build();
        if (partial.getViolations().isEmpty()) {
            return verdict.reliable(true)
                .reason("No anomaly, no suspected disorder and no significant correction")
                .build();
        }
        return partial;
    }
}
