package com.hba1cvalidation.ml;

import com.hba1cvalidation.model.DisorderCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Clinical follow-up suggested for an assessed HbA1c result.
 */
public final class RecommendationPolicy {

    private RecommendationPolicy() {
    }

    public static List<String> recommend(AnomalyResult anomaly, DisorderPrediction disorder,
                                         Hba1cCorrection correction, ReliabilityVerdict verdict,
                                         double labCoverage, ReliabilityThresholds thresholds) {
        List<String> recommendations = new ArrayList<>();

        if (verdict.violates(ReliabilityCondition.SUSPECTED_DISORDER)) {
            recommendations.add(confirmatoryTest(disorder.getPredictedCategory()));
        } else if (verdict.violates(ReliabilityCondition.ANOMALOUS_PROFILE)) {
            recommendations.add("Review full blood count, iron studies and hemolysis markers for an unclassified abnormality");
        }

        if (verdict.isReliable()) {
            recommendations.add("HbA1c result can be used for diabetes diagnosis and monitoring");
        } else {
            recommendations.add("Do not rely on HbA1c alone; confirm glycemic status with an alternative marker");
            recommendations.add("Consider fructosamine or glycated albumin, which do not depend on RBC lifespan");
            recommendations.add("Consider continuous glucose monitoring or glucose-based eAG (fasting glucose, OGTT)");
            if (verdict.violates(ReliabilityCondition.SIGNIFICANT_CORRECTION)) {
                recommendations.add(String.format(Locale.ROOT,
                    "Interpret glycemic exposure using the corrected estimate of %.1f%% rather than the reported %.1f%%",
                    correction.getCorrectedHba1c(), correction.getReportedHba1c()));
            }
        }

        if (labCoverage < thresholds.getLowCoverageFraction()) {
            recommendations.add("Supply a fuller panel (CBC indices, iron studies, hemolysis markers) to improve assessment confidence");
        }
        return recommendations;
    }

    static String confirmatoryTest(DisorderCategory category) {
        return switch (category) {
            case IRON_DEFICIENCY -> "Confirm iron deficiency with ferritin and full iron studies; repeat HbA1c after iron repletion";
            case THALASSEMIA -> "Order haemoglobin electrophoresis to confirm thalassemia trait";
            case SICKLE_CELL -> "Order haemoglobin electrophoresis or HPLC to confirm a sickle haemoglobin variant";
            case G6PD -> "Order a G6PD enzyme assay, ideally outside an acute hemolytic episode";
            case NONE -> "No disorder-specific testing indicated";
        };
    }
}
