package com.hba1cvalidation.service;

import com.hba1cvalidation.dto.ValidationDTO;
import com.hba1cvalidation.ml.AnomalyResult;
import com.hba1cvalidation.ml.AssessmentResult;
import com.hba1cvalidation.ml.DisorderPrediction;
import com.hba1cvalidation.ml.Hba1cCorrection;
import com.hba1cvalidation.ml.ReliabilityCondition;
import com.hba1cvalidation.ml.ReliabilityVerdict;
import com.hba1cvalidation.model.DisorderCategory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Converts engine results to wire DTOs. All rounding happens here.
 */
@Component
public class AssessmentMapper {

    public ValidationDTO.Assessment toDto(AssessmentResult result) {
        return ValidationDTO.Assessment.builder()
            .patientId(result.getPatientId())
            .testValidity(toDto(result.getVerdict()))
            .anomalyDetection(toDto(result.getAnomaly()))
            .disorderPrediction(toDto(result.getDisorder()))
            .hba1cCorrection(toDto(result.getCorrection()))
            .recommendations(result.getRecommendations())
            .labCoverage(round(result.getLabCoverage(), 2))
            .optionalLabsPresent(result.getOptionalLabsPresent())
            .dataQualityNotes(result.getDataQualityNotes())
            .build();
    }

    public ValidationDTO.AnomalyDetection toDto(AnomalyResult anomaly) {
        return ValidationDTO.AnomalyDetection.builder()
            .anomalyScore(round(anomaly.getAnomalyScore(), 4))
            .threshold(round(anomaly.getThreshold(), 4))
            .isAnomalous(anomaly.isAnomalous())
            .contributingFactors(anomaly.getContributingFactors())
            .featuresAssessed(anomaly.getFeaturesAssessed())
            .build();
    }

    public ValidationDTO.DisorderPrediction toDto(DisorderPrediction prediction) {
        Map<String, Double> probabilities = new LinkedHashMap<>();
        for (DisorderCategory category : DisorderCategory.values()) {
            probabilities.put(category.getCode(), round(prediction.probabilityOf(category), 4));
        }
        return ValidationDTO.DisorderPrediction.builder()
            .predictedDisorder(prediction.getPredictedCategory().getCode())
            .confidence(round(prediction.getConfidence(), 4))
            .probabilities(probabilities)
            .build();
    }

    public ValidationDTO.Correction toDto(Hba1cCorrection correction) {
        return ValidationDTO.Correction.builder()
            .reportedHba1c(correction.getReportedHba1c())
            .correctedHba1c(round(correction.getCorrectedHba1c(), 2))
            .delta(round(correction.getDelta(), 2))
            .rbcLifespanDays(round(correction.getRbcLifespanDays(), 1))
            .lifespanSource(correction.getLifespanSource().name().toLowerCase(Locale.ROOT))
            .rationale(correction.getRationale())
            .build();
    }

    public ValidationDTO.TestValidity toDto(ReliabilityVerdict verdict) {
        return ValidationDTO.TestValidity.builder()
            .isReliable(verdict.isReliable())
            .violations(verdict.getViolations().stream()
                .map(ReliabilityCondition::name)
                .map(name -> name.toLowerCase(Locale.ROOT))
                .toList())
            .reasoning(verdict.getReasoning())
            .build();
    }

    static Double round(double value, int places) {
        if (!Double.isFinite(value)) {
            return null;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }
}
