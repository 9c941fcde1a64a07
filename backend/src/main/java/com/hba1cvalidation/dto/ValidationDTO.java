package com.hba1cvalidation.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public class ValidationDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class AnomalyDetection {
        private Double anomalyScore;
        private Double threshold;
        private Boolean isAnomalous;
        private List<String> contributingFactors;
        private Integer featuresAssessed;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class DisorderPrediction {
        private String predictedDisorder;
        private Double confidence;
        private Map<String, Double> probabilities;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Correction {
        private Double reportedHba1c;
        private Double correctedHba1c;
        private Double delta;
        private Double rbcLifespanDays;
        private String lifespanSource;
        private String rationale;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class TestValidity {
        private Boolean isReliable;
        private List<String> violations;
        private List<String> reasoning;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Assessment {
        private String patientId;
        private TestValidity testValidity;
        private AnomalyDetection anomalyDetection;
        private DisorderPrediction disorderPrediction;
        private Correction hba1cCorrection;
        private List<String> recommendations;
        private Double labCoverage;
        private Integer optionalLabsPresent;
        private List<String> dataQualityNotes;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class AssessmentResponse {
        private boolean success;
        private Instant timestamp;
        private Assessment assessment;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class AnomalyResponse {
        private boolean success;
        private String patientId;
        private AnomalyDetection anomalyDetection;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class DisorderResponse {
        private boolean success;
        private String patientId;
        private DisorderPrediction disorderPrediction;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class CorrectionResponse {
        private boolean success;
        private String patientId;
        private Correction correction;
    }
}
