package com.hba1cvalidation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public class ModelDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ModelDetails {
        private boolean trained;
        private String type;
        private List<String> categories;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Models {
        private ModelDetails anomalyDetector;
        private ModelDetails disorderClassifier;
        private ModelDetails hba1cCorrector;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ModelInfoResponse {
        private boolean success;
        private Models models;
        private int trainingDataSize;
        private Instant trainedAt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class HealthResponse {
        private String status;
        private boolean modelsLoaded;
        private String error;
        private Instant timestamp;
        private String service;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ExampleRequestResponse {
        private Map<String, Object> exampleRequest;
        private List<String> requiredFields;
        private List<String> optionalFields;
    }
}
