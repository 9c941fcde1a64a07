package com.hba1cvalidation.service;

import com.hba1cvalidation.exception.ModelNotTrainedException;
import com.hba1cvalidation.exception.TrainingFailedException;
import com.hba1cvalidation.ml.ClinicalDecisionSupport;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle state of the model suite. Instances are immutable; a transition
 * replaces the whole state.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ModelState {

    public enum Status {
        INITIALIZING,
        HEALTHY,
        FAILED;

        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    Status status;

    ClinicalDecisionSupport decisionSupport;

    String failureReason;

    Instant since;

    public static ModelState initializing() {
        return new ModelState(Status.INITIALIZING, null, null, Instant.now());
    }

    public static ModelState healthy(ClinicalDecisionSupport decisionSupport) {
        return new ModelState(Status.HEALTHY, decisionSupport, null, Instant.now());
    }

    public static ModelState failed(String reason) {
        return new ModelState(Status.FAILED, null, reason, Instant.now());
    }

    public boolean isReady() {
        return status == Status.HEALTHY;
    }

    public Optional<String> failure() {
        return Optional.ofNullable(failureReason);
    }

    /**
     * @throws ModelNotTrainedException while training is still running
     * @throws TrainingFailedException once training has failed
     */
    public ClinicalDecisionSupport requireReady() {
        return switch (status) {
            case HEALTHY -> decisionSupport;
            case INITIALIZING -> throw new ModelNotTrainedException(
                "Models are still initializing, please retry in 30 seconds.");
            case FAILED -> throw new TrainingFailedException(failureReason);
        };
    }
}
