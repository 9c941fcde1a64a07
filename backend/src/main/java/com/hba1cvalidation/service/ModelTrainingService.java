package com.hba1cvalidation.service;

import com.hba1cvalidation.ml.ClinicalDecisionSupport;
import com.hba1cvalidation.ml.SyntheticPatientGenerator;
import com.hba1cvalidation.model.TrainingExample;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class ModelTrainingService {

    private final ClinicalDecisionSupport decisionSupport;
    private final SyntheticPatientGenerator generator;
    private final ModelRegistry registry;

    @Value("${hba1c.training.sample-size:1000}")
    private int sampleSize;

    /**
     * Trains the model suite off the request path and publishes the outcome to the registry.
     */
    @Async("trainingExecutor")
    public void trainModels() {
        log.info("Initializing models on {} synthetic patients", sampleSize);
        try {
            List<TrainingExample> corpus = generator.generate(sampleSize);
            decisionSupport.initializeModels(corpus);
            registry.markHealthy(decisionSupport);
        } catch (RuntimeException e) {
            log.error("Model initialization failed: {}", e.getMessage(), e);
            registry.markFailed(failureReason(e));
        } catch (Error e) {
            log.error("Model initialization aborted: {}", e.toString(), e);
            registry.markFailed(failureReason(e));
            throw e;
        }
    }

    private static String failureReason(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
