package com.hba1cvalidation.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts model training once the web server is accepting requests.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TrainingBootstrapper {

    private final ModelTrainingService trainingService;

    @Value("${hba1c.training.enabled:true}")
    private boolean enabled;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!enabled) {
            log.info("Model training on startup is disabled");
            return;
        }
        trainingService.trainModels();
    }
}
