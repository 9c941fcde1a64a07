package com.hba1cvalidation.service;

import com.hba1cvalidation.ml.ClinicalDecisionSupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link ModelState}. The only legal transitions leave
 * INITIALIZING; a failure is latched until the process restarts.
 */
@Component
@Slf4j
public class ModelRegistry {

    private final AtomicReference<ModelState> state = new AtomicReference<>(ModelState.initializing());

    public ModelState current() {
        return state.get();
    }

    public ClinicalDecisionSupport requireReady() {
        return state.get().requireReady();
    }

    public boolean markHealthy(ClinicalDecisionSupport decisionSupport) {
        return transition(ModelState.healthy(decisionSupport));
    }

    public boolean markFailed(String reason) {
        return transition(ModelState.failed(reason));
    }

    private boolean transition(ModelState next) {
        while (true) {
            ModelState current = state.get();
            if (current.getStatus() != ModelState.Status.INITIALIZING) {
                log.warn("Ignoring transition to {}: models already {}", next.getStatus(), current.getStatus());
                return false;
            }
            if (state.compareAndSet(current, next)) {
                log.info("Model state {} -> {}", current.getStatus(), next.getStatus());
                return true;
            }
        }
    }
}
