package com.hba1cvalidation.exception;

/**
 * Model initialization failed. Reported on every request until the process restarts.
 */
public class TrainingFailedException extends HbA1cValidationException {

    private final String reason;

    public TrainingFailedException(String reason) {
        super("Model initialization failed: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.TRAINING_FAILED;
    }
}
