package com.hba1cvalidation.exception;

public class ModelNotTrainedException extends HbA1cValidationException {

    public ModelNotTrainedException(String message) {
        super(message);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.MODEL_NOT_TRAINED;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
