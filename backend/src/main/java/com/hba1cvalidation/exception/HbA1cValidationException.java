package com.hba1cvalidation.exception;

/**
 * Base class for every classified failure raised by the validation engine.
 */
public abstract class HbA1cValidationException extends RuntimeException {

    protected HbA1cValidationException(String message) {
        super(message);
    }

    protected HbA1cValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorType getErrorType();

    public boolean isRetryable() {
        return false;
    }
}
