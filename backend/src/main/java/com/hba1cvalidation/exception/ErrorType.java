package com.hba1cvalidation.exception;

public enum ErrorType {
    INVALID_RECORD,     // user-correctable
    MODEL_NOT_TRAINED,  // transient, retry later
    TRAINING_FAILED,    // latched until restart
    INTERNAL_ERROR
}
