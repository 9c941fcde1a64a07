package com.hba1cvalidation.exception;

import java.util.List;

/**
 * A required field is missing, non-numeric or physically impossible.
 */
public class InvalidRecordException extends HbA1cValidationException {

    private final List<String> fields;

    public InvalidRecordException(String message, List<String> fields) {
        super(message);
        this.fields = List.copyOf(fields);
    }

    public static InvalidRecordException missingFields(List<String> missing) {
        return new InvalidRecordException("Missing required fields: " + String.join(", ", missing), missing);
    }

    public List<String> getFields() {
        return fields;
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.INVALID_RECORD;
    }
}
