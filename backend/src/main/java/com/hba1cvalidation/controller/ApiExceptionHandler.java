package com.hba1cvalidation.controller;

import com.hba1cvalidation.dto.ErrorResponse;
import com.hba1cvalidation.exception.ErrorType;
import com.hba1cvalidation.exception.InvalidRecordException;
import com.hba1cvalidation.exception.ModelNotTrainedException;
import com.hba1cvalidation.exception.TrainingFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Renders every failure as {success: false, error, error_type, fields?}.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    static final String RETRY_AFTER_SECONDS = "30";

    @ExceptionHandler(InvalidRecordException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRecord(InvalidRecordException ex) {
        log.debug("Rejected record: {}", ex.getMessage());
        return ResponseEntity.badRequest()
            .body(body(ex.getMessage(), ex.getErrorType(), ex.getFields().isEmpty() ? null : ex.getFields()));
    }

    @ExceptionHandler(ModelNotTrainedException.class)
    public ResponseEntity<ErrorResponse> handleModelNotTrained(ModelNotTrainedException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
            .body(body(ex.getMessage(), ex.getErrorType(), null));
    }

    @ExceptionHandler(TrainingFailedException.class)
    public ResponseEntity<ErrorResponse> handleTrainingFailed(TrainingFailedException ex) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(body(ex.getMessage(), ex.getErrorType(), null));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.badRequest()
            .body(body("Malformed JSON request body", ErrorType.INVALID_RECORD, null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(body("Internal error: " + ex.getMessage(), ErrorType.INTERNAL_ERROR, null));
    }

    private static ErrorResponse body(String message, ErrorType type, List<String> fields) {
        return ErrorResponse.builder()
            .success(false)
            .error(message)
            .errorType(type.name())
            .fields(fields)
            .build();
    }
}
