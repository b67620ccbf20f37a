package com.logs.anomaly.controller;

import com.logs.anomaly.exception.LogAnalysisException;
import com.logs.anomaly.model.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Single boundary between pipeline failures and HTTP responses.
 * Caller-data errors are echoed; anything else is logged and answered with a generic message.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String INTERNAL_ERROR = "An internal server error occurred";
    static final String INVALID_FORMAT_PREFIX = "Invalid log data format: ";

    @ExceptionHandler(LogAnalysisException.class)
    public ResponseEntity<ErrorResponse> handleAnalysisFailure(LogAnalysisException ex) {
        switch (ex.getKind()) {
            case INPUT_MISSING:
                log.warn("Rejected request: {}", ex.getMessage());
                return body(HttpStatus.BAD_REQUEST, ex.getMessage());
            case DATA_FORMAT:
                log.warn("Rejected log batch: {}", ex.getMessage());
                return body(HttpStatus.BAD_REQUEST, INVALID_FORMAT_PREFIX + ex.getMessage());
            default:
                log.error("Analysis failed with {}", ex.getKind(), ex);
                return body(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR);
        }
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return body(HttpStatus.BAD_REQUEST,
                INVALID_FORMAT_PREFIX + "request body must be a JSON array of objects");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        // framework errors (405, 415, 404 ...) already know their status
        if (ex instanceof org.springframework.web.ErrorResponse framework) {
            HttpStatusCode status = framework.getStatusCode();
            String reason = framework.getBody().getTitle();
            return body(status, reason != null ? reason : status.toString());
        }
        log.error("Unexpected error while handling request", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR);
    }

    private static ResponseEntity<ErrorResponse> body(HttpStatusCode status, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(message));
    }
}
