package com.lab2fhir.controller;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.lab2fhir.domain.PayloadFieldError;
import com.lab2fhir.dto.ApiErrorResponse;
import com.lab2fhir.service.ErrorCode;
import com.lab2fhir.service.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.List;
import java.util.Map;

/**
 * Renders every failure in the {@code {"error": {...}}} envelope. Unknown exceptions are logged
 * and answered with an opaque internal error.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<ApiErrorResponse> handlePipeline(PipelineException e) {
        ErrorCode code = e.getErrorCode();
        if (code.getHttpStatus().is5xxServerError()) {
            logger.error("Pipeline error {}: {}", code.code(), e.getMessage(), e);
        } else {
            logger.warn("Request rejected with {}: {}", code.code(), e.getMessage());
        }
        return ResponseEntity.status(code.getHttpStatus())
                .body(ApiErrorResponse.of(code.code(), e.getMessage(), e.getDetails()));
    }

    /**
     * Unreadable bodies name the offending field when Jackson knows it, e.g. {@code measurements[0].value_type}.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        logger.warn("Unreadable request body: {}", e.getMessage());
        Throwable cause = e.getCause();
        while (cause != null && !(cause instanceof JsonMappingException)) {
            cause = cause.getCause();
        }
        if (cause == null || ((JsonMappingException) cause).getPath().isEmpty()) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(ApiErrorResponse.of(ErrorCode.VALIDATION_ERROR.code(), "Malformed request", Map.of()));
        }
        String field = fieldPath(((JsonMappingException) cause).getPath());
        PayloadFieldError error = new PayloadFieldError(field, "value cannot be read");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiErrorResponse.of(ErrorCode.VALIDATION_ERROR.code(),
                        "Malformed request: " + field, Map.of("errors", List.of(error))));
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class,
            MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception e) {
        logger.warn("Malformed request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiErrorResponse.of(ErrorCode.VALIDATION_ERROR.code(), "Malformed request", Map.of()));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiErrorResponse> handleTooLarge(MaxUploadSizeExceededException e) {
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(ApiErrorResponse.of(ErrorCode.VALIDATION_ERROR.code(), "Uploaded file is too large", Map.of()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception e) {
        logger.error("Unhandled error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiErrorResponse.of(ErrorCode.INTERNAL_ERROR.code(), "An unexpected error occurred", Map.of()));
    }

    private static String fieldPath(List<JsonMappingException.Reference> path) {
        StringBuilder field = new StringBuilder();
        for (JsonMappingException.Reference reference : path) {
            if (reference.getFieldName() != null) {
                if (field.length() > 0) {
                    field.append('.');
                }
                field.append(reference.getFieldName());
            } else if (reference.getIndex() >= 0) {
                field.append('[').append(reference.getIndex()).append(']');
            }
        }
        return field.toString();
    }
}
