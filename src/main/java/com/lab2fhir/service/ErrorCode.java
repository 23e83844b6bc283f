package com.lab2fhir.service;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.http.HttpStatus;

import java.util.Locale;

/**
 * Machine readable error kinds surfaced to API clients and stored on failed reports.
 */
public enum ErrorCode {
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    VALIDATION_ERROR(HttpStatus.UNPROCESSABLE_ENTITY),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    CONFLICT(HttpStatus.CONFLICT),
    DUPLICATE_UPLOAD(HttpStatus.CONFLICT),
    INVALID_FILE_TYPE(HttpStatus.UNSUPPORTED_MEDIA_TYPE),
    PARSING_FAILED(HttpStatus.UNPROCESSABLE_ENTITY),
    SCHEMA_VALIDATION_FAILED(HttpStatus.UNPROCESSABLE_ENTITY),
    STATE_TRANSITION_ERROR(HttpStatus.CONFLICT),
    BUNDLE_GENERATION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR),
    REPORT_NOT_FOUND(HttpStatus.NOT_FOUND),
    PATIENT_NOT_FOUND(HttpStatus.NOT_FOUND),
    PARSED_DATA_NOT_FOUND(HttpStatus.NOT_FOUND),
    BUNDLE_NOT_FOUND(HttpStatus.NOT_FOUND),
    STORAGE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
