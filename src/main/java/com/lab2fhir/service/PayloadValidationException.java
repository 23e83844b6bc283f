package com.lab2fhir.service;

import com.lab2fhir.domain.ValidationOutcome;

import java.util.Map;

/**
 * Carries the field level errors of a rejected structured payload.
 */
public class PayloadValidationException extends PipelineException {

    private final ValidationOutcome outcome;

    public PayloadValidationException(ErrorCode errorCode, ValidationOutcome outcome) {
        super(errorCode, "Structured payload failed validation: " + outcome.summary(),
                Map.of("errors", outcome.getErrors()));
        this.outcome = outcome;
    }

    public PayloadValidationException(String field, String message) {
        this(ErrorCode.VALIDATION_ERROR, ValidationOutcome.invalid(field, message));
    }

    public ValidationOutcome getOutcome() {
        return outcome;
    }
}
