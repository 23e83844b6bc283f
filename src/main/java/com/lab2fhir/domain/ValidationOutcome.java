package com.lab2fhir.domain;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of validating a structured payload. Invalid outcomes list every offending field path.
 */
public final class ValidationOutcome {

    private static final ValidationOutcome VALID = new ValidationOutcome(Collections.emptyList());

    private final List<PayloadFieldError> errors;

    private ValidationOutcome(List<PayloadFieldError> errors) {
        this.errors = errors;
    }

    public static ValidationOutcome valid() {
        return VALID;
    }

    public static ValidationOutcome of(List<PayloadFieldError> errors) {
        if (errors == null || errors.isEmpty()) {
            return VALID;
        }
        return new ValidationOutcome(List.copyOf(errors));
    }

    public static ValidationOutcome invalid(String field, String message) {
        return of(List.of(new PayloadFieldError(field, message)));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<PayloadFieldError> getErrors() {
        return errors;
    }

    public String summary() {
        if (errors.isEmpty()) {
            return "valid";
        }
        return errors.stream()
                .map(e -> e.getField() + ": " + e.getMessage())
                .collect(Collectors.joining("; "));
    }
}
