package com.lab2fhir.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Error envelope: {@code {"error": {"code", "message", "details"}}}.
 */
public record ApiErrorResponse(@JsonProperty("error") ErrorBody error) {

    public record ErrorBody(
            @JsonProperty("code") String code,
            @JsonProperty("message") String message,
            @JsonProperty("details") Map<String, Object> details
    ) {
    }

    public static ApiErrorResponse of(String code, String message, Map<String, Object> details) {
        return new ApiErrorResponse(new ErrorBody(code, message, details == null ? Map.of() : details));
    }
}
