package com.lab2fhir.service;

import java.util.LinkedHashMap;
import java.util.Map;

public class NotFoundException extends PipelineException {

    /**
     * Signals that a required upstream record does not exist.
     */
    public NotFoundException(ErrorCode errorCode, String resource, Object identifier) {
        super(errorCode, resource + " not found: " + identifier, details(resource, identifier));
    }

    private static Map<String, Object> details(String resource, Object identifier) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("resource", resource);
        details.put("identifier", String.valueOf(identifier));
        return details;
    }
}
