package com.lab2fhir.domain;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One leaf that differs between two payloads, addressed by dotted path.
 */
@Data
@AllArgsConstructor
public class FieldChange {
    private String fieldPath;
    private String oldValue;
    private String newValue;
}
