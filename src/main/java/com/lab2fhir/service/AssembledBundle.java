package com.lab2fhir.service;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Canonical bundle JSON plus its SHA-256 and the resource ids in entry order.
 */
@Getter
@AllArgsConstructor
public class AssembledBundle {
    private final String json;
    private final String contentHash;
    private final List<String> resourceIds;
}
