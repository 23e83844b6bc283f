package com.lab2fhir.domain;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableMap;

import java.util.Locale;
import java.util.Map;

/**
 * Normalization applied to analyte names and units before they take part in identifiers.
 * The unit table is part of the identifier contract; changing an entry changes observation ids.
 */
public final class AnalyteNormalizer {

    private static final Map<String, String> UNIT_MAPPINGS = ImmutableMap.<String, String>builder()
            .put("mg/dl", "mg/dL")
            .put("g/dl", "g/dL")
            .put("mmol/l", "mmol/L")
            .put("micromol/l", "umol/L")
            .put("μmol/l", "umol/L")
            .put("µmol/l", "umol/L")
            .put("ug/dl", "ug/dL")
            .put("μg/dl", "ug/dL")
            .put("µg/dl", "ug/dL")
            .put("ng/ml", "ng/mL")
            .put("pg/ml", "pg/mL")
            .put("iu/l", "IU/L")
            .put("u/l", "U/L")
            .put("cells/mm3", "cells/mm3")
            .put("cells/ul", "cells/uL")
            .put("cells/μl", "cells/uL")
            .put("cells/µl", "cells/uL")
            .put("%", "%")
            .put("percent", "%")
            .build();

    private AnalyteNormalizer() {
    }

    /**
     * Upper-cases, trims and collapses internal whitespace runs to a single space.
     */
    public static String normalizeAnalyteName(String name) {
        if (name == null) {
            return null;
        }
        return CharMatcher.whitespace().trimAndCollapseFrom(name, ' ').toUpperCase(Locale.ROOT);
    }

    /**
     * Maps a raw unit to its canonical UCUM-style spelling, falling back to the lower-cased input.
     */
    public static String normalizeUnit(String unit) {
        if (unit == null || unit.isBlank()) {
            return null;
        }
        String key = unit.trim().toLowerCase(Locale.ROOT);
        return UNIT_MAPPINGS.getOrDefault(key, key);
    }
}
