package com.lab2fhir.service;

import com.google.common.collect.ImmutableMap;
import com.lab2fhir.config.TerminologyProperties;
import com.lab2fhir.domain.AnalyteNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup from normalized analyte name to a LOINC code. The table comes from configuration.
 */
@Component
public class AnalyteCodeCatalog {

    private static final Logger logger = LoggerFactory.getLogger(AnalyteCodeCatalog.class);

    private final Map<String, LoincCode> codes;

    public AnalyteCodeCatalog(TerminologyProperties properties) {
        Map<String, LoincCode> byAnalyte = new HashMap<>();
        for (TerminologyProperties.LoincMapping mapping : properties.getLoinc()) {
            LoincCode code = new LoincCode(mapping.getCode(), mapping.getDisplay());
            for (String analyte : mapping.getAnalytes()) {
                LoincCode previous = byAnalyte.put(AnalyteNormalizer.normalizeAnalyteName(analyte), code);
                if (previous != null && !previous.getCode().equals(code.getCode())) {
                    throw new IllegalStateException("Analyte " + analyte + " mapped to both "
                            + previous.getCode() + " and " + code.getCode());
                }
            }
        }
        this.codes = ImmutableMap.copyOf(byAnalyte);
        logger.info("Loaded {} analyte to LOINC mappings", codes.size());
    }

    public Optional<LoincCode> lookup(String normalizedAnalyte) {
        if (normalizedAnalyte == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(codes.get(normalizedAnalyte));
    }

    public static final class LoincCode {
        private final String code;
        private final String display;

        public LoincCode(String code, String display) {
            this.code = code;
            this.display = display;
        }

        public String getCode() {
            return code;
        }

        public String getDisplay() {
            return display;
        }
    }
}
