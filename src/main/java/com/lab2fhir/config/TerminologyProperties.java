package com.lab2fhir.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Analyte to LOINC table, bound from {@code app.terminology.loinc}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.terminology")
public class TerminologyProperties {

    private List<LoincMapping> loinc = new ArrayList<>();

    @Data
    public static class LoincMapping {
        private List<String> analytes = new ArrayList<>();
        private String code;
        private String display;
    }
}
