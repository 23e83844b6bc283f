package com.lab2fhir.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PayloadDiffTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void reportsChangedLeavesWithIndexedPaths() throws Exception {
        JsonNode before = objectMapper.readTree("{\"schema_version\":\"1.0\",\"measurements\":["
                + "{\"original_analyte_name\":\"Glucose\",\"numeric_value\":95.0},"
                + "{\"original_analyte_name\":\"Sodium\",\"numeric_value\":140.0}]}");
        JsonNode after = objectMapper.readTree("{\"schema_version\":\"1.0\",\"measurements\":["
                + "{\"original_analyte_name\":\"Glucose\",\"numeric_value\":95.0},"
                + "{\"original_analyte_name\":\"Sodium\",\"numeric_value\":138.0}]}");

        List<FieldChange> changes = PayloadDiff.diff(before, after);

        assertThat(changes).containsExactly(new FieldChange("measurements[1].numeric_value", "140.0", "138.0"));
    }

    @Test
    void addedAndRemovedLeavesAreChanges() throws Exception {
        JsonNode before = objectMapper.readTree("{\"report_date\":\"2024-01-15T08:00:00Z\",\"measurements\":[]}");
        JsonNode after = objectMapper.readTree("{\"performing_lab\":\"Acme\",\"measurements\":[]}");

        List<FieldChange> changes = PayloadDiff.diff(before, after);

        assertThat(changes).containsExactly(
                new FieldChange("report_date", "2024-01-15T08:00:00Z", null),
                new FieldChange("performing_lab", null, "Acme"));
    }

    @Test
    void identicalTreesHaveNoChanges() throws Exception {
        JsonNode tree = objectMapper.readTree("{\"a\":{\"b\":[1,2,{\"c\":null}]}}");

        assertThat(PayloadDiff.diff(tree, tree.deepCopy())).isEmpty();
        assertThat(PayloadDiff.flatten(tree)).containsOnlyKeys("a.b[0]", "a.b[1]");
    }
}
