package com.lab2fhir.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Flattens payload trees into dotted leaf paths and reports the leaves that changed.
 */
public final class PayloadDiff {

    private PayloadDiff() {
    }

    public static List<FieldChange> diff(JsonNode previous, JsonNode current) {
        Map<String, String> before = flatten(previous);
        Map<String, String> after = flatten(current);

        Set<String> paths = new LinkedHashSet<>(before.keySet());
        paths.addAll(after.keySet());

        List<FieldChange> changes = new ArrayList<>();
        for (String path : paths) {
            String oldValue = before.get(path);
            String newValue = after.get(path);
            if (!Objects.equals(oldValue, newValue)) {
                changes.add(new FieldChange(path, oldValue, newValue));
            }
        }
        return changes;
    }

    /**
     * Leaf values keyed by path such as {@code measurements[2].numeric_value}; JSON nulls are omitted.
     */
    public static Map<String, String> flatten(JsonNode node) {
        Map<String, String> leaves = new LinkedHashMap<>();
        collect(node, "", leaves);
        return leaves;
    }

    private static void collect(JsonNode node, String path, Map<String, String> leaves) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return;
        }
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String child = path.isEmpty() ? field.getKey() : path + "." + field.getKey();
                collect(field.getValue(), child, leaves);
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                collect(node.get(i), path + "[" + i + "]", leaves);
            }
        } else {
            leaves.put(path, node.asText());
        }
    }
}
