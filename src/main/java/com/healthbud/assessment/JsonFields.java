package com.healthbud.assessment;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Coercions for loosely typed fields in model output.
 */
public final class JsonFields {

    private static final String[] LABEL_KEYS = {"name", "condition", "title", "text", "question"};

    private JsonFields() {
    }

    /**
     * Text of a scalar field as sent, or null when missing, null, blank or not a scalar.
     */
    public static String text(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }

    public static String textOr(JsonNode parent, String field, String fallback) {
        String value = text(parent, field);
        return value != null ? value : fallback;
    }

    /**
     * A list field that may arrive as a single string, a list of scalars, or a list of labelled
     * objects. Blank entries are dropped, the rest kept as sent.
     */
    public static List<String> stringList(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                addIfPresent(values, label(item));
            }
        } else {
            addIfPresent(values, label(node));
        }
        return values;
    }

    /**
     * Recognized token verbatim, numeric score bucketed, anything else {@link UrgencyLevel#MEDIUM}.
     */
    public static UrgencyLevel urgency(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null) {
            return UrgencyLevel.MEDIUM;
        }
        if (node.isTextual()) {
            return UrgencyLevel.parseToken(node.asText()).orElse(UrgencyLevel.MEDIUM);
        }
        if (node.isNumber()) {
            return UrgencyLevel.fromScore(node.asDouble());
        }
        return UrgencyLevel.MEDIUM;
    }

    private static String label(JsonNode item) {
        if (item == null || item.isNull()) {
            return null;
        }
        if (item.isValueNode()) {
            return item.asText();
        }
        if (item.isObject()) {
            for (String key : LABEL_KEYS) {
                JsonNode candidate = item.get(key);
                if (candidate != null && candidate.isValueNode() && !candidate.isNull()) {
                    return candidate.asText();
                }
            }
        }
        return null;
    }

    private static void addIfPresent(List<String> values, String value) {
        if (value != null && !value.isBlank()) {
            values.add(value);
        }
    }
}
