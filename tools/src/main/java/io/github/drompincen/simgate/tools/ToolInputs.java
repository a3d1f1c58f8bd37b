package io.github.drompincen.simgate.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed reads of optional tool arguments. A missing or JSON-null field reads as {@code null}.
 */
final class ToolInputs {

    private ToolInputs() {}

    static String requiredText(JsonNode input, String field) {
        JsonNode node = input.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new InvalidToolInputException("'" + field + "' is required");
        }
        return node.asText();
    }

    static String optionalText(JsonNode input, String field) {
        JsonNode node = input.get(field);
        if (node == null || node.isNull()) return null;
        if (!node.isTextual()) throw new InvalidToolInputException("'" + field + "' must be a string");
        return node.asText();
    }

    static Double optionalDouble(JsonNode input, String field) {
        JsonNode node = input.get(field);
        if (node == null || node.isNull()) return null;
        if (!node.isNumber()) throw new InvalidToolInputException("'" + field + "' must be a number");
        return node.asDouble();
    }

    static Integer optionalInt(JsonNode input, String field) {
        JsonNode node = input.get(field);
        if (node == null || node.isNull()) return null;
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new InvalidToolInputException("'" + field + "' must be an integer");
        }
        return node.asInt();
    }

    static boolean optionalBoolean(JsonNode input, String field, boolean defaultValue) {
        JsonNode node = input.get(field);
        if (node == null || node.isNull()) return defaultValue;
        if (!node.isBoolean()) throw new InvalidToolInputException("'" + field + "' must be a boolean");
        return node.asBoolean();
    }

    static List<String> optionalTextList(JsonNode input, String field) {
        JsonNode node = input.get(field);
        if (node == null || node.isNull()) return null;
        if (!node.isArray()) throw new InvalidToolInputException("'" + field + "' must be an array of strings");
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            if (!item.isTextual()) throw new InvalidToolInputException("'" + field + "' must be an array of strings");
            values.add(item.asText());
        }
        return values;
    }
}
