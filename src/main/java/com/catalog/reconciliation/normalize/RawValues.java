package com.catalog.reconciliation.normalize;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.regex.Pattern;

/**
 * Lenient accessors over raw provider JSON. None of them throw; anything unusable reads as null.
 */
public final class RawValues {

    // Plain decimal with optional exponent; rejects Java-only forms like "10d" or "0x1p3".
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private RawValues() {
    }

    /**
     * Returns the trimmed text of a string node, or null when absent, blank or not a string.
     */
    public static String text(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        String trimmed = node.asText().trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Returns a finite number from a numeric node or a plain decimal string, else null.
     */
    public static Double number(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isNumber()) {
            double value = node.asDouble();
            return Double.isFinite(value) ? value : null;
        }
        String text = text(node);
        if (text == null || !DECIMAL.matcher(text).matches()) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(text);
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Reads a display name from either a plain string or a localized map such as
     * {@code {"en": "Battery", "de": "Batterie"}}. English wins, otherwise the first
     * usable string value.
     */
    public static String localizedName(JsonNode node) {
        String direct = text(node);
        if (direct != null) {
            return direct;
        }
        if (node == null || !node.isContainerNode()) {
            return null;
        }
        if (node.isObject()) {
            String english = text(node.get("en"));
            if (english != null) {
                return english;
            }
        }
        for (Iterator<JsonNode> it = node.elements(); it.hasNext(); ) {
            String candidate = text(it.next());
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Returns the child object under {@code field}, or null when missing or not an object.
     */
    public static JsonNode object(JsonNode parent, String field) {
        if (parent == null) {
            return null;
        }
        JsonNode child = parent.get(field);
        return child != null && child.isObject() ? child : null;
    }

    /**
     * Returns the first non-null text among the given nodes.
     */
    public static String firstText(JsonNode... nodes) {
        for (JsonNode node : nodes) {
            String value = text(node);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * Returns the first non-null number among the given nodes.
     */
    public static Double firstNumber(JsonNode... nodes) {
        for (JsonNode node : nodes) {
            Double value = number(node);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * Null-safe {@link JsonNode#get(String)}.
     */
    public static JsonNode field(JsonNode parent, String name) {
        return parent == null ? null : parent.get(name);
    }
}
