package io.taskgateway.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Shared JSON node helpers for the placer and the adapters.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class JsonNodeUtils {

    /** Marker appended to truncated diagnostic text. */
    public static final String TRUNCATION_MARKER = "...[truncated]";

    private JsonNodeUtils() {}

    /** Returns a deep copy of {@code node}, or a new empty object for {@code null}. */
    public static ObjectNode copyOrEmpty(ObjectNode node) {
        return node == null ? JsonNodeFactory.instance.objectNode() : node.deepCopy();
    }

    /** {@code true} for {@code null}, {@code NullNode} and {@code MissingNode}. */
    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    /**
     * Reads an integral field. Returns {@code null} if the field is absent or
     * not an integral number.
     */
    public static Long longOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isIntegralNumber() ? value.longValue() : null;
    }

    /** Reads a textual field, or {@code null} if absent or not text. */
    public static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.textValue() : null;
    }

    /** Truncates text for diagnostics, appending {@link #TRUNCATION_MARKER}. */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return null;
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + TRUNCATION_MARKER;
    }
}
