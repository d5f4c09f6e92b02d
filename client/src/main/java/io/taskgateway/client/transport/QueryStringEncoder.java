package io.taskgateway.client.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.Map;

/**
 * Renders a JSON object as an {@code application/x-www-form-urlencoded} query
 * string, in field order.
 *
 * <ul>
 * <li>scalars use their text form ({@code true}, {@code 10}, {@code pending});</li>
 * <li>arrays become repeated parameters ({@code tag=a&tag=b});</li>
 * <li>{@code null} values are omitted;</li>
 * <li>nested objects are sent as their compact JSON text.</li>
 * </ul>
 */
public final class QueryStringEncoder {

    private QueryStringEncoder() {
        // utility class
    }

    /** Returns the encoded query without a leading {@code ?}; empty if nothing to send. */
    public static String encode(ObjectNode query) {
        if (query == null || query.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        Iterator<Map.Entry<String, JsonNode>> fields = query.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isArray()) {
                for (JsonNode item : value) {
                    append(sb, field.getKey(), item);
                }
            } else {
                append(sb, field.getKey(), value);
            }
        }
        return sb.toString();
    }

    private static void append(StringBuilder sb, String name, JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return;
        }
        String text = value.isContainerNode() ? value.toString() : value.asText();
        if (sb.length() > 0) {
            sb.append('&');
        }
        sb.append(encodeComponent(name)).append('=').append(encodeComponent(text));
    }

    private static String encodeComponent(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
