package io.taskgateway.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskgateway.core.error.MalformedPayloadException;
import io.taskgateway.core.model.CallResponse;
import io.taskgateway.core.model.PaginationInfo;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reshapes upstream JSON into the stable contract.
 *
 * <p>
 * Payload cases handled by {@link #adapt(JsonNode)}:
 * <ol>
 * <li>bare array of objects: wrapped as {@code {tasks, pagination}} with a
 * single-page pagination block;</li>
 * <li>object with a {@code tasks} array: items adapted, pagination recomputed
 * from {@code total/limit/offset};</li>
 * <li>task-shaped object: adapted as a single item;</li>
 * <li>anything else (scalars, null, non-task objects, arrays of scalars):
 * returned unchanged.</li>
 * </ol>
 *
 * <p>
 * {@link #toEnvelope(JsonNode, int)} additionally unwraps an upstream
 * {@code {code, success, message, data}} envelope before adapting its
 * {@code data}.
 *
 * <p>
 * Never mutates its input. Thread-safe: stateless utility class.
 */
public final class ResponseShapeAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(ResponseShapeAdapter.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /**
     * Fields the stable contract requires but the upstream omits, with the
     * default each is back-filled with.
     */
    public static final Map<String, JsonNode> BACKFILL_DEFAULTS;

    static {
        Map<String, JsonNode> defaults = new LinkedHashMap<>();
        defaults.put("parent_id", NODES.nullNode());
        defaults.put("tags", NODES.arrayNode());
        defaults.put("service_ids", NODES.arrayNode());
        defaults.put("planned_start_time", NODES.nullNode());
        defaults.put("planned_end_time", NODES.nullNode());
        defaults.put("last_claimed_date", NODES.nullNode());
        defaults.put("is_deleted", NODES.booleanNode(false));
        defaults.put("completion_percentage", NODES.numberNode(0.0));
        BACKFILL_DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    /** Keys whose presence marks a single object as a task. */
    private static final Set<String> TASK_MARKERS = Set.of("status", "priority", "title");

    /** Flat listing keys replaced by the derived pagination block. */
    private static final Set<String> LISTING_KEYS = Set.of("tasks", "total", "limit", "offset", "pagination");

    private ResponseShapeAdapter() {
        // utility class
    }

    /**
     * Adapts a raw upstream payload.
     *
     * @throws MalformedPayloadException if the payload has a {@code tasks}
     *                                   key that is not an array
     */
    public static JsonNode adapt(JsonNode raw) {
        if (JsonNodeUtils.isAbsent(raw)) {
            return raw;
        }
        if (raw.isArray()) {
            return isObjectArray(raw) ? wrapArray((ArrayNode) raw) : raw;
        }
        if (raw.isObject()) {
            if (raw.has("tasks")) {
                return adaptListing((ObjectNode) raw);
            }
            return isTaskShaped(raw) ? adaptItem((ObjectNode) raw) : raw;
        }
        return raw;
    }

    /**
     * Normalizes enum casing and back-fills missing contract fields on one
     * task. Fields already present are never overwritten.
     */
    public static ObjectNode adaptItem(ObjectNode item) {
        ObjectNode adapted = item.deepCopy();
        JsonNode status = adapted.get("status");
        if (status != null && status.isTextual()) {
            adapted.put("status", TaskEnumNormalizer.normalizeStatus(status.textValue()));
        }
        JsonNode priority = adapted.get("priority");
        if (priority != null && priority.isTextual()) {
            adapted.put("priority", TaskEnumNormalizer.normalizePriority(priority.textValue()));
        }
        BACKFILL_DEFAULTS.forEach((field, defaultValue) -> {
            if (!adapted.has(field)) {
                adapted.set(field, defaultValue.deepCopy());
            }
        });
        return adapted;
    }

    /**
     * Builds the caller envelope for a successful HTTP exchange.
     *
     * <p>
     * If the body is itself an envelope (an object with {@code success}, or
     * with both {@code code} and {@code data}) its {@code code} and
     * {@code message} are carried over and only {@code data} is adapted. An
     * explicit {@code success: false} without a code becomes 400. Otherwise the
     * whole body is the data and {@code httpStatus} the code.
     *
     * @param body       parsed upstream body, {@code null} for an empty body
     * @param httpStatus the upstream HTTP status (2xx/3xx)
     */
    public static CallResponse toEnvelope(JsonNode body, int httpStatus) {
        if (body != null && body.isObject() && isEnvelope(body)) {
            Long upstreamCode = JsonNodeUtils.longOrNull(body, "code");
            JsonNode success = body.get("success");
            boolean explicitFailure = success != null && success.isBoolean() && !success.booleanValue();

            int code;
            if (upstreamCode != null) {
                code = upstreamCode.intValue();
            } else {
                code = explicitFailure ? 400 : httpStatus;
            }
            if (explicitFailure && CallResponse.isSuccessCode(code)) {
                LOG.warn("Upstream envelope has success=false with code {}; code wins", code);
            }

            String message = JsonNodeUtils.textOrNull(body, "message");
            JsonNode data = body.get("data");
            if (CallResponse.isSuccessCode(code)) {
                data = adapt(data);
            }
            return CallResponse.of(code, message, JsonNodeUtils.isAbsent(data) ? null : data);
        }
        return CallResponse.of(httpStatus, "success", adapt(body));
    }

    private static boolean isEnvelope(JsonNode body) {
        return body.has("success") || (body.has("code") && body.has("data"));
    }

    private static JsonNode wrapArray(ArrayNode raw) {
        ObjectNode result = NODES.objectNode();
        result.set("tasks", adaptItems(raw));
        result.set("pagination", PaginationInfo.singlePage(raw.size()).toJson());
        return result;
    }

    private static JsonNode adaptListing(ObjectNode raw) {
        JsonNode tasks = raw.get("tasks");
        if (!tasks.isArray()) {
            throw new MalformedPayloadException("Expected 'tasks' to be an array but got " + tasks.getNodeType());
        }
        int size = tasks.size();
        Long total = JsonNodeUtils.longOrNull(raw, "total");
        Long limit = JsonNodeUtils.longOrNull(raw, "limit");
        Long offset = JsonNodeUtils.longOrNull(raw, "offset");

        PaginationInfo pagination = PaginationInfo.of(
                total != null ? total : size,
                limit != null ? (int) Math.min(limit, Integer.MAX_VALUE) : size,
                offset != null ? offset : 0);

        ObjectNode result = NODES.objectNode();
        result.set("tasks", adaptItems((ArrayNode) tasks));
        result.set("pagination", pagination.toJson());
        Iterator<Map.Entry<String, JsonNode>> fields = raw.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!LISTING_KEYS.contains(field.getKey())) {
                result.set(field.getKey(), field.getValue().deepCopy());
            }
        }
        return result;
    }

    private static ArrayNode adaptItems(ArrayNode items) {
        ArrayNode adapted = NODES.arrayNode(items.size());
        for (JsonNode item : items) {
            adapted.add(item.isObject() ? adaptItem((ObjectNode) item) : item.deepCopy());
        }
        return adapted;
    }

    private static boolean isObjectArray(JsonNode array) {
        for (JsonNode item : array) {
            if (!item.isObject()) {
                return false;
            }
        }
        return true;
    }

    private static boolean isTaskShaped(JsonNode object) {
        for (String marker : TASK_MARKERS) {
            if (object.has(marker)) {
                return true;
            }
        }
        return false;
    }
}
