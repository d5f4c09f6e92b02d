package io.taskgateway.client.transport;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskgateway.core.model.HttpMethod;
import java.util.Objects;

/**
 * Fully placed upstream request: the rewritten method and path plus the final
 * query and body objects.
 *
 * @param method upstream method
 * @param path   upstream path relative to the base URL, e.g. {@code tasks/}
 * @param query  query parameters, never {@code null}
 * @param body   JSON body, never {@code null}; dropped for GET/DELETE
 */
public record UpstreamRequest(HttpMethod method, String path, ObjectNode query, ObjectNode body) {

    public UpstreamRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        query = query == null ? JsonNodeFactory.instance.objectNode() : query;
        body = body == null ? JsonNodeFactory.instance.objectNode() : body;
    }

    /** A bodyless GET without query parameters, used for health checks. */
    public static UpstreamRequest get(String path) {
        return new UpstreamRequest(HttpMethod.GET, path, null, null);
    }
}
