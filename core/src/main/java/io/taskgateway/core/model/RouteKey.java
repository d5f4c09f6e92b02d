package io.taskgateway.core.model;

import java.util.Objects;

/**
 * Lookup key of the rewrite table: a logical method plus the logical path
 * template (e.g. {@code tasks/{task_id}}), without a leading slash.
 *
 * @param method      the logical HTTP method
 * @param logicalPath the logical path template
 */
public record RouteKey(HttpMethod method, String logicalPath) {

    public RouteKey {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(logicalPath, "logicalPath must not be null");
    }

    @Override
    public String toString() {
        return method + " " + logicalPath;
    }
}
