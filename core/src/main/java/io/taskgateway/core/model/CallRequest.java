package io.taskgateway.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One logical call as issued by a route handler. Constructed fresh for every
 * call and discarded afterwards.
 *
 * <p>
 * {@code body} and {@code query} may be {@code null}; {@code pathParams} is
 * never {@code null} once constructed.
 *
 * @param method      logical HTTP method
 * @param logicalPath logical path, either a template ({@code tasks/{task_id}})
 *                    or concrete ({@code tasks/6f1c...})
 * @param userId      caller identity, a canonical UUID string
 * @param pathParams  values for template placeholders
 * @param body        JSON body supplied by the caller
 * @param query       query parameters supplied by the caller
 */
public record CallRequest(
        HttpMethod method,
        String logicalPath,
        String userId,
        Map<String, String> pathParams,
        ObjectNode body,
        ObjectNode query) {

    public CallRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(logicalPath, "logicalPath must not be null");
        pathParams = pathParams == null ? Map.of() : Map.copyOf(pathParams);
    }

    /** Creates a builder for the given method and logical path. */
    public static Builder builder(HttpMethod method, String logicalPath) {
        return new Builder(method, logicalPath);
    }

    /** Builder for {@link CallRequest}. */
    public static final class Builder {
        private final HttpMethod method;
        private final String logicalPath;
        private String userId;
        private final Map<String, String> pathParams = new LinkedHashMap<>();
        private ObjectNode body;
        private ObjectNode query;

        Builder(HttpMethod method, String logicalPath) {
            this.method = method;
            this.logicalPath = logicalPath;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder pathParam(String name, String value) {
            this.pathParams.put(name, value);
            return this;
        }

        public Builder pathParams(Map<String, String> pathParams) {
            if (pathParams != null) {
                this.pathParams.putAll(pathParams);
            }
            return this;
        }

        public Builder body(ObjectNode body) {
            this.body = body;
            return this;
        }

        public Builder query(ObjectNode query) {
            this.query = query;
            return this;
        }

        public CallRequest build() {
            return new CallRequest(method, logicalPath, userId, pathParams, body, query);
        }
    }
}
