package io.taskgateway.core.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskgateway.core.model.PlacedParameters;
import io.taskgateway.core.model.RewrittenRoute;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether caller data travels in the query string or in the JSON body
 * of the upstream request, and injects the caller identity.
 *
 * <p>
 * Rules, in order:
 * <ol>
 * <li>If the rewrite turned a POST/PUT into a GET/DELETE, every body field not
 * already present in the query moves into the query and the body is
 * emptied.</li>
 * <li>GET/DELETE: {@code user_id} is set in the query and removed from the
 * body. POST/PUT/PATCH: {@code user_id} is set in the body, and additionally in
 * the query only when the route is flagged for it.</li>
 * </ol>
 *
 * <p>
 * The validated {@code user_id} always overwrites a caller-supplied one, so an
 * unvalidated identity can never reach the wire. Inputs are copied, never
 * mutated.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class ParameterPlacer {

    /** Name of the identity field on the upstream side. */
    public static final String USER_ID = "user_id";

    private static final Logger LOG = LoggerFactory.getLogger(ParameterPlacer.class);

    private ParameterPlacer() {
        // utility class
    }

    /**
     * @param route  the rewritten route
     * @param userId the already-validated caller identity
     * @param body   caller body, may be {@code null}
     * @param query  caller query parameters, may be {@code null}
     * @return fresh body and query objects
     */
    public static PlacedParameters place(RewrittenRoute route, String userId, ObjectNode body, ObjectNode query) {
        ObjectNode finalBody = JsonNodeUtils.copyOrEmpty(body);
        ObjectNode finalQuery = JsonNodeUtils.copyOrEmpty(query);

        if (route.convertsBodyToQuery() && !finalBody.isEmpty()) {
            List<String> moved = new ArrayList<>();
            finalBody.fields().forEachRemaining(entry -> {
                if (!finalQuery.has(entry.getKey())) {
                    finalQuery.set(entry.getKey(), entry.getValue());
                    moved.add(entry.getKey());
                }
            });
            finalBody.removeAll();
            LOG.debug("{} → {}: moved body fields {} into query", route.logicalMethod(), route.method(), moved);
        }

        if (route.method().usesQueryParameters()) {
            finalQuery.put(USER_ID, userId);
            finalBody.removeAll();
        } else {
            finalBody.put(USER_ID, userId);
            if (route.userIdInQuery()) {
                finalQuery.put(USER_ID, userId);
            }
        }

        return new PlacedParameters(finalBody, finalQuery);
    }
}
