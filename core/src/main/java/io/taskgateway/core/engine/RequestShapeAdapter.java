package io.taskgateway.core.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request-direction counterpart of {@link ResponseShapeAdapter}: removes the
 * read-only fields the contract reports on a task (computed by the upstream,
 * never accepted from callers) from an outgoing write body. Callers that echo
 * a fetched task back on update use this.
 *
 * <p>
 * Caller-settable fields such as {@code parent_id}, {@code tags} or the
 * planned times are never touched.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class RequestShapeAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(RequestShapeAdapter.class);

    /** Fields owned by the upstream; a subset of the response back-fill fields. */
    public static final List<String> READ_ONLY_FIELDS =
            List.of("is_deleted", "completion_percentage", "last_claimed_date");

    private RequestShapeAdapter() {
        // utility class
    }

    /**
     * Returns a copy of {@code body} without {@link #READ_ONLY_FIELDS}.
     *
     * @param body the outgoing body; {@code null} yields an empty object
     */
    public static ObjectNode stripReadOnlyFields(ObjectNode body) {
        ObjectNode adapted = JsonNodeUtils.copyOrEmpty(body);
        List<String> removed = new ArrayList<>();
        for (String field : READ_ONLY_FIELDS) {
            if (adapted.remove(field) != null) {
                removed.add(field);
            }
        }
        if (!removed.isEmpty()) {
            LOG.debug("Stripped read-only fields from request body: {}", removed);
        }
        return adapted;
    }
}
