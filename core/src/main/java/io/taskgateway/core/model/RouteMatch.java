package io.taskgateway.core.model;

import java.util.Map;

/**
 * Result of looking a logical call up in the rewrite table, before template
 * substitution.
 *
 * @param target     the upstream target, or a passthrough target if no entry
 *                   matched
 * @param pathParams caller-supplied path parameters merged over any values
 *                   extracted from a concrete logical path
 * @param rewritten  {@code false} when no table entry matched
 */
public record RouteMatch(RouteTarget target, Map<String, String> pathParams, boolean rewritten) {

    public RouteMatch {
        pathParams = Map.copyOf(pathParams);
    }
}
