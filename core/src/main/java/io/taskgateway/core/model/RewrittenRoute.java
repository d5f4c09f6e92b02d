package io.taskgateway.core.model;

/**
 * Concrete upstream method and path for one call.
 *
 * @param logicalMethod the method the caller used
 * @param method        the upstream method
 * @param path          the upstream path with every placeholder substituted
 * @param userIdInQuery whether {@code user_id} is also required in the query
 *                      string for body-carrying methods
 * @param rewritten     {@code false} when the call passed through unchanged
 */
public record RewrittenRoute(
        HttpMethod logicalMethod, HttpMethod method, String path, boolean userIdInQuery, boolean rewritten) {

    /** {@code true} when the rewrite turned a body-carrying call into a query-only one. */
    public boolean convertsBodyToQuery() {
        return (logicalMethod == HttpMethod.POST || logicalMethod == HttpMethod.PUT)
                && method.usesQueryParameters();
    }
}
