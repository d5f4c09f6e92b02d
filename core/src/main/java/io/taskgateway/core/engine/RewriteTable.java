package io.taskgateway.core.engine;

import io.taskgateway.core.error.RouteConfigurationException;
import io.taskgateway.core.model.HttpMethod;
import io.taskgateway.core.model.RouteKey;
import io.taskgateway.core.model.RouteMatch;
import io.taskgateway.core.model.RouteTarget;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only mapping from logical routes to upstream routes.
 *
 * <p>
 * Built once through {@link Builder} and never mutated afterwards. The
 * builder rejects entries whose target references a placeholder that the
 * logical path does not declare, so a typo in the table fails at startup
 * rather than on the first call.
 *
 * <p>
 * Lookup order for a logical call:
 * <ol>
 * <li>exact string match on {@code (method, path)};</li>
 * <li>template match against entries of the same method whose logical path
 * has placeholders: the entry with the most literal segments wins, earlier
 * declarations break ties. A segment captured into an identifier
 * placeholder ({@code id} or {@code *_id}) must be a UUID, so
 * {@code tasks/statistics} is not taken for {@code tasks/{task_id}};</li>
 * <li>no match: the call passes through unchanged.</li>
 * </ol>
 *
 * <p>
 * Thread-safe: immutable after construction.
 */
public final class RewriteTable {

    private static final Logger LOG = LoggerFactory.getLogger(RewriteTable.class);

    private final Map<RouteKey, RouteTarget> routes;
    private final List<TemplateEntry> templates;

    private RewriteTable(Map<RouteKey, RouteTarget> routes) {
        this.routes = Collections.unmodifiableMap(new LinkedHashMap<>(routes));
        List<TemplateEntry> entries = new ArrayList<>();
        routes.forEach((key, target) -> {
            if (!RouteTarget.placeholdersOf(key.logicalPath()).isEmpty()) {
                entries.add(new TemplateEntry(key, target, key.logicalPath().split("/", -1)));
            }
        });
        this.templates = List.copyOf(entries);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The task microservice's table. Upstream paths keep the trailing slash the
     * service requires; without it every call costs a 307 redirect.
     */
    public static RewriteTable taskServiceDefaults() {
        return builder()
                // task CRUD
                .map(HttpMethod.POST, "tasks", HttpMethod.POST, "tasks/")
                .map(HttpMethod.POST, "tasks/", HttpMethod.POST, "tasks/")
                .map(HttpMethod.GET, "tasks", HttpMethod.GET, "tasks/")
                .map(HttpMethod.POST, "tasks/query", HttpMethod.GET, "tasks/")
                .map(HttpMethod.GET, "tasks/tags", HttpMethod.GET, "tasks/tags/")
                .map(HttpMethod.POST, "tasks/search", HttpMethod.POST, "tasks/search/")
                .map(HttpMethod.GET, "tasks/{task_id}", HttpMethod.GET, "tasks/{task_id}/")
                .mapWithQueryUserId(HttpMethod.PUT, "tasks/{task_id}", HttpMethod.PUT, "tasks/{task_id}/")
                .map(HttpMethod.DELETE, "tasks/{task_id}", HttpMethod.DELETE, "tasks/{task_id}/")
                // the upstream has no complete endpoint; completion is a status update
                .mapWithQueryUserId(
                        HttpMethod.POST, "tasks/{task_id}/complete", HttpMethod.PUT, "tasks/{task_id}/")
                .map(HttpMethod.GET, "tasks/{task_id}/tree", HttpMethod.GET, "tasks/{task_id}/tree/")
                // top3
                .map(HttpMethod.POST, "tasks/top3/query", HttpMethod.GET, "tasks/top3/")
                .map(HttpMethod.POST, "tasks/special/top3", HttpMethod.POST, "tasks/top3/")
                .map(HttpMethod.GET, "tasks/special/top3/{date}", HttpMethod.GET, "tasks/top3/{date}/")
                // focus and pomodoro
                .mapWithQueryUserId(HttpMethod.POST, "tasks/focus-status", HttpMethod.POST, "focus/sessions/")
                .map(HttpMethod.GET, "tasks/pomodoro-count", HttpMethod.GET, "pomodoros/count/")
                .build();
    }

    /**
     * Looks up a logical call. Never fails: an unknown route yields a
     * passthrough match whose target is the logical method and path.
     *
     * @param method      the logical method
     * @param logicalPath the logical path, without a leading slash
     * @param pathParams  caller-supplied path parameters (take precedence over
     *                    values extracted from a concrete path)
     */
    public RouteMatch match(HttpMethod method, String logicalPath, Map<String, String> pathParams) {
        RouteTarget exact = routes.get(new RouteKey(method, logicalPath));
        if (exact != null) {
            return new RouteMatch(exact, pathParams, true);
        }

        String[] segments = logicalPath.split("/", -1);
        TemplateEntry best = null;
        Map<String, String> bestExtracted = null;
        for (TemplateEntry entry : templates) {
            if (entry.key.method() != method) {
                continue;
            }
            Map<String, String> extracted = entry.extract(segments);
            if (extracted != null && (best == null || entry.literalCount() > best.literalCount())) {
                best = entry;
                bestExtracted = extracted;
            }
        }
        if (best != null) {
            Map<String, String> merged = new LinkedHashMap<>(bestExtracted);
            merged.putAll(pathParams);
            LOG.debug("Template match: {} {} → {}", method, logicalPath, best.key);
            return new RouteMatch(best.target, merged, true);
        }

        return new RouteMatch(new RouteTarget(method, logicalPath, false), pathParams, false);
    }

    /** All entries, in declaration order. */
    public Map<RouteKey, RouteTarget> routes() {
        return routes;
    }

    public int size() {
        return routes.size();
    }

    /** A table entry whose logical path contains placeholders. */
    private static final class TemplateEntry {
        private final RouteKey key;
        private final RouteTarget target;
        private final String[] segments;
        private final int literalCount;

        TemplateEntry(RouteKey key, RouteTarget target, String[] segments) {
            this.key = key;
            this.target = target;
            this.segments = segments;
            int literals = 0;
            for (String segment : segments) {
                if (!isPlaceholder(segment)) {
                    literals++;
                }
            }
            this.literalCount = literals;
        }

        int literalCount() {
            return literalCount;
        }

        /**
         * Returns the extracted placeholder values, or {@code null} on mismatch
         * or when an identifier placeholder captures a non-UUID segment.
         */
        Map<String, String> extract(String[] concrete) {
            if (concrete.length != segments.length) {
                return null;
            }
            Map<String, String> values = new LinkedHashMap<>();
            for (int i = 0; i < segments.length; i++) {
                if (isPlaceholder(segments[i])) {
                    String name = segments[i].substring(1, segments[i].length() - 1);
                    if (concrete[i].isEmpty()
                            || (IdentifierValidator.isIdentifierField(name)
                                    && !IdentifierValidator.isValid(concrete[i]))) {
                        return null;
                    }
                    values.put(name, concrete[i]);
                } else if (!segments[i].equals(concrete[i])) {
                    return null;
                }
            }
            return values;
        }

        private static boolean isPlaceholder(String segment) {
            return RouteTarget.PLACEHOLDER.matcher(segment).matches();
        }
    }

    /** Collects entries and validates them in {@link #build()}. */
    public static final class Builder {
        private final Map<RouteKey, RouteTarget> routes = new LinkedHashMap<>();

        Builder() {}

        /** Adds an entry whose body-carrying calls send {@code user_id} in the body only. */
        public Builder map(HttpMethod method, String logicalPath, HttpMethod upstreamMethod, String upstreamPath) {
            return add(new RouteKey(method, logicalPath), new RouteTarget(upstreamMethod, upstreamPath, false));
        }

        /** Adds an entry that also needs {@code user_id} in the query string on writes. */
        public Builder mapWithQueryUserId(
                HttpMethod method, String logicalPath, HttpMethod upstreamMethod, String upstreamPath) {
            return add(new RouteKey(method, logicalPath), new RouteTarget(upstreamMethod, upstreamPath, true));
        }

        public Builder add(RouteKey key, RouteTarget target) {
            if (routes.containsKey(key)) {
                throw new RouteConfigurationException("Duplicate rewrite entry: " + key);
            }
            routes.put(key, target);
            return this;
        }

        /**
         * Builds the table.
         *
         * @throws RouteConfigurationException if a path starts with '/' or a
         *                                     target placeholder has no
         *                                     counterpart in the logical path
         */
        public RewriteTable build() {
            for (Map.Entry<RouteKey, RouteTarget> entry : routes.entrySet()) {
                RouteKey key = entry.getKey();
                RouteTarget target = entry.getValue();
                if (key.logicalPath().startsWith("/") || target.pathTemplate().startsWith("/")) {
                    throw new RouteConfigurationException(
                            "Rewrite paths must not start with '/': " + key + " → " + target);
                }
                Set<String> declared = new HashSet<>(RouteTarget.placeholdersOf(key.logicalPath()));
                for (String name : target.placeholders()) {
                    if (!declared.contains(name)) {
                        throw new RouteConfigurationException("Rewrite target " + target + " references {" + name
                                + "} which " + key + " does not declare");
                    }
                }
            }
            return new RewriteTable(routes);
        }
    }
}
