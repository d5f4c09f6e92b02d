package io.taskgateway.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Upstream side of a rewrite table entry.
 *
 * <p>
 * The path template keeps the upstream's trailing slash verbatim; it is
 * never added or removed at runtime.
 *
 * @param method        the upstream HTTP method
 * @param pathTemplate  upstream path with {@code {name}} placeholders
 * @param userIdInQuery whether {@code user_id} must also be sent in the query
 *                      string when the upstream method carries a body
 */
public record RouteTarget(HttpMethod method, String pathTemplate, boolean userIdInQuery) {

    /** Matches a single {@code {name}} placeholder. */
    public static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)}");

    public RouteTarget {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(pathTemplate, "pathTemplate must not be null");
    }

    /** Returns the placeholder names referenced by the template, in order. */
    public List<String> placeholders() {
        return placeholdersOf(pathTemplate);
    }

    /** Returns the placeholder names referenced by any path template, in order. */
    public static List<String> placeholdersOf(String template) {
        List<String> names = new ArrayList<>();
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return Collections.unmodifiableList(names);
    }

    @Override
    public String toString() {
        return method + " " + pathTemplate + (userIdInQuery ? " (+query user_id)" : "");
    }
}
