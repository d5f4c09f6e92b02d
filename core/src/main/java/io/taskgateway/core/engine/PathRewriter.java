package io.taskgateway.core.engine;

import io.taskgateway.core.error.RouteConfigurationException;
import io.taskgateway.core.model.HttpMethod;
import io.taskgateway.core.model.RewrittenRoute;
import io.taskgateway.core.model.RouteMatch;
import io.taskgateway.core.model.RouteTarget;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a logical {@code (method, path)} pair to the upstream method and path
 * using a {@link RewriteTable}, then substitutes {@code {name}} placeholders.
 *
 * <p>
 * A table miss is not an error: the call passes through with its original
 * method and path so endpoints can be migrated one at a time. A placeholder
 * without a value means the calling code forgot to pass a path parameter and
 * fails with {@link RouteConfigurationException}.
 *
 * <p>
 * Substituted values are percent-encoded as a single path segment (RFC 3986
 * §3.3). A table template, including its trailing slash, is copied verbatim;
 * a passed-through logical path is taken as unencoded text and each of its
 * literal segments is percent-encoded.
 *
 * <p>
 * Thread-safe: holds only the immutable table.
 */
public final class PathRewriter {

    private static final Logger LOG = LoggerFactory.getLogger(PathRewriter.class);

    private final RewriteTable table;

    public PathRewriter(RewriteTable table) {
        this.table = Objects.requireNonNull(table, "table must not be null");
    }

    /**
     * Resolves the table entry for a logical call without substituting.
     *
     * @param method      the logical method
     * @param logicalPath logical path, with or without a leading slash
     * @param pathParams  caller-supplied path parameters; may be empty
     */
    public RouteMatch match(HttpMethod method, String logicalPath, Map<String, String> pathParams) {
        return table.match(method, normalize(logicalPath), pathParams == null ? Map.of() : pathParams);
    }

    /**
     * Substitutes the placeholders of a resolved match.
     *
     * @param logicalMethod the method the caller used
     * @param match         result of {@link #match}
     * @throws RouteConfigurationException if a placeholder has no value
     */
    public RewrittenRoute rewrite(HttpMethod logicalMethod, RouteMatch match) {
        RouteTarget target = match.target();
        String template = match.rewritten() ? target.pathTemplate() : encodeLiteralSegments(target.pathTemplate());
        String path = substitute(template, match.pathParams(), logicalMethod);
        if (match.rewritten()) {
            LOG.debug("Rewrite: {} → {} {}", logicalMethod, target.method(), path);
        } else {
            LOG.debug("No rewrite entry, passing through: {} {}", logicalMethod, path);
        }
        return new RewrittenRoute(logicalMethod, target.method(), path, target.userIdInQuery(), match.rewritten());
    }

    /** Convenience for {@code rewrite(method, match(method, logicalPath, pathParams))}. */
    public RewrittenRoute rewrite(HttpMethod method, String logicalPath, Map<String, String> pathParams) {
        return rewrite(method, match(method, logicalPath, pathParams));
    }

    private static String substitute(String template, Map<String, String> params, HttpMethod logicalMethod) {
        Matcher matcher = RouteTarget.PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = params.get(name);
            if (value == null || value.isEmpty()) {
                throw new RouteConfigurationException(
                        name + " is required for " + logicalMethod + " " + template + " but was not supplied");
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(encodePathSegment(value)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /** Strips leading slashes; the table stores paths relative to the base URL. */
    static String normalize(String logicalPath) {
        String path = logicalPath == null ? "" : logicalPath.trim();
        int start = 0;
        while (start < path.length() && path.charAt(start) == '/') {
            start++;
        }
        return path.substring(start);
    }

    /** Encodes every segment of a caller path except {@code {name}} placeholders. */
    static String encodeLiteralSegments(String path) {
        String[] segments = path.split("/", -1);
        StringBuilder sb = new StringBuilder(path.length());
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                sb.append('/');
            }
            String segment = segments[i];
            sb.append(RouteTarget.PLACEHOLDER.matcher(segment).matches() ? segment : encodePathSegment(segment));
        }
        return sb.toString();
    }

    /** Percent-encodes one path segment; spaces become {@code %20}, not {@code +}. */
    static String encodePathSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
