package io.taskgateway.core.engine;

import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps the upstream's status and priority spellings onto the stable
 * contract's lower-case values.
 *
 * <p>
 * Lookup is case-insensitive. Unknown values are lower-cased and logged at
 * WARN rather than rejected: these are display fields and a missing alias
 * should not take a listing down. Every mapping is idempotent, i.e.
 * {@code normalize(normalize(x)) == normalize(x)}.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class TaskEnumNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(TaskEnumNormalizer.class);

    /** Keys are lower-case aliases. */
    static final Map<String, String> STATUS_ALIASES = Map.of(
            "not_started", "pending",
            "todo", "pending",
            "pending", "pending",
            "in_progress", "in_progress",
            "inprogress", "in_progress",
            "completed", "completed");

    static final Map<String, String> PRIORITY_ALIASES = Map.of(
            "low", "low",
            "medium", "medium",
            "high", "high");

    private TaskEnumNormalizer() {
        // utility class
    }

    /** Normalizes a task status; {@code null} stays {@code null}. */
    public static String normalizeStatus(String value) {
        return normalize("status", value, STATUS_ALIASES);
    }

    /** Normalizes a task priority; {@code null} stays {@code null}. */
    public static String normalizePriority(String value) {
        return normalize("priority", value, PRIORITY_ALIASES);
    }

    private static String normalize(String field, String value, Map<String, String> aliases) {
        if (value == null) {
            return null;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        String mapped = aliases.get(lower);
        if (mapped != null) {
            return mapped;
        }
        LOG.warn("Unknown task {} value '{}', falling back to '{}'", field, value, lower);
        return lower;
    }
}
