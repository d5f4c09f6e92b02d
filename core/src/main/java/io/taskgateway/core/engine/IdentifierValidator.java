package io.taskgateway.core.engine;

import io.taskgateway.core.error.InvalidIdentifierException;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Checks that user and task identifiers are canonical UUIDs before they are
 * embedded in a URL or a payload.
 *
 * <p>
 * Canonical means five hyphen-separated hex groups of 8-4-4-4-12 characters.
 * Upper- and lower-case hex digits are both accepted; the value is returned
 * exactly as given and never normalized. {@link java.util.UUID#fromString}
 * is deliberately not used: it accepts short groups such as {@code 1-1-1-1-1}.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class IdentifierValidator {

    /** Placeholder reported for null or empty input. */
    public static final String EMPTY_VALUE = "<empty>";

    private static final Pattern CANONICAL_UUID =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private IdentifierValidator() {
        // utility class
    }

    /**
     * Validates a single identifier.
     *
     * @param value     the candidate UUID string
     * @param fieldName the field the value came from, used in the error
     * @return {@code value}, unchanged
     * @throws InvalidIdentifierException if the value is null, empty or not a
     *                                    canonical UUID
     */
    public static String validate(String value, String fieldName) {
        if (value == null || value.isEmpty()) {
            throw new InvalidIdentifierException(fieldName, EMPTY_VALUE);
        }
        if (!CANONICAL_UUID.matcher(value).matches()) {
            throw new InvalidIdentifierException(fieldName, value);
        }
        return value;
    }

    /** Returns {@code true} if the string is a canonical UUID. Never throws. */
    public static boolean isValid(String value) {
        return value != null && CANONICAL_UUID.matcher(value).matches();
    }

    /**
     * Validates every path parameter that names an identifier, i.e. whose name
     * ends in {@code _id}. Other parameters (such as {@code date}) are left
     * alone.
     *
     * @throws InvalidIdentifierException on the first invalid identifier
     */
    public static void validatePathParams(Map<String, String> pathParams) {
        for (Map.Entry<String, String> entry : pathParams.entrySet()) {
            if (isIdentifierField(entry.getKey())) {
                validate(entry.getValue(), entry.getKey());
            }
        }
    }

    /** {@code true} for parameter names that carry an identifier. */
    static boolean isIdentifierField(String name) {
        return name != null && (name.equals("id") || name.endsWith("_id"));
    }
}
