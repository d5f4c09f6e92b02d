package io.taskgateway.core.model;

import java.util.Locale;

/**
 * HTTP methods accepted on both sides of the gateway.
 *
 * <p>
 * GET and DELETE carry parameters in the query string; POST, PUT and PATCH
 * carry them in the JSON body.
 */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE;

    /**
     * Parses a method name case-insensitively.
     *
     * @throws IllegalArgumentException if the name is null or not one of the
     *                                  supported methods
     */
    public static HttpMethod parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("HTTP method must not be empty");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported HTTP method: " + name, e);
        }
    }

    /** {@code true} for methods whose parameters travel in the query string. */
    public boolean usesQueryParameters() {
        return this == GET || this == DELETE;
    }

    /** {@code true} for methods that carry a JSON body. */
    public boolean carriesBody() {
        return !usesQueryParameters();
    }
}
