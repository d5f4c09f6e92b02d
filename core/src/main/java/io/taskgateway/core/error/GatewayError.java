package io.taskgateway.core.error;

import java.util.Objects;

/**
 * Closed set of failures a gateway call can end in. Exactly one {@link Kind}
 * per instance; the kind-specific accessors return {@code null} for other
 * kinds.
 *
 * <ul>
 * <li>{@link Kind#CONNECTION_FAILED}: no connection could be established
 * (refused, DNS failure, reset). Retryable.
 * <li>{@link Kind#TIMEOUT}: connect, read, write or pool timeout, or the call
 * deadline was exceeded. Retryable.
 * <li>{@link Kind#UPSTREAM_HTTP_ERROR}: the upstream answered with a 4xx/5xx
 * status. Never retried.
 * <li>{@link Kind#MALFORMED_RESPONSE}: the upstream body could not be
 * interpreted.
 * <li>{@link Kind#INVALID_IDENTIFIER}: a user or task identifier is not a
 * canonical UUID.
 * </ul>
 *
 * <p>
 * Instances are immutable and call-scoped.
 */
public final class GatewayError {

    /** Failure category. */
    public enum Kind {
        CONNECTION_FAILED,
        TIMEOUT,
        UPSTREAM_HTTP_ERROR,
        MALFORMED_RESPONSE,
        INVALID_IDENTIFIER
    }

    private final Kind kind;
    private final String message;
    private final boolean retryable;
    private final Integer statusCode;
    private final Integer businessCode;
    private final String field;
    private final String value;
    private final String upstreamBody;
    private final Throwable cause;

    private GatewayError(
            Kind kind,
            String message,
            boolean retryable,
            Integer statusCode,
            Integer businessCode,
            String field,
            String value,
            String upstreamBody,
            Throwable cause) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = message;
        this.retryable = retryable;
        this.statusCode = statusCode;
        this.businessCode = businessCode;
        this.field = field;
        this.value = value;
        this.upstreamBody = upstreamBody;
        this.cause = cause;
    }

    public static GatewayError connectionFailed(String message, Throwable cause) {
        return new GatewayError(Kind.CONNECTION_FAILED, message, true, null, null, null, null, null, cause);
    }

    public static GatewayError timeout(String message, Throwable cause) {
        return new GatewayError(Kind.TIMEOUT, message, true, null, null, null, null, null, cause);
    }

    /**
     * @param statusCode   the HTTP status the upstream answered with
     * @param businessCode the upstream's own {@code code} field, or {@code null}
     * @param message      the upstream's message, or a synthesized one
     */
    public static GatewayError upstreamHttpError(int statusCode, Integer businessCode, String message) {
        return new GatewayError(
                Kind.UPSTREAM_HTTP_ERROR, message, false, statusCode, businessCode, null, null, null, null);
    }

    /**
     * @param message      what could not be interpreted
     * @param upstreamBody the raw upstream body, kept for diagnostics
     */
    public static GatewayError malformedResponse(String message, String upstreamBody) {
        return new GatewayError(
                Kind.MALFORMED_RESPONSE, message, false, null, null, null, null, upstreamBody, null);
    }

    /**
     * @param field the name of the offending field, e.g. {@code user_id}
     * @param value the rejected value, or {@code <empty>} for null/empty input
     */
    public static GatewayError invalidIdentifier(String field, String value) {
        return new GatewayError(
                Kind.INVALID_IDENTIFIER,
                "Invalid UUID format for " + field + ": " + value,
                false,
                null,
                null,
                field,
                value,
                null,
                null);
    }

    public Kind kind() {
        return kind;
    }

    public String message() {
        return message;
    }

    /** Whether the failure happened before any HTTP response was obtained. */
    public boolean retryable() {
        return retryable;
    }

    /** HTTP status. Only set for {@link Kind#UPSTREAM_HTTP_ERROR}. */
    public Integer statusCode() {
        return statusCode;
    }

    /** Upstream business code, if the error body carried one. */
    public Integer businessCode() {
        return businessCode;
    }

    /** Offending field. Only set for {@link Kind#INVALID_IDENTIFIER}. */
    public String field() {
        return field;
    }

    /** Rejected value. Only set for {@link Kind#INVALID_IDENTIFIER}. */
    public String value() {
        return value;
    }

    /** Raw upstream body. Only set for {@link Kind#MALFORMED_RESPONSE}. */
    public String upstreamBody() {
        return upstreamBody;
    }

    /** The underlying transport exception, if any. */
    public Throwable cause() {
        return cause;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case UPSTREAM_HTTP_ERROR -> "GatewayError[UPSTREAM_HTTP_ERROR, status=" + statusCode
                    + (businessCode != null ? ", code=" + businessCode : "") + ", " + message + "]";
            case INVALID_IDENTIFIER -> "GatewayError[INVALID_IDENTIFIER, " + field + "=" + value + "]";
            default -> "GatewayError[" + kind + (retryable ? ", retryable" : "") + ", " + message + "]";
        };
    }
}
