package io.taskgateway.core.error;

/**
 * Thrown when a user or task identifier is not a canonical UUID. Raised before
 * any network I/O and allowed to cross the gateway boundary: callers are
 * expected to have validated identifiers already.
 */
public final class InvalidIdentifierException extends GatewayException {

    private static final long serialVersionUID = 1L;

    private final transient GatewayError error;

    public InvalidIdentifierException(String field, String value) {
        this(GatewayError.invalidIdentifier(field, value));
    }

    private InvalidIdentifierException(GatewayError error) {
        super(error.message());
        this.error = error;
    }

    /** The offending field name. */
    public String field() {
        return error.field();
    }

    /** The rejected value ({@code <empty>} for null or empty input). */
    public String value() {
        return error.value();
    }

    /** The failure as a {@link GatewayError} of kind INVALID_IDENTIFIER. */
    public GatewayError error() {
        return error;
    }
}
