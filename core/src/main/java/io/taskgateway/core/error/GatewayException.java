package io.taskgateway.core.error;

/**
 * Abstract base for the gateway's unchecked exceptions. Expected failures
 * travel as {@link GatewayError} values; exceptions are reserved for
 * precondition violations and programming errors.
 */
public abstract class GatewayException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected GatewayException(String message) {
        super(message);
    }

    protected GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
