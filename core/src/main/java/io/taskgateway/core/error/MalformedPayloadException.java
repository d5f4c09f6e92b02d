package io.taskgateway.core.error;

/**
 * Thrown by the response adapter when an upstream payload looks task-shaped
 * but cannot be interpreted (e.g. {@code tasks} is not an array). The gateway
 * converts it into a MALFORMED_RESPONSE envelope; it never reaches callers.
 */
public class MalformedPayloadException extends GatewayException {

    private static final long serialVersionUID = 1L;

    public MalformedPayloadException(String message) {
        super(message);
    }
}
