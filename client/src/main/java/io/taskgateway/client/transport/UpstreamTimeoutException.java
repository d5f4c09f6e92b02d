package io.taskgateway.client.transport;

/**
 * Thrown when an upstream attempt exceeds its connect, request or pool
 * timeout. Classified as TIMEOUT by the retry loop.
 */
public class UpstreamTimeoutException extends UpstreamException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message human-readable error description
     * @param cause   the underlying timeout exception, {@code null} for a pool
     *                timeout
     */
    public UpstreamTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
