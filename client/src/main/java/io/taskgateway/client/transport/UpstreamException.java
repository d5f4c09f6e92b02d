package io.taskgateway.client.transport;

/**
 * Base exception for a single failed upstream attempt that produced no HTTP
 * response.
 *
 * <p>
 * Subtypes represent specific failure modes:
 * <ul>
 * <li>{@link UpstreamConnectException}: connection refused, DNS failure,
 * reset
 * <li>{@link UpstreamTimeoutException}: connect, read/write or pool timeout
 * </ul>
 * Both are retryable; {@link RetryingTransport} converts them into a
 * {@link io.taskgateway.core.error.GatewayError}.
 */
public abstract class UpstreamException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * @param message human-readable error description
     * @param cause   the underlying exception, may be {@code null}
     */
    protected UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
