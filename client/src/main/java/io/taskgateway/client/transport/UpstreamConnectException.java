package io.taskgateway.client.transport;

/**
 * Thrown when the upstream task service cannot be reached.
 *
 * <p>
 * Wraps low-level network exceptions ({@code ConnectException}, DNS
 * resolution failures, connection resets) so the retry loop can classify
 * them as CONNECTION_FAILED.
 */
public class UpstreamConnectException extends UpstreamException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message human-readable error description
     * @param cause   the underlying network exception
     */
    public UpstreamConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
