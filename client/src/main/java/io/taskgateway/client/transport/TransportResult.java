package io.taskgateway.client.transport;

import io.taskgateway.core.error.GatewayError;
import java.util.Objects;

/**
 * Terminal outcome of one logical call through {@link RetryingTransport}.
 *
 * <p>
 * Exactly one of {@link #response()} and {@link #error()} is non-null:
 * <ul>
 * <li>{@link Type#SUCCESS}: an HTTP round trip completed, whatever its status
 * <li>{@link Type#FAILURE}: no response was obtained within the allowed attempts
 * or the call deadline
 * </ul>
 */
public final class TransportResult {

    /** Outcome type. */
    public enum Type {
        SUCCESS,
        FAILURE
    }

    private final Type type;
    private final UpstreamResponse response;
    private final GatewayError error;
    private final int attempts;

    private TransportResult(Type type, UpstreamResponse response, GatewayError error, int attempts) {
        this.type = type;
        this.response = response;
        this.error = error;
        this.attempts = attempts;
    }

    /** A completed round trip after {@code attempts} tries. */
    public static TransportResult success(UpstreamResponse response, int attempts) {
        return new TransportResult(Type.SUCCESS, Objects.requireNonNull(response, "response"), null, attempts);
    }

    /** A transport-level failure after {@code attempts} tries. */
    public static TransportResult failure(GatewayError error, int attempts) {
        return new TransportResult(Type.FAILURE, null, Objects.requireNonNull(error, "error"), attempts);
    }

    public Type type() {
        return type;
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    /** The upstream response, or {@code null} on failure. */
    public UpstreamResponse response() {
        return response;
    }

    /** The failure, or {@code null} on success. */
    public GatewayError error() {
        return error;
    }

    /** Number of attempts made, including the first. */
    public int attempts() {
        return attempts;
    }

    @Override
    public String toString() {
        return "TransportResult[" + type + ", attempts=" + attempts
                + (isSuccess() ? ", status=" + response.statusCode() : ", " + error) + "]";
    }
}
