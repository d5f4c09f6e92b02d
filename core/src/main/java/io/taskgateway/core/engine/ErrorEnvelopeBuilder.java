package io.taskgateway.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskgateway.core.error.GatewayError;
import io.taskgateway.core.model.CallResponse;
import java.util.Map;

/**
 * Converts a {@link GatewayError} into the caller envelope.
 *
 * <table>
 * <caption>Envelope codes</caption>
 * <tr><th>Kind</th><th>code</th></tr>
 * <tr><td>INVALID_IDENTIFIER</td><td>400</td></tr>
 * <tr><td>CONNECTION_FAILED</td><td>503</td></tr>
 * <tr><td>TIMEOUT</td><td>504</td></tr>
 * <tr><td>UPSTREAM_HTTP_ERROR</td><td>upstream business code, else mapped HTTP status</td></tr>
 * <tr><td>MALFORMED_RESPONSE</td><td>500</td></tr>
 * </table>
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class ErrorEnvelopeBuilder {

    /** Upstream body characters kept in a MALFORMED_RESPONSE message. */
    public static final int MAX_BODY_EXCERPT = 200;

    private static final Map<Integer, Integer> HTTP_STATUS_CODES = Map.of(
            400, 400,
            401, 401,
            403, 403,
            404, 404,
            409, 409,
            422, 422);

    private ErrorEnvelopeBuilder() {
        // utility class
    }

    /** Builds a failure envelope without data. */
    public static CallResponse toResponse(GatewayError error) {
        return toResponse(error, null);
    }

    /**
     * Builds a failure envelope.
     *
     * @param error the failure
     * @param data  payload to attach (the upstream's {@code data} on HTTP
     *              errors), may be {@code null}
     */
    public static CallResponse toResponse(GatewayError error, JsonNode data) {
        return switch (error.kind()) {
            case INVALID_IDENTIFIER -> CallResponse.of(400, error.message(), null);
            case CONNECTION_FAILED -> CallResponse.of(
                    503, "Task service connection failed, please retry later", null);
            case TIMEOUT -> CallResponse.of(504, "Task service timed out, please retry later", null);
            case UPSTREAM_HTTP_ERROR -> CallResponse.of(
                    error.businessCode() != null ? error.businessCode() : mapHttpStatus(error.statusCode()),
                    error.message(),
                    data);
            case MALFORMED_RESPONSE -> CallResponse.of(500, malformedMessage(error), null);
        };
    }

    /** Maps an upstream HTTP status to an envelope code; unknown statuses pass through. */
    public static int mapHttpStatus(int httpStatus) {
        return HTTP_STATUS_CODES.getOrDefault(httpStatus, httpStatus);
    }

    private static String malformedMessage(GatewayError error) {
        String body = error.upstreamBody();
        if (body == null || body.isEmpty()) {
            return "Malformed task service response: " + error.message();
        }
        return "Malformed task service response: " + error.message() + ": "
                + JsonNodeUtils.truncate(body, MAX_BODY_EXCERPT);
    }
}
