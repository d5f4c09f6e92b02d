package io.taskgateway.client.transport;

import java.util.Map;

/**
 * Immutable container for one upstream HTTP response.
 *
 * <p>
 * Returned by {@link UpstreamClient#send} for every completed round trip,
 * whatever the status. All header names are normalized to lowercase.
 *
 * @param statusCode the HTTP status code from the upstream
 * @param headers    single-value header map (lowercase keys, first value wins)
 * @param body       the response body as a string (empty string for no-body
 *                   responses like 204)
 */
public record UpstreamResponse(int statusCode, Map<String, String> headers, String body) {

    public UpstreamResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? "" : body;
    }

    /** {@code true} for 4xx and 5xx statuses. */
    public boolean isError() {
        return statusCode >= 400;
    }
}
