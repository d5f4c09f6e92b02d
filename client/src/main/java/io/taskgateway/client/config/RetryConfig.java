package io.taskgateway.client.config;

import java.time.Duration;
import java.util.List;

/**
 * Retry policy for transport-level failures.
 *
 * @param maxRetries retries after the first attempt; {@code 0} disables retry
 * @param backoff    wait before retry {@code n} is {@code backoff[min(n, size-1)]}
 */
public record RetryConfig(int maxRetries, List<Duration> backoff) {

    /** Three retries waiting 1s, 2s and 4s. */
    public static final RetryConfig DEFAULT =
            new RetryConfig(3, List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)));

    public RetryConfig {
        backoff = List.copyOf(backoff);
    }

    /**
     * Returns the wait after the failed attempt with the given 0-based index.
     * The last configured value is reused once the list is exhausted.
     */
    public Duration backoffFor(int attempt) {
        return backoff.get(Math.min(Math.max(attempt, 0), backoff.size() - 1));
    }

    /** Total attempts including the first one. */
    public int maxAttempts() {
        return maxRetries + 1;
    }
}
