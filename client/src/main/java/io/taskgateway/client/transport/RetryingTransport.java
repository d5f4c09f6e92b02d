package io.taskgateway.client.transport;

import io.taskgateway.client.config.RetryConfig;
import io.taskgateway.core.error.GatewayError;
import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one logical call with bounded retries on transport-level failures.
 *
 * <p>
 * Per call: {@code Attempting(0)} → SUCCESS on any HTTP response (4xx/5xx
 * included, since repeating a write on a 5xx could apply it twice), or →
 * retry after {@code backoff[min(n, size-1)]} on
 * {@link UpstreamConnectException}/{@link UpstreamTimeoutException}, until
 * {@code maxRetries + 1} attempts have been made. No jitter is added.
 *
 * <p>
 * When a call deadline is configured, each attempt's request timeout is
 * capped by the time left, and retries that would start after the deadline
 * are abandoned with a TIMEOUT. Nothing keeps running once a result has been
 * returned.
 *
 * <p>
 * Thread-safe: holds no per-call state.
 */
public final class RetryingTransport {

    private static final Logger LOG = LoggerFactory.getLogger(RetryingTransport.class);
    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final UpstreamClient client;
    private final RetryConfig retry;
    private final BackoffSleeper sleeper;
    private final Duration callTimeout;
    private final LongSupplier nanoTime;

    /**
     * @param client      single-attempt upstream client
     * @param retry       retry policy
     * @param sleeper     waits between attempts
     * @param callTimeout overall deadline per call; {@link Duration#ZERO} for
     *                    none
     */
    public RetryingTransport(UpstreamClient client, RetryConfig retry, BackoffSleeper sleeper, Duration callTimeout) {
        this(client, retry, sleeper, callTimeout, System::nanoTime);
    }

    RetryingTransport(
            UpstreamClient client,
            RetryConfig retry,
            BackoffSleeper sleeper,
            Duration callTimeout,
            LongSupplier nanoTime) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.retry = Objects.requireNonNull(retry, "retry must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.callTimeout = callTimeout == null ? Duration.ZERO : callTimeout;
        this.nanoTime = nanoTime;
    }

    /**
     * Executes the request, retrying transport-level failures.
     *
     * @return SUCCESS with the first HTTP response obtained, or FAILURE with a
     *         retryable CONNECTION_FAILED/TIMEOUT error
     */
    public TransportResult execute(UpstreamRequest request) {
        long deadline = callTimeout.isZero() ? NO_DEADLINE : nanoTime.getAsLong() + callTimeout.toNanos();
        int maxAttempts = retry.maxAttempts();
        UpstreamException lastFailure = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            Duration remaining = remaining(deadline);
            if (remaining != null && remaining.isZero()) {
                return abandon(request, attempt, "Call deadline of " + callTimeout.toMillis() + " ms exceeded");
            }
            try {
                UpstreamResponse response = client.send(request, remaining);
                if (attempt > 0) {
                    LOG.info("{} {} succeeded on attempt {}", request.method(), request.path(), attempt + 1);
                }
                return TransportResult.success(response, attempt + 1);
            } catch (UpstreamException e) {
                lastFailure = e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return abandon(request, attempt + 1, "Interrupted while calling task service");
            }

            if (attempt + 1 >= maxAttempts) {
                break;
            }
            Duration delay = retry.backoffFor(attempt);
            if (deadline != NO_DEADLINE && nanoTime.getAsLong() + delay.toNanos() >= deadline) {
                return abandon(
                        request,
                        attempt + 1,
                        "Call deadline of " + callTimeout.toMillis() + " ms exceeded after: "
                                + lastFailure.getMessage());
            }
            LOG.warn(
                    "{} {} attempt {}/{} failed ({}), retrying in {} ms",
                    request.method(),
                    request.path(),
                    attempt + 1,
                    maxAttempts,
                    lastFailure.getMessage(),
                    delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return abandon(request, attempt + 1, "Interrupted while waiting to retry");
            }
        }

        GatewayError error = classify(lastFailure);
        LOG.error(
                "{} {} failed after {} attempt(s): {}",
                request.method(),
                request.path(),
                maxAttempts,
                lastFailure.getMessage());
        return TransportResult.failure(error, maxAttempts);
    }

    /** Maps a single-attempt failure to its error kind. */
    static GatewayError classify(UpstreamException failure) {
        if (failure instanceof UpstreamTimeoutException) {
            return GatewayError.timeout(failure.getMessage(), failure);
        }
        return GatewayError.connectionFailed(failure.getMessage(), failure);
    }

    /** Time left before the deadline, {@code ZERO} once passed, {@code null} without a deadline. */
    private Duration remaining(long deadline) {
        if (deadline == NO_DEADLINE) {
            return null;
        }
        long left = deadline - nanoTime.getAsLong();
        return left <= 0 ? Duration.ZERO : Duration.ofNanos(left);
    }

    private TransportResult abandon(UpstreamRequest request, int attempts, String message) {
        LOG.error("{} {} abandoned after {} attempt(s): {}", request.method(), request.path(), attempts, message);
        return TransportResult.failure(GatewayError.timeout(message, null), attempts);
    }
}
