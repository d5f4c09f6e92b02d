package io.taskgateway.client;

import io.taskgateway.client.transport.UpstreamClient;
import io.taskgateway.client.transport.UpstreamException;
import io.taskgateway.client.transport.UpstreamRequest;
import io.taskgateway.client.transport.UpstreamResponse;
import io.taskgateway.core.model.CallResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Upstream health check with a TTL cache.
 *
 * <p>
 * A healthy verdict is cached until {@code now + ttl}; an unhealthy one is
 * never cached, so recovery is seen on the next call. Checks bypass the retry
 * loop. Concurrent callers may race to check after expiry; the last
 * successful check wins.
 */
final class HealthMonitor {

    private static final Logger LOG = LoggerFactory.getLogger(HealthMonitor.class);

    private final UpstreamClient client;
    private final String healthPath;
    private final Duration ttl;
    private final Clock clock;
    private final AtomicReference<Instant> healthyUntil = new AtomicReference<>();

    HealthMonitor(UpstreamClient client, String healthPath, Duration ttl, Clock clock) {
        this.client = client;
        this.healthPath = healthPath;
        this.ttl = ttl;
        this.clock = clock;
    }

    boolean isHealthy() {
        Instant cached = healthyUntil.get();
        if (cached != null && clock.instant().isBefore(cached)) {
            return true;
        }
        boolean healthy = checkUpstream();
        healthyUntil.set(healthy ? clock.instant().plus(ttl) : null);
        return healthy;
    }

    private boolean checkUpstream() {
        try {
            UpstreamResponse response = client.send(UpstreamRequest.get(healthPath));
            if (CallResponse.isSuccessCode(response.statusCode())) {
                LOG.debug("Health check {} → {}", healthPath, response.statusCode());
                return true;
            }
            LOG.warn("Health check {} returned HTTP {}", healthPath, response.statusCode());
            return false;
        } catch (UpstreamException e) {
            LOG.warn("Health check {} failed: {}", healthPath, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Health check {} interrupted", healthPath);
            return false;
        }
    }
}
