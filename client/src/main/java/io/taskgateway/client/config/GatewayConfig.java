package io.taskgateway.client.config;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolved settings of a {@link io.taskgateway.client.GatewayClient}.
 *
 * <p>
 * All fields have defaults except {@code baseUrl}. Use {@link #builder()};
 * {@link Builder#build()} validates every value, so an instance is always
 * usable as-is.
 *
 * @param baseUrl             upstream base URL, absolute http/https, no
 *                            trailing slash
 * @param userAgent           fixed {@code User-Agent} header value
 * @param connectTimeoutMs    TCP connect timeout in ms
 * @param readTimeoutMs       response read timeout in ms
 * @param writeTimeoutMs      request write timeout in ms
 * @param poolTimeoutMs       max wait for a pool slot in ms
 * @param callTimeoutMs       overall deadline per logical call including
 *                            retries; {@code 0} means none
 * @param pool                connection pool limits
 * @param retry               retry policy
 * @param healthPath          upstream health endpoint path
 * @param healthCacheTtlMs    how long a healthy verdict is cached
 * @param stripContractFields strip read-only task fields from write bodies
 * @param loggingFormat       json or text
 * @param loggingLevel        root log level
 */
public record GatewayConfig(
        String baseUrl,
        String userAgent,
        int connectTimeoutMs,
        int readTimeoutMs,
        int writeTimeoutMs,
        int poolTimeoutMs,
        int callTimeoutMs,
        PoolConfig pool,
        RetryConfig retry,
        String healthPath,
        int healthCacheTtlMs,
        boolean stripContractFields,
        String loggingFormat,
        String loggingLevel) {

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Per-attempt request timeout handed to the HTTP client (write + read). */
    public Duration requestTimeout() {
        return Duration.ofMillis((long) writeTimeoutMs + readTimeoutMs);
    }

    /**
     * Builder for {@link GatewayConfig}. All fields have defaults except
     * {@code baseUrl}.
     */
    public static final class Builder {
        private String baseUrl;
        private String userAgent = "task-gateway/1.0";
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 30000;
        private int writeTimeoutMs = 10000;
        private int poolTimeoutMs = 60000;
        private int callTimeoutMs = 0;
        private int maxConnections = PoolConfig.DEFAULT.maxConnections();
        private int maxKeepAlive = PoolConfig.DEFAULT.maxKeepAlive();
        private int poolIdleTimeoutMs = PoolConfig.DEFAULT.idleTimeoutMs();
        private int maxRetries = RetryConfig.DEFAULT.maxRetries();
        private List<Duration> backoff = RetryConfig.DEFAULT.backoff();
        private String healthPath = "/health";
        private int healthCacheTtlMs = 60000;
        private boolean stripContractFields = false;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        private Builder() {}

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder connectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
            return this;
        }

        public Builder readTimeoutMs(int readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
            return this;
        }

        public Builder writeTimeoutMs(int writeTimeoutMs) {
            this.writeTimeoutMs = writeTimeoutMs;
            return this;
        }

        public Builder poolTimeoutMs(int poolTimeoutMs) {
            this.poolTimeoutMs = poolTimeoutMs;
            return this;
        }

        public Builder callTimeoutMs(int callTimeoutMs) {
            this.callTimeoutMs = callTimeoutMs;
            return this;
        }

        public Builder maxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder maxKeepAlive(int maxKeepAlive) {
            this.maxKeepAlive = maxKeepAlive;
            return this;
        }

        public Builder poolIdleTimeoutMs(int poolIdleTimeoutMs) {
            this.poolIdleTimeoutMs = poolIdleTimeoutMs;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder backoff(List<Duration> backoff) {
            this.backoff = backoff;
            return this;
        }

        /** Sets the backoff schedule from millisecond values. */
        public Builder backoffMs(List<Long> backoffMs) {
            List<Duration> durations = new ArrayList<>();
            for (Long ms : backoffMs) {
                durations.add(Duration.ofMillis(ms));
            }
            this.backoff = durations;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder healthCacheTtlMs(int healthCacheTtlMs) {
            this.healthCacheTtlMs = healthCacheTtlMs;
            return this;
        }

        public Builder stripContractFields(boolean stripContractFields) {
            this.stripContractFields = stripContractFields;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * Validates and builds the configuration.
         *
         * @throws IllegalArgumentException if any value is out of range
         */
        public GatewayConfig build() {
            String resolvedBaseUrl = validateBaseUrl(baseUrl);
            requirePositive("connect-timeout-ms", connectTimeoutMs);
            requirePositive("read-timeout-ms", readTimeoutMs);
            requirePositive("write-timeout-ms", writeTimeoutMs);
            requirePositive("pool-timeout-ms", poolTimeoutMs);
            requirePositive("pool.idle-timeout-ms", poolIdleTimeoutMs);
            requirePositive("health.cache-ttl-ms", healthCacheTtlMs);
            if (callTimeoutMs < 0) {
                throw new IllegalArgumentException("call-timeout-ms must be >= 0 but was " + callTimeoutMs);
            }
            if (maxConnections < 1) {
                throw new IllegalArgumentException("pool.max-connections must be >= 1 but was " + maxConnections);
            }
            if (maxKeepAlive < 0 || maxKeepAlive > maxConnections) {
                throw new IllegalArgumentException("pool.max-keepalive must be between 0 and max-connections ("
                        + maxConnections + ") but was " + maxKeepAlive);
            }
            if (maxRetries < 0) {
                throw new IllegalArgumentException("retry.max-retries must be >= 0 but was " + maxRetries);
            }
            if (backoff == null || backoff.isEmpty()) {
                throw new IllegalArgumentException("retry.backoff-ms must contain at least one value");
            }
            for (Duration delay : backoff) {
                if (delay == null || delay.isNegative()) {
                    throw new IllegalArgumentException("retry.backoff-ms values must be >= 0 but got " + delay);
                }
            }
            Objects.requireNonNull(userAgent, "user-agent must not be null");
            String resolvedHealthPath = healthPath == null || healthPath.isBlank()
                    ? "/health"
                    : (healthPath.startsWith("/") ? healthPath : "/" + healthPath);

            return new GatewayConfig(
                    resolvedBaseUrl,
                    userAgent,
                    connectTimeoutMs,
                    readTimeoutMs,
                    writeTimeoutMs,
                    poolTimeoutMs,
                    callTimeoutMs,
                    new PoolConfig(maxConnections, maxKeepAlive, poolIdleTimeoutMs),
                    new RetryConfig(maxRetries, backoff),
                    resolvedHealthPath,
                    healthCacheTtlMs,
                    stripContractFields,
                    loggingFormat,
                    loggingLevel);
        }

        private static String validateBaseUrl(String value) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("upstream.base-url is required");
            }
            String trimmed = value.trim();
            while (trimmed.endsWith("/")) {
                trimmed = trimmed.substring(0, trimmed.length() - 1);
            }
            URI uri;
            try {
                uri = URI.create(trimmed);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("upstream.base-url is not a valid URI: " + value, e);
            }
            String scheme = uri.getScheme();
            if (!uri.isAbsolute()
                    || uri.getHost() == null
                    || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new IllegalArgumentException("upstream.base-url must be an absolute http(s) URL: " + value);
            }
            return trimmed;
        }

        private static void requirePositive(String key, int value) {
            if (value <= 0) {
                throw new IllegalArgumentException(key + " must be > 0 but was " + value);
            }
        }
    }
}
