package io.taskgateway.client.config;

/**
 * Upstream connection pool configuration.
 *
 * @param maxConnections max concurrent upstream exchanges; callers beyond
 *                       this block for up to the pool timeout
 * @param maxKeepAlive   max idle keep-alive connections retained
 * @param idleTimeoutMs  close idle connections after this duration in ms
 */
public record PoolConfig(int maxConnections, int maxKeepAlive, int idleTimeoutMs) {

    /** Default pool configuration. */
    public static final PoolConfig DEFAULT = new PoolConfig(100, 20, 60000);
}
