package io.taskgateway.client.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.taskgateway.client.config.GatewayConfig;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JDK {@link HttpClient}-based single-attempt upstream caller.
 *
 * <p>
 * Sends one JSON request to the task service and returns the response with
 * status, headers and body intact, whatever the status. Transport-level
 * failures surface as {@link UpstreamException}; retrying is the job of
 * {@link RetryingTransport}. Uses HTTP/1.1 for all upstream connections.
 *
 * <p>
 * Pool limits: concurrent exchanges are bounded by a fair {@link Semaphore} of
 * {@code maxConnections} permits; a caller that cannot get a permit within the
 * pool timeout fails with {@link UpstreamTimeoutException}. The JDK client
 * keeps idle connections in a JVM-wide pool sized by the
 * {@code jdk.httpclient.connectionPoolSize} and
 * {@code jdk.httpclient.keepalive.timeout} system properties; these are set
 * from the first config seen, unless already defined.
 *
 * <p>
 * The JDK client has no separate write timeout, so each attempt gets a
 * request timeout of {@code write + read}.
 *
 * <p>
 * This class is thread-safe: the underlying {@link HttpClient} is
 * thread-safe and designed for concurrent use.
 */
public class UpstreamClient implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(UpstreamClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String JSON = "application/json";

    private final HttpClient httpClient;
    private final ExecutorService executor;
    private final Semaphore permits;
    private final String baseUrl;
    private final String userAgent;
    private final Duration requestTimeout;
    private final long poolTimeoutMs;

    /**
     * Creates an {@code UpstreamClient} for the given gateway configuration.
     *
     * @param config resolved configuration; base URL, timeouts and pool limits
     *               are read from it
     */
    public UpstreamClient(GatewayConfig config) {
        applyPoolProperties(config);
        this.baseUrl = config.baseUrl();
        this.userAgent = config.userAgent();
        this.requestTimeout = config.requestTimeout();
        this.poolTimeoutMs = config.poolTimeoutMs();
        this.permits = new Semaphore(config.pool().maxConnections(), true);
        this.executor = Executors.newCachedThreadPool(daemonThreads());

        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(config.connectTimeoutMs()))
                .followRedirects(HttpClient.Redirect.NEVER)
                .executor(executor)
                .build();

        LOG.debug(
                "UpstreamClient initialized: baseUrl={}, maxConnections={}, requestTimeout={}",
                baseUrl,
                config.pool().maxConnections(),
                requestTimeout);
    }

    /** Sends one attempt with the configured request timeout. */
    public UpstreamResponse send(UpstreamRequest request) throws UpstreamException, InterruptedException {
        return send(request, null);
    }

    /**
     * Sends one attempt.
     *
     * @param request    the placed upstream request
     * @param maxTimeout upper bound for this attempt's request timeout, e.g. the
     *                   time left before the call deadline; {@code null} for
     *                   the configured timeout
     * @return the upstream response, for any HTTP status
     * @throws UpstreamConnectException if the upstream is unreachable or the
     *                                  connection fails mid-exchange
     * @throws UpstreamTimeoutException if connecting, the exchange or waiting
     *                                  for a pool slot times out
     * @throws InterruptedException     if the thread is interrupted while waiting
     */
    public UpstreamResponse send(UpstreamRequest request, Duration maxTimeout)
            throws UpstreamException, InterruptedException {
        URI targetUri = targetUri(request);
        Duration timeout = maxTimeout != null && maxTimeout.compareTo(requestTimeout) < 0 ? maxTimeout : requestTimeout;

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(targetUri)
                .timeout(timeout.isZero() || timeout.isNegative() ? Duration.ofMillis(1) : timeout)
                .header("Content-Type", JSON)
                .header("Accept", JSON)
                .header("User-Agent", userAgent)
                .method(request.method().name(), bodyPublisher(request))
                .build();

        if (!permits.tryAcquire(poolTimeoutMs, TimeUnit.MILLISECONDS)) {
            throw new UpstreamTimeoutException(
                    "Pool timeout: no upstream connection available within " + poolTimeoutMs + " ms", null);
        }

        LOG.debug("Sending {} {}", request.method(), targetUri);

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (HttpConnectTimeoutException e) {
            throw new UpstreamTimeoutException("Connect timeout to " + targetUri, e);
        } catch (HttpTimeoutException e) {
            throw new UpstreamTimeoutException("Request timeout from " + targetUri, e);
        } catch (ConnectException e) {
            throw new UpstreamConnectException("Connection refused by " + targetUri, e);
        } catch (IOException e) {
            throw new UpstreamConnectException("Failed to communicate with " + targetUri, e);
        } finally {
            permits.release();
        }

        // Normalize response headers to lowercase, first-value semantics
        Map<String, String> responseHeaders = new LinkedHashMap<>();
        response.headers().map().forEach((name, values) -> {
            if (!values.isEmpty()) {
                responseHeaders.put(name.toLowerCase(Locale.ROOT), values.get(0));
            }
        });

        LOG.debug("Upstream responded: {} {} → {}", request.method(), targetUri, response.statusCode());

        return new UpstreamResponse(response.statusCode(), responseHeaders, response.body());
    }

    /** Builds {@code base + "/" + path [+ "?" + query]}. */
    URI targetUri(UpstreamRequest request) {
        String path = request.path();
        StringBuilder uri = new StringBuilder(baseUrl);
        if (!path.startsWith("/")) {
            uri.append('/');
        }
        uri.append(path);
        String query = QueryStringEncoder.encode(request.query());
        if (!query.isEmpty()) {
            uri.append('?').append(query);
        }
        return URI.create(uri.toString());
    }

    /** Stops the client's executor; in-flight exchanges are abandoned. */
    @Override
    public void close() {
        executor.shutdownNow();
        LOG.debug("UpstreamClient closed: baseUrl={}", baseUrl);
    }

    /** Returns the underlying {@link HttpClient}; package-private for testing. */
    HttpClient httpClient() {
        return httpClient;
    }

    /** GET and DELETE never carry a body, even if one was placed. */
    private static HttpRequest.BodyPublisher bodyPublisher(UpstreamRequest request) {
        if (!request.method().carriesBody()) {
            return HttpRequest.BodyPublishers.noBody();
        }
        try {
            return HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(request.body()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize request body", e);
        }
    }

    private static void applyPoolProperties(GatewayConfig config) {
        setIfAbsent("jdk.httpclient.connectionPoolSize", Integer.toString(config.pool().maxKeepAlive()));
        long idleSeconds = Math.max(1, TimeUnit.MILLISECONDS.toSeconds(config.pool().idleTimeoutMs()));
        setIfAbsent("jdk.httpclient.keepalive.timeout", Long.toString(idleSeconds));
    }

    private static void setIfAbsent(String property, String value) {
        String existing = System.getProperty(property);
        if (existing == null) {
            System.setProperty(property, value);
        } else if (!existing.equals(value)) {
            LOG.info("{} is already {} for this JVM; configured value {} is ignored", property, existing, value);
        }
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "task-gateway-http-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
