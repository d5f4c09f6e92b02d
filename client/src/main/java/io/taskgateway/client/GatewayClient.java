package io.taskgateway.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskgateway.client.config.GatewayConfig;
import io.taskgateway.client.transport.BackoffSleeper;
import io.taskgateway.client.transport.RetryingTransport;
import io.taskgateway.client.transport.TransportResult;
import io.taskgateway.client.transport.UpstreamClient;
import io.taskgateway.client.transport.UpstreamRequest;
import io.taskgateway.client.transport.UpstreamResponse;
import io.taskgateway.core.engine.ErrorEnvelopeBuilder;
import io.taskgateway.core.engine.IdentifierValidator;
import io.taskgateway.core.engine.JsonNodeUtils;
import io.taskgateway.core.engine.ParameterPlacer;
import io.taskgateway.core.engine.PathRewriter;
import io.taskgateway.core.engine.RequestShapeAdapter;
import io.taskgateway.core.engine.ResponseShapeAdapter;
import io.taskgateway.core.engine.RewriteTable;
import io.taskgateway.core.error.GatewayError;
import io.taskgateway.core.error.InvalidIdentifierException;
import io.taskgateway.core.error.MalformedPayloadException;
import io.taskgateway.core.error.RouteConfigurationException;
import io.taskgateway.core.model.CallRequest;
import io.taskgateway.core.model.CallResponse;
import io.taskgateway.core.model.HttpMethod;
import io.taskgateway.core.model.PlacedParameters;
import io.taskgateway.core.model.RewrittenRoute;
import io.taskgateway.core.model.RouteMatch;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the upstream task service, exposing the stable logical contract.
 *
 * <p>
 * One call runs these stages strictly in order:
 * <ol>
 * <li>validate {@code userId} and every {@code *_id} path parameter;</li>
 * <li>rewrite the logical method and path;</li>
 * <li>place parameters between query and body, injecting {@code user_id};</li>
 * <li>execute with retry;</li>
 * <li>reshape the upstream body into the {@link CallResponse} envelope.</li>
 * </ol>
 *
 * <p>
 * Every failure after validation is returned as a {@link CallResponse} with
 * {@code success=false}, including a request that cannot be expressed as a
 * URI (400). Only {@link InvalidIdentifierException} (bad input,
 * raised before any I/O) and {@link RouteConfigurationException} (a missing
 * path parameter or a broken rewrite table) are thrown.
 *
 * <p>
 * Construct once at startup and share: the instance is thread-safe and owns
 * the upstream connection pool until {@link #close()}.
 */
public final class GatewayClient implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(GatewayClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final GatewayConfig config;
    private final PathRewriter rewriter;
    private final UpstreamClient upstreamClient;
    private final RetryingTransport transport;
    private final HealthMonitor healthMonitor;
    private final AtomicBoolean closed = new AtomicBoolean();

    /** Creates a client with the default task-service rewrite table. */
    public GatewayClient(GatewayConfig config) {
        this(config, RewriteTable.taskServiceDefaults());
    }

    public GatewayClient(GatewayConfig config, RewriteTable table) {
        this(config, table, new UpstreamClient(config), BackoffSleeper.THREAD_SLEEP, Clock.systemUTC());
    }

    GatewayClient(
            GatewayConfig config,
            RewriteTable table,
            UpstreamClient upstreamClient,
            BackoffSleeper sleeper,
            Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.rewriter = new PathRewriter(table);
        this.upstreamClient = upstreamClient;
        this.transport = new RetryingTransport(
                upstreamClient, config.retry(), sleeper, Duration.ofMillis(config.callTimeoutMs()));
        this.healthMonitor = new HealthMonitor(
                upstreamClient, config.healthPath(), Duration.ofMillis(config.healthCacheTtlMs()), clock);

        LOG.info(
                "GatewayClient created: baseUrl={}, routes={}, maxRetries={}, maxConnections={}",
                config.baseUrl(),
                table.size(),
                config.retry().maxRetries(),
                config.pool().maxConnections());
    }

    /**
     * Performs one logical call.
     *
     * @param method      logical method
     * @param logicalPath logical path, template or concrete
     * @param userId      caller identity, canonical UUID
     * @param body        JSON body, may be {@code null}
     * @param query       query parameters, may be {@code null}
     * @param pathParams  placeholder values, may be {@code null}
     * @return the normalized envelope
     * @throws InvalidIdentifierException  if {@code userId} or a {@code *_id}
     *                                     path parameter is not a UUID
     * @throws RouteConfigurationException if a required path parameter is
     *                                     missing
     */
    public CallResponse call(
            HttpMethod method,
            String logicalPath,
            String userId,
            ObjectNode body,
            ObjectNode query,
            Map<String, String> pathParams) {
        return call(new CallRequest(method, logicalPath, userId, pathParams, body, query));
    }

    /**
     * Performs one logical call.
     *
     * @see #call(HttpMethod, String, String, ObjectNode, ObjectNode, Map)
     */
    public CallResponse call(CallRequest request) {
        ensureOpen();
        String userId = IdentifierValidator.validate(request.userId(), ParameterPlacer.USER_ID);
        RouteMatch match = rewriter.match(request.method(), request.logicalPath(), request.pathParams());
        IdentifierValidator.validatePathParams(match.pathParams());
        RewrittenRoute route = rewriter.rewrite(request.method(), match);

        PlacedParameters placed = ParameterPlacer.place(route, userId, request.body(), request.query());
        ObjectNode body = placed.body();
        if (config.stripContractFields() && route.method().carriesBody()) {
            body = RequestShapeAdapter.stripReadOnlyFields(body);
        }
        UpstreamRequest upstreamRequest = new UpstreamRequest(route.method(), route.path(), placed.query(), body);

        long start = System.nanoTime();
        TransportResult result;
        try {
            result = transport.execute(upstreamRequest);
        } catch (IllegalArgumentException e) {
            // request could not be turned into a valid URI; nothing was sent
            LOG.error("{} {} cannot be sent upstream: {}", route.method(), route.path(), e.getMessage());
            return CallResponse.failure(400, "Invalid upstream request: " + e.getMessage());
        }
        CallResponse response = result.isSuccess()
                ? interpret(upstreamRequest, result.response())
                : ErrorEnvelopeBuilder.toResponse(result.error());

        LOG.info(
                "{} {} → {} {}: code={}, attempts={}, {} ms",
                request.method(),
                request.logicalPath(),
                route.method(),
                route.path(),
                response.code(),
                result.attempts(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        return response;
    }

    /**
     * Returns whether the upstream answers its health endpoint with 2xx. A
     * healthy verdict is cached for the configured TTL.
     */
    public boolean isHealthy() {
        ensureOpen();
        return healthMonitor.isHealthy();
    }

    /** Releases the upstream connection pool. Idempotent. */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            upstreamClient.close();
            LOG.info("GatewayClient closed: baseUrl={}", config.baseUrl());
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("GatewayClient is closed");
        }
    }

    private CallResponse interpret(UpstreamRequest request, UpstreamResponse response) {
        int status = response.statusCode();
        String raw = response.body();

        JsonNode body = null;
        if (!raw.isBlank()) {
            try {
                body = MAPPER.readTree(raw);
            } catch (JsonProcessingException e) {
                if (response.isError()) {
                    return ErrorEnvelopeBuilder.toResponse(GatewayError.upstreamHttpError(status, null, "HTTP " + status));
                }
                LOG.error("{} {} returned non-JSON body with HTTP {}", request.method(), request.path(), status);
                return ErrorEnvelopeBuilder.toResponse(GatewayError.malformedResponse("body is not valid JSON", raw));
            }
        }

        if (response.isError()) {
            return ErrorEnvelopeBuilder.toResponse(httpError(status, body), errorData(body));
        }

        try {
            return ResponseShapeAdapter.toEnvelope(body, status);
        } catch (MalformedPayloadException e) {
            LOG.error("{} {} returned a malformed payload: {}", request.method(), request.path(), e.getMessage());
            return ErrorEnvelopeBuilder.toResponse(GatewayError.malformedResponse(e.getMessage(), raw));
        }
    }

    /** Reads the upstream business code and message from an error body. */
    private static GatewayError httpError(int status, JsonNode body) {
        Integer businessCode = null;
        String message = null;
        if (body != null && body.isObject()) {
            Long code = JsonNodeUtils.longOrNull(body, "code");
            businessCode = code == null ? null : code.intValue();
            message = JsonNodeUtils.textOrNull(body, "message");
            if (message == null) {
                message = JsonNodeUtils.textOrNull(body, "detail");
            }
        }
        return GatewayError.upstreamHttpError(status, businessCode, message != null ? message : "HTTP " + status);
    }

    private static JsonNode errorData(JsonNode body) {
        if (body == null || !body.isObject()) {
            return null;
        }
        JsonNode data = body.get("data");
        return JsonNodeUtils.isAbsent(data) ? null : data;
    }
}
