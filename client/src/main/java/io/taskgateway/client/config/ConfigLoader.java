package io.taskgateway.client.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link GatewayConfig} from a YAML file with an optional environment
 * variable overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code task-gateway.yaml} from the current
 * directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>
 * Missing keys receive the defaults from {@link GatewayConfig.Builder}.
 * Every key can be overridden via an environment variable, and env vars take
 * precedence over YAML values. An env var is considered "set" if and only if
 * it is defined AND its trimmed value is non-empty; empty or whitespace-only
 * values are treated as "unset" and the YAML value is used.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "task-gateway.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link GatewayConfig} from the given YAML file path, applying
     * environment variable overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, contains invalid YAML
     *                             or holds an invalid value
     */
    public static GatewayConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link GatewayConfig} from the given YAML file path, applying
     * environment variable overrides from the supplied lookup function.
     * Returning {@code null} from {@code envLookup} means the variable is not
     * defined.
     *
     * @throws ConfigLoadException if the file is missing, contains invalid YAML
     *                             or holds an invalid value
     */
    public static GatewayConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        return fromTree(root, envLookup);
    }

    /**
     * Builds a configuration from the environment alone, for deployments that
     * ship no YAML file. {@code TASK_SERVICE_URL} must be set.
     */
    public static GatewayConfig fromEnvironment(Function<String, String> envLookup) {
        return fromTree(null, envLookup);
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @param args command-line arguments
     * @return the resolved config file path
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static GatewayConfig fromTree(JsonNode root, Function<String, String> envLookup) {
        GatewayConfig.Builder builder = GatewayConfig.builder();
        if (root != null && !root.isMissingNode() && !root.isNull()) {
            applyYaml(builder, root);
        }
        applyEnvOverrides(builder, envLookup);
        try {
            return builder.build();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigLoadException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static void applyYaml(GatewayConfig.Builder builder, JsonNode root) {
        // Upstream section
        JsonNode upstream = root.path("upstream");
        if (upstream.has("base-url")) builder.baseUrl(upstream.get("base-url").asText());
        if (upstream.has("user-agent")) builder.userAgent(upstream.get("user-agent").asText());
        yamlInt(upstream, "upstream.", "connect-timeout-ms", builder::connectTimeoutMs);
        yamlInt(upstream, "upstream.", "read-timeout-ms", builder::readTimeoutMs);
        yamlInt(upstream, "upstream.", "write-timeout-ms", builder::writeTimeoutMs);
        yamlInt(upstream, "upstream.", "pool-timeout-ms", builder::poolTimeoutMs);
        yamlInt(upstream, "upstream.", "call-timeout-ms", builder::callTimeoutMs);

        // Pool
        JsonNode pool = upstream.path("pool");
        yamlInt(pool, "upstream.pool.", "max-connections", builder::maxConnections);
        yamlInt(pool, "upstream.pool.", "max-keepalive", builder::maxKeepAlive);
        yamlInt(pool, "upstream.pool.", "idle-timeout-ms", builder::poolIdleTimeoutMs);

        // Retry section
        JsonNode retry = root.path("retry");
        yamlInt(retry, "retry.", "max-retries", builder::maxRetries);
        if (retry.has("backoff-ms")) {
            builder.backoffMs(yamlLongList(retry.get("backoff-ms"), "retry.backoff-ms"));
        }

        // Health section
        JsonNode health = root.path("health");
        if (health.has("path")) builder.healthPath(health.get("path").asText());
        yamlInt(health, "health.", "cache-ttl-ms", builder::healthCacheTtlMs);

        // Adapter section
        JsonNode adapter = root.path("adapter");
        if (adapter.has("strip-contract-fields"))
            builder.stripContractFields(adapter.get("strip-contract-fields").asBoolean());

        // Logging section
        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
    }

    /**
     * Applies environment variable overrides to the builder. An env var is
     * "set" if {@code envLookup.apply(name)} returns a non-null, non-empty
     * (after trim) string. Otherwise the YAML/default value stands.
     */
    private static void applyEnvOverrides(GatewayConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "TASK_SERVICE_URL", builder::baseUrl);
        envString(envLookup, "TASK_SERVICE_USER_AGENT", builder::userAgent);
        envString(envLookup, "TASK_SERVICE_HEALTH_PATH", builder::healthPath);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        envInt(envLookup, "TASK_SERVICE_CONNECT_TIMEOUT_MS", builder::connectTimeoutMs);
        envInt(envLookup, "TASK_SERVICE_READ_TIMEOUT_MS", builder::readTimeoutMs);
        envInt(envLookup, "TASK_SERVICE_WRITE_TIMEOUT_MS", builder::writeTimeoutMs);
        envInt(envLookup, "TASK_SERVICE_POOL_TIMEOUT_MS", builder::poolTimeoutMs);
        envInt(envLookup, "TASK_SERVICE_CALL_TIMEOUT_MS", builder::callTimeoutMs);
        envInt(envLookup, "TASK_SERVICE_MAX_CONNECTIONS", builder::maxConnections);
        envInt(envLookup, "TASK_SERVICE_MAX_KEEPALIVE_CONNECTIONS", builder::maxKeepAlive);
        envInt(envLookup, "TASK_SERVICE_POOL_IDLE_TIMEOUT_MS", builder::poolIdleTimeoutMs);
        envInt(envLookup, "TASK_SERVICE_MAX_RETRIES", builder::maxRetries);
        envInt(envLookup, "TASK_SERVICE_HEALTH_CHECK_INTERVAL_MS", builder::healthCacheTtlMs);

        envBool(envLookup, "TASK_SERVICE_STRIP_CONTRACT_FIELDS", builder::stripContractFields);

        if (isSet(envLookup, "TASK_SERVICE_RETRY_DELAYS_MS")) {
            List<Long> delays = new ArrayList<>();
            for (String part : envLookup.apply("TASK_SERVICE_RETRY_DELAYS_MS").split(",")) {
                if (!part.isBlank()) {
                    delays.add(parseLong("TASK_SERVICE_RETRY_DELAYS_MS", part.trim()));
                }
            }
            builder.backoffMs(delays);
        }
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer but was '" + raw + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    // --- YAML helpers ---

    private static void yamlInt(JsonNode node, String prefix, String field, IntConsumer setter) {
        if (!node.has(field)) {
            return;
        }
        JsonNode value = node.get(field);
        if (value.canConvertToInt()) {
            setter.accept(value.intValue());
            return;
        }
        if (value.isTextual()) {
            try {
                setter.accept(Integer.parseInt(value.textValue().trim()));
                return;
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(prefix + field + " must be an integer but was '" + value.asText() + "'", e);
            }
        }
        throw new ConfigLoadException(prefix + field + " must be an integer but was '" + value + "'");
    }

    private static List<Long> yamlLongList(JsonNode node, String key) {
        List<Long> values = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                values.add(item.isIntegralNumber() ? item.longValue() : parseLong(key, item.asText()));
            }
        } else {
            for (String part : node.asText().split(",")) {
                if (!part.isBlank()) {
                    values.add(parseLong(key, part.trim()));
                }
            }
        }
        return values;
    }

    private static long parseLong(String key, String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(key + " must contain integers but got '" + raw + "'", e);
        }
    }
}
