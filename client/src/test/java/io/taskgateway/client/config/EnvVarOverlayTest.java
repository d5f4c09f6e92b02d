package io.taskgateway.client.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for the environment variable overlay of {@link ConfigLoader}. Env vars
 * take precedence over YAML; blank values count as unset.
 */
@DisplayName("ConfigLoader: environment overlay")
class EnvVarOverlayTest {

    private final Map<String, String> envVars = new HashMap<>();

    private Path fullConfigPath;

    private Function<String, String> envLookup() {
        return envVars::get;
    }

    @BeforeEach
    void setUp() throws Exception {
        fullConfigPath = ConfigLoaderTest.fixture("full.yaml");
        envVars.clear();
    }

    @Nested
    @DisplayName("overrides")
    class Overrides {

        @Test
        void baseUrlOverride() {
            envVars.put("TASK_SERVICE_URL", "http://10.0.0.5:20252/");

            assertThat(ConfigLoader.load(fullConfigPath, envLookup()).baseUrl()).isEqualTo("http://10.0.0.5:20252");
        }

        @Test
        void integerOverrides() {
            envVars.put("TASK_SERVICE_READ_TIMEOUT_MS", " 1234 ");
            envVars.put("TASK_SERVICE_MAX_CONNECTIONS", "8");
            envVars.put("TASK_SERVICE_MAX_KEEPALIVE_CONNECTIONS", "4");
            envVars.put("TASK_SERVICE_MAX_RETRIES", "0");
            envVars.put("TASK_SERVICE_HEALTH_CHECK_INTERVAL_MS", "500");

            GatewayConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.readTimeoutMs()).isEqualTo(1234);
            assertThat(config.pool().maxConnections()).isEqualTo(8);
            assertThat(config.pool().maxKeepAlive()).isEqualTo(4);
            assertThat(config.retry().maxRetries()).isZero();
            assertThat(config.healthCacheTtlMs()).isEqualTo(500);
        }

        @Test
        void retryDelaysCommaList() {
            envVars.put("TASK_SERVICE_RETRY_DELAYS_MS", "100, 200,400");

            assertThat(ConfigLoader.load(fullConfigPath, envLookup()).retry().backoff())
                    .containsExactly(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400));
        }

        @Test
        void booleanAndStringOverrides() {
            envVars.put("TASK_SERVICE_STRIP_CONTRACT_FIELDS", "false");
            envVars.put("LOG_FORMAT", "text");
            envVars.put("LOG_LEVEL", "WARN");
            envVars.put("TASK_SERVICE_USER_AGENT", "ops-cli/0.1");

            GatewayConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.stripContractFields()).isFalse();
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("WARN");
            assertThat(config.userAgent()).isEqualTo("ops-cli/0.1");
        }
    }

    @Nested
    @DisplayName("unset semantics")
    class UnsetSemantics {

        @Test
        @DisplayName("blank values keep the YAML value")
        void blankIsUnset() {
            envVars.put("TASK_SERVICE_URL", "   ");
            envVars.put("TASK_SERVICE_READ_TIMEOUT_MS", "");

            GatewayConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.baseUrl()).isEqualTo("https://tasks.internal:8443/api");
            assertThat(config.readTimeoutMs()).isEqualTo(15000);
        }
    }

    @Test
    @DisplayName("non-numeric env value names the variable")
    void nonNumericEnvValue() {
        envVars.put("TASK_SERVICE_CONNECT_TIMEOUT_MS", "fast");

        assertThatThrownBy(() -> ConfigLoader.load(fullConfigPath, envLookup()))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("TASK_SERVICE_CONNECT_TIMEOUT_MS");
    }

    @Test
    @DisplayName("environment alone is enough when TASK_SERVICE_URL is set")
    void environmentOnly() {
        envVars.put("TASK_SERVICE_URL", "http://127.0.0.1:20252");

        assertThat(ConfigLoader.fromEnvironment(envLookup()).baseUrl()).isEqualTo("http://127.0.0.1:20252");
    }

    @Test
    void environmentOnlyWithoutUrlFails() {
        assertThatThrownBy(() -> ConfigLoader.fromEnvironment(envLookup()))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("upstream.base-url");
    }
}
