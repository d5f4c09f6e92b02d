package io.taskgateway.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskgateway.client.config.ConfigLoadException;
import io.taskgateway.client.config.ConfigLoader;
import io.taskgateway.client.config.GatewayConfig;
import io.taskgateway.core.error.GatewayException;
import io.taskgateway.core.model.CallRequest;
import io.taskgateway.core.model.CallResponse;
import io.taskgateway.core.model.HttpMethod;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point for ad-hoc calls against the task service.
 *
 * <pre>
 * task-gateway [--config file.yaml] health
 * task-gateway [--config file.yaml] call METHOD PATH USER_ID [JSON_BODY]
 * </pre>
 *
 * <p>
 * Without {@code --config}, {@code task-gateway.yaml} is used if present,
 * otherwise the configuration comes from the environment alone. The result is
 * printed to stdout as JSON.
 *
 * <p>
 * Exit codes: {@code 0} success, {@code 1} unhealthy upstream or failure
 * envelope, {@code 2} usage or startup error.
 */
public final class TaskGatewayMain {

    private static final Logger LOG = LoggerFactory.getLogger(TaskGatewayMain.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = "Usage: task-gateway [--config <file>] health\n"
            + "       task-gateway [--config <file>] call <METHOD> <path> <user_id> [json-body]";

    private TaskGatewayMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err, System::getenv));
    }

    /** Runs one command and returns the process exit code. */
    static int run(String[] args, PrintStream out, PrintStream err, Function<String, String> envLookup) {
        List<String> command = new ArrayList<>();
        boolean explicitConfig = false;
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                explicitConfig = true;
                i++;
            } else {
                command.add(args[i]);
            }
        }
        if (command.isEmpty()) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        GatewayConfig config;
        try {
            config = loadConfig(args, explicitConfig, envLookup);
        } catch (ConfigLoadException | IllegalArgumentException e) {
            LOG.error("Startup failed: {}", e.getMessage());
            err.println("Startup failed: " + e.getMessage());
            return EXIT_USAGE;
        }
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());

        String verb = command.get(0);
        if ("health".equals(verb) && command.size() == 1) {
            try (GatewayClient client = new GatewayClient(config)) {
                boolean healthy = client.isHealthy();
                ObjectNode result = MAPPER.createObjectNode().put("healthy", healthy);
                out.println(result.toString());
                return healthy ? EXIT_OK : EXIT_FAILURE;
            }
        }
        if ("call".equals(verb) && (command.size() == 4 || command.size() == 5)) {
            CallRequest request;
            try {
                request = CallRequest.builder(HttpMethod.parse(command.get(1)), command.get(2))
                        .userId(command.get(3))
                        .body(command.size() == 5 ? parseBody(command.get(4)) : null)
                        .build();
            } catch (IllegalArgumentException e) {
                err.println(e.getMessage());
                return EXIT_USAGE;
            }
            try (GatewayClient client = new GatewayClient(config)) {
                CallResponse response = client.call(request);
                out.println(response.toJson().toString());
                return response.success() ? EXIT_OK : EXIT_FAILURE;
            } catch (GatewayException e) {
                err.println(e.getMessage());
                return EXIT_USAGE;
            }
        }
        err.println(USAGE);
        return EXIT_USAGE;
    }

    private static GatewayConfig loadConfig(String[] args, boolean explicitConfig, Function<String, String> envLookup) {
        Path path = ConfigLoader.resolveConfigPath(args);
        if (explicitConfig || Files.exists(path)) {
            return ConfigLoader.load(path, envLookup);
        }
        return ConfigLoader.fromEnvironment(envLookup);
    }

    private static ObjectNode parseBody(String json) {
        JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Body is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Body must be a JSON object");
        }
        return (ObjectNode) node;
    }
}
