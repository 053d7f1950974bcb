package io.formulaflow.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.formulaflow.core.engine.FailurePolicy;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link EngineConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * cache:
 *   capacity: 1024
 * executor:
 *   failure-policy: isolate        # or abort-batch
 *   parallel-rows: false
 *   parallel-threshold: 1000
 * </pre>
 *
 * <p>
 * Missing keys keep the {@link EngineConfig.Builder} defaults. Environment variables take
 * precedence over YAML values: {@code FORMULAFLOW_CACHE_CAPACITY},
 * {@code FORMULAFLOW_FAILURE_POLICY}, {@code FORMULAFLOW_PARALLEL_ROWS} and
 * {@code FORMULAFLOW_PARALLEL_THRESHOLD}. A variable counts as set only if it is defined and its
 * trimmed value is non-empty.
 */
public final class EngineConfigLoader {

    static final String ENV_CACHE_CAPACITY = "FORMULAFLOW_CACHE_CAPACITY";
    static final String ENV_FAILURE_POLICY = "FORMULAFLOW_FAILURE_POLICY";
    static final String ENV_PARALLEL_ROWS = "FORMULAFLOW_PARALLEL_ROWS";
    static final String ENV_PARALLEL_THRESHOLD = "FORMULAFLOW_PARALLEL_THRESHOLD";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private EngineConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath}, overlaying {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds an invalid
     *                             value
     */
    public static EngineConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, overlaying variables from {@code envLookup}
     * ({@code null} means undefined).
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds an invalid
     *                             value
     */
    public static EngineConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            // Empty file: defaults plus environment.
            root = YAML_MAPPER.createObjectNode();
        }
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
        }
        try {
            return mapToConfig(root, envLookup);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    /** Environment-only configuration: builder defaults overlaid with {@code envLookup}. */
    public static EngineConfig fromEnvironment(Function<String, String> envLookup) {
        try {
            return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in environment: " + e.getMessage(), e);
        }
    }

    private static EngineConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        EngineConfig.Builder builder = EngineConfig.builder();

        // --- YAML mapping ---

        JsonNode cache = root.path("cache");
        if (cache.has("capacity")) builder.cacheCapacity(intValue(cache, "cache.capacity", "capacity"));

        JsonNode executor = root.path("executor");
        if (executor.has("failure-policy"))
            builder.failurePolicy(FailurePolicy.fromString(executor.get("failure-policy").asText()));
        if (executor.has("parallel-rows"))
            builder.parallelRows(boolValue(executor, "executor.parallel-rows", "parallel-rows"));
        if (executor.has("parallel-threshold"))
            builder.parallelThreshold(intValue(executor, "executor.parallel-threshold", "parallel-threshold"));

        // --- Environment variable overlay ---

        envInt(envLookup, ENV_CACHE_CAPACITY, builder::cacheCapacity);
        envString(envLookup, ENV_FAILURE_POLICY, v -> builder.failurePolicy(FailurePolicy.fromString(v)));
        envBool(envLookup, ENV_PARALLEL_ROWS, builder::parallelRows);
        envInt(envLookup, ENV_PARALLEL_THRESHOLD, builder::parallelThreshold);

        return builder.build();
    }

    // --- YAML helpers ---

    private static int intValue(JsonNode node, String key, String field) {
        JsonNode value = node.get(field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new IllegalArgumentException("'" + key + "' must be an integer, got '" + value.asText() + "'");
        }
        return value.asInt();
    }

    private static boolean boolValue(JsonNode node, String key, String field) {
        JsonNode value = node.get(field);
        if (!value.isBoolean()) {
            throw new IllegalArgumentException("'" + key + "' must be true or false, got '" + value.asText() + "'");
        }
        return value.asBoolean();
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined and non-blank after trimming. */
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
                throw new IllegalArgumentException(envVar + " must be an integer, got '" + raw + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
