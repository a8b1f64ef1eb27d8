package io.uvlanalyzer.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * Loads {@link ServerConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * File resolution:
 * <ul>
 * <li>{@code --config /path/to/config.yaml}: that file, which must exist</li>
 * <li>otherwise {@code uvl-analyzer.yaml} in the working directory, when present</li>
 * <li>otherwise the built-in defaults</li>
 * </ul>
 *
 * <p>
 * Layout:
 * <pre>{@code
 * server:
 *   host: 0.0.0.0
 *   port: 8000
 *   max-body-bytes: 1048576
 * analysis:
 *   timeout-ms: 30000
 *   sampling-seed: 0
 *   default-sample-size: 10
 *   cache-capacity: 64
 *   worker-threads: 4
 * health:
 *   enabled: true
 *   path: /health
 * metrics:
 *   path: /metrics
 * logging:
 *   format: json
 *   level: INFO
 * }</pre>
 *
 * <p>
 * Every key can be overridden by an {@code UVL_ANALYZER_*} environment variable. A variable
 * counts as set only when its trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "uvl-analyzer.yaml";

    static final String ENV_HOST = "UVL_ANALYZER_HOST";
    static final String ENV_PORT = "UVL_ANALYZER_PORT";
    static final String ENV_MAX_BODY_BYTES = "UVL_ANALYZER_MAX_BODY_BYTES";
    static final String ENV_TIMEOUT_MS = "UVL_ANALYZER_TIMEOUT_MS";
    static final String ENV_SAMPLING_SEED = "UVL_ANALYZER_SAMPLING_SEED";
    static final String ENV_DEFAULT_SAMPLE_SIZE = "UVL_ANALYZER_DEFAULT_SAMPLE_SIZE";
    static final String ENV_CACHE_CAPACITY = "UVL_ANALYZER_CACHE_CAPACITY";
    static final String ENV_WORKER_THREADS = "UVL_ANALYZER_WORKER_THREADS";
    static final String ENV_HEALTH_ENABLED = "UVL_ANALYZER_HEALTH_ENABLED";
    static final String ENV_HEALTH_PATH = "UVL_ANALYZER_HEALTH_PATH";
    static final String ENV_METRICS_PATH = "UVL_ANALYZER_METRICS_PATH";
    static final String ENV_LOG_FORMAT = "UVL_ANALYZER_LOG_FORMAT";
    static final String ENV_LOG_LEVEL = "UVL_ANALYZER_LOG_LEVEL";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration named by the command line, or the defaults when there is none,
     * applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if an explicit file is missing or any value is invalid
     */
    public static ServerConfig load(String[] args) {
        return load(args, System::getenv);
    }

    /**
     * Loads the configuration named by the command line, applying overrides from the supplied
     * lookup. Without {@code --config}, the default file is read if present and skipped if not.
     */
    public static ServerConfig load(String[] args, Function<String, String> envLookup) {
        Optional<Path> explicit = resolveConfigPath(args);
        if (explicit.isPresent()) {
            return load(explicit.get(), envLookup);
        }
        Path fallback = Path.of(DEFAULT_CONFIG_FILE);
        if (Files.exists(fallback)) {
            return load(fallback, envLookup);
        }
        return defaults(envLookup);
    }

    /**
     * Loads a {@link ServerConfig} from the given YAML file, applying overrides from
     * {@link System#getenv}.
     */
    public static ServerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link ServerConfig} from the given YAML file, applying overrides from the supplied
     * lookup. Returning {@code null} from {@code envLookup} means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or holds an invalid value
     */
    public static ServerConfig load(Path configPath, Function<String, String> envLookup) {
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
        try {
            return mapToConfig(root == null ? MissingNode.getInstance() : root, envLookup);
        } catch (RuntimeException e) {
            throw new ConfigLoadException(
                    "Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    /** The built-in defaults with environment overrides applied. */
    public static ServerConfig defaults(Function<String, String> envLookup) {
        try {
            return mapToConfig(MissingNode.getInstance(), envLookup);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @return the path given with {@code --config}, or empty when the flag is absent
     * @throws ConfigLoadException if {@code --config} has no value
     */
    public static Optional<Path> resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new ConfigLoadException("--config requires a file path argument");
                }
                return Optional.of(Path.of(args[i + 1]));
            }
        }
        return Optional.empty();
    }

    private static ServerConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ServerConfig.Builder builder = ServerConfig.builder();

        JsonNode server = root.path("server");
        if (server.has("host")) builder.host(server.get("host").asText());
        if (server.has("port")) builder.port(intValue(server, "port"));
        if (server.has("max-body-bytes")) builder.maxBodyBytes(longValue(server, "max-body-bytes"));

        JsonNode analysis = root.path("analysis");
        if (analysis.has("timeout-ms")) builder.timeoutMs(longValue(analysis, "timeout-ms"));
        if (analysis.has("sampling-seed")) builder.samplingSeed(longValue(analysis, "sampling-seed"));
        if (analysis.has("default-sample-size"))
            builder.defaultSampleSize(intValue(analysis, "default-sample-size"));
        if (analysis.has("cache-capacity")) builder.cacheCapacity(intValue(analysis, "cache-capacity"));
        if (analysis.has("worker-threads")) builder.workerThreads(intValue(analysis, "worker-threads"));

        JsonNode health = root.path("health");
        if (health.has("enabled")) builder.healthEnabled(health.get("enabled").asBoolean());
        if (health.has("path")) builder.healthPath(health.get("path").asText());

        JsonNode metrics = root.path("metrics");
        if (metrics.has("path")) builder.metricsPath(metrics.get("path").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // Environment variables win over YAML.
        envString(envLookup, ENV_HOST, builder::host);
        envInt(envLookup, ENV_PORT, builder::port);
        envLong(envLookup, ENV_MAX_BODY_BYTES, builder::maxBodyBytes);
        envLong(envLookup, ENV_TIMEOUT_MS, builder::timeoutMs);
        envLong(envLookup, ENV_SAMPLING_SEED, builder::samplingSeed);
        envInt(envLookup, ENV_DEFAULT_SAMPLE_SIZE, builder::defaultSampleSize);
        envInt(envLookup, ENV_CACHE_CAPACITY, builder::cacheCapacity);
        envInt(envLookup, ENV_WORKER_THREADS, builder::workerThreads);
        envBool(envLookup, ENV_HEALTH_ENABLED, builder::healthEnabled);
        envString(envLookup, ENV_HEALTH_PATH, builder::healthPath);
        envString(envLookup, ENV_METRICS_PATH, builder::metricsPath);
        envString(envLookup, ENV_LOG_FORMAT, builder::loggingFormat);
        envString(envLookup, ENV_LOG_LEVEL, builder::loggingLevel);

        return builder.build();
    }

    // --- Env helpers ---

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
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(envVar + " must be an integer, got: " + value, e);
            }
        }
    }

    private static void envLong(Function<String, String> envLookup, String envVar, LongConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Long.parseLong(value));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(envVar + " must be an integer, got: " + value, e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    // --- YAML helpers ---

    private static int intValue(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (!value.canConvertToInt()) {
            throw new IllegalArgumentException(field + " must be an integer, got: " + value.asText());
        }
        return value.intValue();
    }

    private static long longValue(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (!value.canConvertToLong()) {
            throw new IllegalArgumentException(field + " must be an integer, got: " + value.asText());
        }
        return value.longValue();
    }
}
