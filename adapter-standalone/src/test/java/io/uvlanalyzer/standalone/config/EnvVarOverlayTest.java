package io.uvlanalyzer.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for the {@code UVL_ANALYZER_*} environment overlay on {@link ConfigLoader}. A variable
 * wins over YAML when it is defined and its trimmed value is non-empty.
 */
@DisplayName("EnvVarOverlayTest")
class EnvVarOverlayTest {

    private final Map<String, String> envVars = new HashMap<>();

    private Path fullConfigPath;

    private Function<String, String> envLookup() {
        return envVars::get;
    }

    @BeforeEach
    void setUp() throws Exception {
        fullConfigPath = ConfigLoaderTest.fixture("full-config.yaml");
        envVars.clear();
    }

    @Nested
    @DisplayName("Overrides")
    class Overrides {

        @Test
        @DisplayName("string keys")
        void strings() {
            envVars.put(ConfigLoader.ENV_HOST, "10.0.0.1");
            envVars.put(ConfigLoader.ENV_HEALTH_PATH, "/live");
            envVars.put(ConfigLoader.ENV_METRICS_PATH, "/counters");
            envVars.put(ConfigLoader.ENV_LOG_FORMAT, "json");
            envVars.put(ConfigLoader.ENV_LOG_LEVEL, "WARN");

            ServerConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.host()).isEqualTo("10.0.0.1");
            assertThat(config.healthPath()).isEqualTo("/live");
            assertThat(config.metricsPath()).isEqualTo("/counters");
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("WARN");
        }

        @Test
        @DisplayName("numeric keys")
        void numbers() {
            envVars.put(ConfigLoader.ENV_PORT, "9100");
            envVars.put(ConfigLoader.ENV_MAX_BODY_BYTES, "2048");
            envVars.put(ConfigLoader.ENV_TIMEOUT_MS, "750");
            envVars.put(ConfigLoader.ENV_SAMPLING_SEED, "9000000000");
            envVars.put(ConfigLoader.ENV_DEFAULT_SAMPLE_SIZE, "3");
            envVars.put(ConfigLoader.ENV_CACHE_CAPACITY, "0");
            envVars.put(ConfigLoader.ENV_WORKER_THREADS, "8");

            ServerConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.port()).isEqualTo(9100);
            assertThat(config.maxBodyBytes()).isEqualTo(2048);
            assertThat(config.timeoutMs()).isEqualTo(750);
            assertThat(config.samplingSeed()).isEqualTo(9_000_000_000L);
            assertThat(config.defaultSampleSize()).isEqualTo(3);
            assertThat(config.cacheCapacity()).isZero();
            assertThat(config.workerThreads()).isEqualTo(8);
        }

        @Test
        @DisplayName("boolean key")
        void booleans() {
            envVars.put(ConfigLoader.ENV_HEALTH_ENABLED, "true");

            assertThat(ConfigLoader.load(fullConfigPath, envLookup()).healthEnabled()).isTrue();
        }

        @Test
        @DisplayName("values are trimmed")
        void trimmed() {
            envVars.put(ConfigLoader.ENV_PORT, "  9200 ");

            assertThat(ConfigLoader.load(fullConfigPath, envLookup()).port()).isEqualTo(9200);
        }

        @Test
        @DisplayName("overlay applies without a file")
        void withoutFile() {
            envVars.put(ConfigLoader.ENV_PORT, "0");

            assertThat(ConfigLoader.defaults(envLookup()).port()).isZero();
        }
    }

    @Nested
    @DisplayName("Unset values")
    class Unset {

        @Test
        @DisplayName("empty or blank → YAML value kept")
        void blankIgnored() {
            envVars.put(ConfigLoader.ENV_HOST, "");
            envVars.put(ConfigLoader.ENV_PORT, "   ");

            ServerConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.host()).isEqualTo("127.0.0.1");
            assertThat(config.port()).isEqualTo(8123);
        }
    }

    @Nested
    @DisplayName("Invalid values")
    class Invalid {

        @Test
        @DisplayName("non-numeric port → ConfigLoadException naming the variable")
        void nonNumeric() {
            envVars.put(ConfigLoader.ENV_PORT, "eighty");

            assertThatThrownBy(() -> ConfigLoader.load(fullConfigPath, envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining(ConfigLoader.ENV_PORT);
        }

        @Test
        @DisplayName("negative cache capacity → ConfigLoadException")
        void negativeCapacity() {
            envVars.put(ConfigLoader.ENV_CACHE_CAPACITY, "-1");

            assertThatThrownBy(() -> ConfigLoader.defaults(envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("cache-capacity");
        }
    }
}
