package io.uvlanalyzer.standalone.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.uvlanalyzer.standalone.config.ConfigLoadException;
import io.uvlanalyzer.standalone.config.ServerConfig;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Startup and route registration of {@link ServerApp}. */
@DisplayName("ServerAppTest")
class ServerAppTest {

    private final HttpClient client = HttpClient.newHttpClient();

    private int status(int port, String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + path))
                .GET()
                .build();
        return client.send(request, HttpResponse.BodyHandlers.discarding()).statusCode();
    }

    @Test
    @DisplayName("missing --config file → startup fails before the server binds")
    void missingConfigFile() {
        assertThatThrownBy(() -> ServerApp.start(new String[] {"--config", "no-such-file.yaml"}))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("no-such-file.yaml");
    }

    @Test
    @DisplayName("health disabled and custom metrics path")
    void configuredRoutes() throws Exception {
        ServerApp server = ServerApp.start(ServerConfig.builder()
                .host("127.0.0.1")
                .port(0)
                .healthEnabled(false)
                .metricsPath("/stats")
                .build());
        try {
            assertThat(server.port()).isPositive();
            assertThat(status(server.port(), "/health")).isEqualTo(404);
            assertThat(status(server.port(), "/stats")).isEqualTo(200);
            assertThat(status(server.port(), "/metrics")).isEqualTo(404);
        } finally {
            server.stop();
        }
    }

    @Test
    @DisplayName("engine is built from the configured budget")
    void engineBudget() {
        ServerApp server = ServerApp.start(ServerConfig.builder()
                .host("127.0.0.1")
                .port(0)
                .timeoutMs(1234)
                .samplingSeed(7)
                .build());
        try {
            assertThat(server.engine().budget().timeoutMs()).isEqualTo(1234);
            assertThat(server.engine().budget().samplingSeed()).isEqualTo(7);
        } finally {
            server.stop();
        }
    }
}
