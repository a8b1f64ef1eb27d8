package io.uvlanalyzer.standalone.server;

import io.javalin.Javalin;
import io.uvlanalyzer.core.engine.AnalysisEngine;
import io.uvlanalyzer.core.engine.Operation;
import io.uvlanalyzer.standalone.config.ConfigLoader;
import io.uvlanalyzer.standalone.config.ServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup sequence of the tool server.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Load configuration from YAML + env overlay</li>
 * <li>Configure Logback</li>
 * <li>Create the analysis engine with the metrics listener</li>
 * <li>Register routes and start Javalin</li>
 * </ol>
 *
 * <p>
 * Kept apart from {@link io.uvlanalyzer.standalone.StandaloneMain} so tests can start a server
 * from a {@link ServerConfig} without going through {@code main()}.
 */
public final class ServerApp {

    private static final Logger LOG = LoggerFactory.getLogger(ServerApp.class);

    static final String TOOLS_PATH = "/tools";

    private final Javalin app;
    private final AnalysisEngine engine;
    private final AnalysisMetrics metrics;
    private final ServerConfig config;

    private ServerApp(Javalin app, AnalysisEngine engine, AnalysisMetrics metrics, ServerConfig config) {
        this.app = app;
        this.engine = engine;
        this.metrics = metrics;
        this.config = config;
    }

    /**
     * Loads the configuration named by {@code args}, configures logging and starts the server.
     *
     * @param args command-line arguments (e.g. {@code --config path/to/config.yaml})
     * @return a running server
     */
    public static ServerApp start(String[] args) {
        ServerConfig config = ConfigLoader.load(args);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded: {}", ConfigLoader.resolveConfigPath(args)
                .map(Object::toString)
                .orElse("defaults"));
        return start(config);
    }

    /** Starts a server for an already-loaded configuration. Logging is left as it is. */
    public static ServerApp start(ServerConfig config) {
        long startTime = System.nanoTime();

        AnalysisMetrics metrics = new AnalysisMetrics();
        AnalysisEngine engine =
                new AnalysisEngine(config.budget(), metrics, config.cacheCapacity(), config.workerThreads());

        Javalin app = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;
            // Oversized bodies are rejected by ToolHandler with a problem detail.
            javalinConfig.http.maxRequestSize = Math.max(javalinConfig.http.maxRequestSize, config.maxBodyBytes());
        });

        if (config.healthEnabled()) {
            app.get(config.healthPath(), new HealthHandler());
        }
        app.get(config.metricsPath(), new MetricsHandler(metrics));
        app.get(TOOLS_PATH, new ToolListHandler());
        app.post(TOOLS_PATH + "/{" + ToolHandler.OPERATION_PARAM + "}", new ToolHandler(engine, config.maxBodyBytes()));

        try {
            app.start(config.host(), config.port());
        } catch (RuntimeException e) {
            engine.close();
            throw e;
        }

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "uvl-analyzer started: host={}, port={}, tools={}, timeoutMs={}, cacheCapacity={}, workers={}, startupMs={}",
                config.host(),
                app.port(),
                Operation.values().length,
                config.timeoutMs(),
                config.cacheCapacity(),
                config.workerThreads(),
                elapsedMs);

        return new ServerApp(app, engine, metrics, config);
    }

    /** Returns the port the server is listening on. */
    public int port() {
        return app.port();
    }

    public Javalin javalin() {
        return app;
    }

    public AnalysisEngine engine() {
        return engine;
    }

    public AnalysisMetrics metrics() {
        return metrics;
    }

    public ServerConfig config() {
        return config;
    }

    /** Stops Javalin, then the engine's worker pool. */
    public void stop() {
        app.stop();
        engine.close();
        LOG.info("uvl-analyzer stopped");
    }
}
