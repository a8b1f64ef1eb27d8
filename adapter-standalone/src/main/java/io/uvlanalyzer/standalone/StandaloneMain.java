package io.uvlanalyzer.standalone;

import io.uvlanalyzer.standalone.server.ServerApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the standalone tool server. Delegates to {@link ServerApp#start(String[])};
 * on failure, logs the error and exits with status 1.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * @param args command-line arguments (e.g. {@code --config path/to/uvl-analyzer.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            ServerApp server = ServerApp.start(args);
            Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "uvl-analyzer-shutdown"));
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
