package io.uvlanalyzer.standalone.config;

import io.uvlanalyzer.core.engine.AnalysisBudget;

/**
 * Root configuration for the standalone tool server.
 *
 * <p>
 * Every field has a default; use {@link #builder()} to override individual values.
 *
 * @param host              bind address of the HTTP server
 * @param port              listen port; 0 picks a free port
 * @param maxBodyBytes      largest accepted request body
 * @param timeoutMs         wall-clock budget per analysis in milliseconds
 * @param samplingSeed      seed for the {@code sampling} operation
 * @param defaultSampleSize sample size when a request gives none
 * @param cacheCapacity     parsed models kept in memory; 0 disables caching
 * @param workerThreads     threads of the engine's worker pool
 * @param healthEnabled     register the liveness endpoint
 * @param healthPath        liveness endpoint path
 * @param metricsPath       analysis counters endpoint path
 * @param loggingFormat     {@code json} or {@code text}
 * @param loggingLevel      root log level
 */
public record ServerConfig(
        String host,
        int port,
        long maxBodyBytes,
        long timeoutMs,
        long samplingSeed,
        int defaultSampleSize,
        int cacheCapacity,
        int workerThreads,
        boolean healthEnabled,
        String healthPath,
        String metricsPath,
        String loggingFormat,
        String loggingLevel) {

    public ServerConfig {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("port must be between 0 and 65535, got: " + port);
        }
        if (maxBodyBytes <= 0) {
            throw new IllegalArgumentException("max-body-bytes must be positive, got: " + maxBodyBytes);
        }
        if (cacheCapacity < 0) {
            throw new IllegalArgumentException("cache-capacity must not be negative, got: " + cacheCapacity);
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("worker-threads must be positive, got: " + workerThreads);
        }
        if (!"json".equalsIgnoreCase(loggingFormat) && !"text".equalsIgnoreCase(loggingFormat)) {
            throw new IllegalArgumentException("logging.format must be json or text, got: " + loggingFormat);
        }
    }

    /** Resource limits handed to the analysis engine. */
    public AnalysisBudget budget() {
        return new AnalysisBudget(timeoutMs, samplingSeed, defaultSampleSize);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder holding the documented defaults. */
    public static final class Builder {
        private String host = "0.0.0.0";
        private int port = 8000;
        private long maxBodyBytes = 1_048_576; // 1 MB
        private long timeoutMs = AnalysisBudget.DEFAULT.timeoutMs();
        private long samplingSeed = AnalysisBudget.DEFAULT.samplingSeed();
        private int defaultSampleSize = AnalysisBudget.DEFAULT.defaultSampleSize();
        private int cacheCapacity = 64;
        private int workerThreads = Runtime.getRuntime().availableProcessors();
        private boolean healthEnabled = true;
        private String healthPath = "/health";
        private String metricsPath = "/metrics";
        private String loggingFormat = "json";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder maxBodyBytes(long maxBodyBytes) {
            this.maxBodyBytes = maxBodyBytes;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder samplingSeed(long samplingSeed) {
            this.samplingSeed = samplingSeed;
            return this;
        }

        public Builder defaultSampleSize(int defaultSampleSize) {
            this.defaultSampleSize = defaultSampleSize;
            return this;
        }

        public Builder cacheCapacity(int cacheCapacity) {
            this.cacheCapacity = cacheCapacity;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder healthEnabled(boolean healthEnabled) {
            this.healthEnabled = healthEnabled;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder metricsPath(String metricsPath) {
            this.metricsPath = metricsPath;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public ServerConfig build() {
            // Budget fields are validated by AnalysisBudget.
            new AnalysisBudget(timeoutMs, samplingSeed, defaultSampleSize);
            return new ServerConfig(
                    host,
                    port,
                    maxBodyBytes,
                    timeoutMs,
                    samplingSeed,
                    defaultSampleSize,
                    cacheCapacity,
                    workerThreads,
                    healthEnabled,
                    healthPath,
                    metricsPath,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
