package io.uvlanalyzer.core.engine;

/**
 * Resource limits and reproducibility settings for analyses. Immutable and thread-safe.
 *
 * @param timeoutMs         wall-clock budget per operation in milliseconds (default: 30s)
 * @param samplingSeed      seed for the sampling operation's random choices (default: 0)
 * @param defaultSampleSize sample size used when the caller does not give one (default: 10)
 */
public record AnalysisBudget(long timeoutMs, long samplingSeed, int defaultSampleSize) {

    /** Default budget: 30s per operation, seed 0, samples of 10. */
    public static final AnalysisBudget DEFAULT = new AnalysisBudget(30_000, 0, 10);

    public AnalysisBudget {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive, got: " + timeoutMs);
        }
        if (defaultSampleSize <= 0) {
            throw new IllegalArgumentException("defaultSampleSize must be positive, got: " + defaultSampleSize);
        }
    }

    /** Returns a copy with another timeout. */
    public AnalysisBudget withTimeoutMs(long timeoutMs) {
        return new AnalysisBudget(timeoutMs, samplingSeed, defaultSampleSize);
    }
}
