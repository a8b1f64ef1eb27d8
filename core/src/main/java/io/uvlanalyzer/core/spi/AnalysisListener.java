package io.uvlanalyzer.core.spi;

/**
 * Observability hooks for the analysis engine.
 *
 * <p>
 * Adapters implement this to feed counters, histograms or traces; the core has no telemetry
 * dependency of its own. Every method receives an immutable event. Implementations must be
 * thread-safe and must not block: callbacks run on the thread that executes the analysis.
 * Exceptions thrown by a listener are caught and logged by the engine and never change the
 * outcome of an analysis.
 *
 * <p>
 * Suggested metric vocabulary:
 * <ul>
 * <li>{@code analyses_total}: counter, incremented on completed and failed</li>
 * <li>{@code analysis_duration_ms}: histogram of completed durations</li>
 * <li>{@code analysis_timeouts_total}: counter of failures with the timeout URN</li>
 * <li>{@code model_rejections_total}: counter, incremented on rejected</li>
 * </ul>
 */
public interface AnalysisListener {

    /**
     * Called before an operation runs.
     *
     * @param event contains the operation wire name
     */
    void onAnalysisStarted(AnalysisStartedEvent event);

    /**
     * Called when an operation returns a result.
     *
     * @param event contains the operation and its duration
     */
    void onAnalysisCompleted(AnalysisCompletedEvent event);

    /**
     * Called when an operation fails (unknown feature, bad argument, timeout).
     *
     * @param event contains the operation, duration, error URN and detail
     */
    void onAnalysisFailed(AnalysisFailedEvent event);

    /**
     * Called when model text is parsed for the first time.
     *
     * @param event contains the root name and the model's size
     */
    void onModelParsed(ModelParsedEvent event);

    /**
     * Called when model text is rejected as malformed.
     *
     * @param event contains the location hint and error detail
     */
    void onModelRejected(ModelRejectedEvent event);

    // --- Event records ---

    /** Event emitted when an operation starts. */
    record AnalysisStartedEvent(String operation) {}

    /** Event emitted when an operation completes. */
    record AnalysisCompletedEvent(String operation, long durationMs) {}

    /** Event emitted when an operation fails. */
    record AnalysisFailedEvent(String operation, long durationMs, String errorUrn, String errorDetail) {}

    /** Event emitted when a model is parsed. */
    record ModelParsedEvent(String rootFeature, int featureCount, int constraintCount, long durationMs) {}

    /** Event emitted when a model is rejected. */
    record ModelRejectedEvent(String location, String errorDetail) {}
}
