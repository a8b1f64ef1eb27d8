package io.uvlanalyzer.standalone.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.uvlanalyzer.core.error.AnalysisTimeoutException;
import io.uvlanalyzer.core.spi.AnalysisListener;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-process counters fed by the engine's listener callbacks.
 *
 * <p>
 * Lock-free: every callback only increments {@link LongAdder}s, so it never blocks the
 * analysis thread.
 */
public final class AnalysisMetrics implements AnalysisListener {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final LongAdder started = new LongAdder();
    private final LongAdder completed = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final LongAdder timeouts = new LongAdder();
    private final LongAdder durationMsTotal = new LongAdder();
    private final LongAdder modelsParsed = new LongAdder();
    private final LongAdder modelsRejected = new LongAdder();
    private final Map<String, LongAdder> perOperation = new ConcurrentHashMap<>();

    @Override
    public void onAnalysisStarted(AnalysisStartedEvent event) {
        started.increment();
    }

    @Override
    public void onAnalysisCompleted(AnalysisCompletedEvent event) {
        completed.increment();
        durationMsTotal.add(event.durationMs());
        perOperation.computeIfAbsent(event.operation(), key -> new LongAdder()).increment();
    }

    @Override
    public void onAnalysisFailed(AnalysisFailedEvent event) {
        failed.increment();
        if (AnalysisTimeoutException.URN.equals(event.errorUrn())) {
            timeouts.increment();
        }
    }

    @Override
    public void onModelParsed(ModelParsedEvent event) {
        modelsParsed.increment();
    }

    @Override
    public void onModelRejected(ModelRejectedEvent event) {
        modelsRejected.increment();
    }

    public long analysesStarted() {
        return started.sum();
    }

    public long analysesCompleted() {
        return completed.sum();
    }

    public long analysesFailed() {
        return failed.sum();
    }

    public long analysisTimeouts() {
        return timeouts.sum();
    }

    public long modelsParsed() {
        return modelsParsed.sum();
    }

    public long modelsRejected() {
        return modelsRejected.sum();
    }

    /** Completed analyses of one operation. */
    public long completedOf(String operation) {
        LongAdder adder = perOperation.get(operation);
        return adder == null ? 0 : adder.sum();
    }

    /** Point-in-time snapshot as JSON; the per-operation map is sorted by wire name. */
    public ObjectNode snapshot() {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("analyses_started_total", started.sum());
        node.put("analyses_completed_total", completed.sum());
        node.put("analyses_failed_total", failed.sum());
        node.put("analysis_timeouts_total", timeouts.sum());
        node.put("analysis_duration_ms_total", durationMsTotal.sum());
        node.put("models_parsed_total", modelsParsed.sum());
        node.put("model_rejections_total", modelsRejected.sum());
        ObjectNode operations = node.putObject("completed_by_operation");
        new TreeMap<>(perOperation).forEach((name, adder) -> operations.put(name, adder.sum()));
        return node;
    }
}
