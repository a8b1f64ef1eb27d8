package io.uvlanalyzer.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.uvlanalyzer.core.analysis.FeatureClassifier;
import io.uvlanalyzer.core.analysis.TreeMetrics;
import io.uvlanalyzer.core.encoding.PropositionalEncoder;
import io.uvlanalyzer.core.error.AnalysisEvalException;
import io.uvlanalyzer.core.error.AnalysisTimeoutException;
import io.uvlanalyzer.core.error.InvalidArgumentException;
import io.uvlanalyzer.core.error.ModelLoadException;
import io.uvlanalyzer.core.error.UnknownFeatureException;
import io.uvlanalyzer.core.model.Configuration;
import io.uvlanalyzer.core.model.FeatureModel;
import io.uvlanalyzer.core.parser.ArgumentParser;
import io.uvlanalyzer.core.parser.UvlParser;
import io.uvlanalyzer.core.solver.ConfigurationSpace;
import io.uvlanalyzer.core.solver.Deadline;
import io.uvlanalyzer.core.spi.AnalysisListener;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Query dispatcher: routes each named {@link Operation} to the parser, the configuration space
 * or the structural analyzer, and shapes the result as JSON.
 *
 * <p>
 * Model text is parsed into a {@link ModelSession} once and cached by text in a bounded
 * {@link ModelRegistry}; the session's formula is encoded lazily and shared read-only by every
 * analysis on that model. Each operation runs under its own {@link Deadline} derived from the
 * {@link AnalysisBudget}, opens its own solvers, and either returns a complete result or fails:
 * a timeout never yields a partial value.
 *
 * <p>
 * Results are shaped as follows: feature lists as arrays of names, configurations as objects
 * mapping every feature to its selection state, counts as integers of arbitrary size, and
 * fractional measures rounded to the operation's {@link Operation#decimals() decimals}.
 *
 * <p>
 * Thread-safe. {@link #executeAsync} runs analyses on a fixed worker pool that
 * {@link #close()} shuts down.
 */
public final class AnalysisEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisEngine.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /** Default number of cached model sessions. */
    public static final int DEFAULT_CACHE_CAPACITY = 64;

    private final UvlParser parser = new UvlParser();
    private final PropositionalEncoder encoder = new PropositionalEncoder();
    private final AnalysisBudget budget;
    private final AnalysisListener listener;
    private final ModelRegistry registry;
    private final ExecutorService workers;

    /** Creates an engine with the default budget, no listener and the default cache. */
    public AnalysisEngine() {
        this(AnalysisBudget.DEFAULT, null);
    }

    public AnalysisEngine(AnalysisBudget budget) {
        this(budget, null);
    }

    /**
     * @param budget   per-operation limits
     * @param listener optional lifecycle listener, may be null
     */
    public AnalysisEngine(AnalysisBudget budget, AnalysisListener listener) {
        this(budget, listener, DEFAULT_CACHE_CAPACITY, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Creates an engine with all options.
     *
     * @param budget        per-operation limits
     * @param listener      optional lifecycle listener, may be null
     * @param cacheCapacity maximum number of cached model sessions, {@code 0} disables the cache
     * @param workerThreads size of the pool used by {@link #executeAsync}
     */
    public AnalysisEngine(AnalysisBudget budget, AnalysisListener listener, int cacheCapacity, int workerThreads) {
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
        this.listener = listener; // nullable
        this.registry = new ModelRegistry(cacheCapacity);
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be positive, got: " + workerThreads);
        }
        AtomicInteger threadIndex = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(workerThreads, runnable -> {
            Thread thread = new Thread(runnable, "uvl-analyzer-worker-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public AnalysisBudget budget() {
        return budget;
    }

    /** The session cache, for introspection. */
    public ModelRegistry registry() {
        return registry;
    }

    /**
     * Parses model text into a session, reusing the cached session for identical text.
     *
     * @param content UVL model text
     * @return the session handle
     * @throws ModelLoadException if the text is not a well-formed model
     */
    public ModelSession parse(String content) {
        return registry.getOrCreate(content != null ? content : "", this::createSession);
    }

    private ModelSession createSession(String content) {
        long start = System.nanoTime();
        try {
            FeatureModel model = parser.parse(content);
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            LOG.info(
                    "model.parsed root={} features={} constraints={} duration_ms={}",
                    model.tree().root().name(),
                    model.tree().size(),
                    model.constraints().size(),
                    durationMs);
            notifyModelParsed(model, durationMs);
            return new ModelSession(model, encoder);
        } catch (ModelLoadException e) {
            LOG.info("model.rejected location={} detail={}", e.location(), e.getMessage());
            notifyModelRejected(e);
            throw e;
        }
    }

    /**
     * Runs an operation by wire name.
     *
     * @param operation wire name, e.g. {@code core_features}
     * @param content   UVL model text
     * @param argument  the operation's extra parameter, or {@code null}
     * @throws InvalidArgumentException if the operation is unknown or the argument is malformed
     */
    public AnalysisResult execute(String operation, String content, String argument) {
        Operation resolved = Operation.fromWireName(operation)
                .orElseThrow(() -> new InvalidArgumentException("Unknown operation: '" + operation + "'", operation));
        return execute(resolved, content, argument);
    }

    /**
     * Runs an operation on model text.
     *
     * @throws ModelLoadException      if the model text is malformed
     * @throws AnalysisEvalException   if the argument is invalid, names an unknown feature, or
     *                                 the analysis exceeds its budget
     */
    public AnalysisResult execute(Operation operation, String content, String argument) {
        return run(operation, content, null, argument, Deadline.of(budget.timeoutMs()));
    }

    /** Runs an operation on an already parsed session. */
    public AnalysisResult execute(Operation operation, ModelSession session, String argument) {
        Objects.requireNonNull(session, "session must not be null");
        return run(operation, null, session, argument, Deadline.of(budget.timeoutMs()));
    }

    /**
     * Runs an operation on the worker pool. Cancelling the returned future, or completing it
     * exceptionally (for example through {@link CompletableFuture#orTimeout}), cancels the
     * analysis at its next deadline check.
     */
    public CompletableFuture<AnalysisResult> executeAsync(Operation operation, String content, String argument) {
        Deadline deadline = Deadline.of(budget.timeoutMs());
        CompletableFuture<AnalysisResult> future =
                CompletableFuture.supplyAsync(() -> run(operation, content, null, argument, deadline), workers);
        future.whenComplete((result, error) -> {
            if (error != null) {
                deadline.cancel();
            }
        });
        return future;
    }

    private AnalysisResult run(
            Operation operation, String content, ModelSession session, String argument, Deadline deadline) {
        Objects.requireNonNull(operation, "operation must not be null");
        long start = System.nanoTime();
        notifyStarted(operation);
        try {
            ModelSession target = session != null ? session : parse(content);
            JsonNode value = dispatch(operation, target, argument, deadline);
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            LOG.info(
                    "analysis.completed operation={} features={} duration_ms={}",
                    operation.wireName(),
                    target.tree().size(),
                    durationMs);
            notifyCompleted(operation, durationMs);
            return new AnalysisResult(operation, value, durationMs);
        } catch (ModelLoadException e) {
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            notifyFailed(operation, durationMs, e.urn(), e.getMessage());
            throw e;
        } catch (AnalysisEvalException e) {
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            AnalysisEvalException tagged = withOperation(e, operation);
            LOG.warn(
                    "analysis.failed operation={} urn={} duration_ms={} detail={}",
                    operation.wireName(),
                    tagged.urn(),
                    durationMs,
                    tagged.getMessage());
            notifyFailed(operation, durationMs, tagged.urn(), tagged.getMessage());
            throw tagged;
        }
    }

    private JsonNode dispatch(Operation operation, ModelSession session, String argument, Deadline deadline) {
        String name = operation.wireName();
        TreeMetrics metrics = new TreeMetrics(session.tree());
        return switch (operation) {
            case LEAF_FEATURES -> names(metrics.leafFeatures());
            case COUNT_LEAFS -> NODES.numberNode(metrics.countLeaves());
            case MAX_DEPTH -> NODES.numberNode(metrics.maxDepth());
            case AVERAGE_BRANCHING_FACTOR -> rounded(operation, metrics.averageBranchingFactor());
            case FEATURE_ANCESTORS -> names(metrics.featureAncestors(ArgumentParser.featureName(argument, name)));
            case ESTIMATED_NUMBER_OF_CONFIGURATIONS -> NODES.numberNode(
                    space(session, deadline).estimateConfigurationCount());
            case SATISFIABILITY -> NODES.booleanNode(space(session, deadline).isSatisfiable());
            case SATISFIABLE_CONFIGURATION -> NODES.booleanNode(
                    space(session, deadline).isConfigurationValid(ArgumentParser.selection(argument, name)));
            case CONFIGURATIONS -> configurations(space(session, deadline).allConfigurations());
            case CONFIGURATIONS_NUMBER -> NODES.numberNode(space(session, deadline).countConfigurations());
            case FILTER -> configurations(
                    space(session, deadline).filterConfigurations(ArgumentParser.criteria(argument, name)));
            case SAMPLING -> configurations(space(session, deadline).sampleConfigurations(sampleSize(argument, name)));
            case CORE_FEATURES -> names(classifier(session, deadline).coreFeatures());
            case DEAD_FEATURES -> names(classifier(session, deadline).deadFeatures());
            case VARIANT_FEATURES -> names(classifier(session, deadline).variantFeatures());
            case FALSE_OPTIONAL_FEATURES -> names(classifier(session, deadline).falseOptionalFeatures());
            case UNIQUE_FEATURES -> names(classifier(session, deadline).uniqueFeatures());
            case ATOMIC_SETS -> MAPPER.valueToTree(classifier(session, deadline).atomicSets());
            case COMMONALITY -> rounded(
                    operation, classifier(session, deadline).commonality(ArgumentParser.featureName(argument, name)));
            case FEATURE_INCLUSION_PROBABILITY -> {
                ObjectNode probabilities = NODES.objectNode();
                for (Map.Entry<String, Double> entry : classifier(session, deadline)
                        .featureInclusionProbabilities()
                        .entrySet()) {
                    probabilities.set(entry.getKey(), rounded(operation, entry.getValue()));
                }
                yield probabilities;
            }
            case HOMOGENEITY -> rounded(operation, classifier(session, deadline).homogeneity());
            case VARIABILITY -> rounded(operation, classifier(session, deadline).variability());
        };
    }

    private ConfigurationSpace space(ModelSession session, Deadline deadline) {
        return new ConfigurationSpace(session.model(), session.formula(), deadline, budget.samplingSeed());
    }

    private FeatureClassifier classifier(ModelSession session, Deadline deadline) {
        return new FeatureClassifier(space(session, deadline));
    }

    private int sampleSize(String argument, String operation) {
        if (argument == null || argument.isBlank()) {
            return budget.defaultSampleSize();
        }
        return ArgumentParser.sampleCount(argument, operation);
    }

    // --- Result shaping ---

    private static ArrayNode names(Collection<String> names) {
        ArrayNode array = NODES.arrayNode();
        names.forEach(array::add);
        return array;
    }

    private static ArrayNode configurations(Iterable<Configuration> configurations) {
        ArrayNode array = NODES.arrayNode();
        for (Configuration configuration : configurations) {
            ObjectNode node = array.addObject();
            configuration.assignment().forEach(node::put);
        }
        return array;
    }

    private static JsonNode rounded(Operation operation, double value) {
        if (operation.decimals() < 0) {
            return NODES.numberNode(value);
        }
        return NODES.numberNode(BigDecimal.valueOf(value)
                .setScale(operation.decimals(), RoundingMode.HALF_EVEN)
                .doubleValue());
    }

    private static AnalysisEvalException withOperation(AnalysisEvalException e, Operation operation) {
        if (e.operation() != null) {
            return e;
        }
        String name = operation.wireName();
        if (e instanceof UnknownFeatureException unknown) {
            return new UnknownFeatureException(unknown.featureName(), name);
        }
        if (e instanceof AnalysisTimeoutException timeout) {
            return new AnalysisTimeoutException(timeout.getMessage(), timeout, timeout.budgetMs(), name);
        }
        if (e instanceof InvalidArgumentException) {
            return new InvalidArgumentException(e.getMessage(), e, name);
        }
        return e;
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they never change the analysis outcome.

    private void notifyStarted(Operation operation) {
        if (listener == null) return;
        try {
            listener.onAnalysisStarted(new AnalysisListener.AnalysisStartedEvent(operation.wireName()));
        } catch (Exception e) {
            LOG.warn("AnalysisListener.onAnalysisStarted failed", e);
        }
    }

    private void notifyCompleted(Operation operation, long durationMs) {
        if (listener == null) return;
        try {
            listener.onAnalysisCompleted(new AnalysisListener.AnalysisCompletedEvent(operation.wireName(), durationMs));
        } catch (Exception e) {
            LOG.warn("AnalysisListener.onAnalysisCompleted failed", e);
        }
    }

    private void notifyFailed(Operation operation, long durationMs, String urn, String detail) {
        if (listener == null) return;
        try {
            listener.onAnalysisFailed(
                    new AnalysisListener.AnalysisFailedEvent(operation.wireName(), durationMs, urn, detail));
        } catch (Exception e) {
            LOG.warn("AnalysisListener.onAnalysisFailed failed", e);
        }
    }

    private void notifyModelParsed(FeatureModel model, long durationMs) {
        if (listener == null) return;
        try {
            listener.onModelParsed(new AnalysisListener.ModelParsedEvent(
                    model.tree().root().name(), model.tree().size(), model.constraints().size(), durationMs));
        } catch (Exception e) {
            LOG.warn("AnalysisListener.onModelParsed failed", e);
        }
    }

    private void notifyModelRejected(ModelLoadException cause) {
        if (listener == null) return;
        try {
            listener.onModelRejected(new AnalysisListener.ModelRejectedEvent(cause.location(), cause.getMessage()));
        } catch (Exception e) {
            LOG.warn("AnalysisListener.onModelRejected failed", e);
        }
    }
}
