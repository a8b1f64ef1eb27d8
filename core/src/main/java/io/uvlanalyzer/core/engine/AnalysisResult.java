package io.uvlanalyzer.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Outcome of one dispatched operation: the JSON-shaped value plus timing.
 *
 * @param operation  the operation that ran
 * @param value      result value (array, number, boolean or object)
 * @param durationMs wall-clock duration including parsing when the model was not cached
 */
public record AnalysisResult(Operation operation, JsonNode value, long durationMs) {

    public AnalysisResult {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }
}
