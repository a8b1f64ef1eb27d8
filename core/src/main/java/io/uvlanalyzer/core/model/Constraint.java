package io.uvlanalyzer.core.model;

import java.util.Objects;

/**
 * A cross-tree constraint read from the {@code constraints} section. The position in the
 * constraint set only matters for error reporting.
 *
 * @param expression parsed formula over feature names
 * @param source     constraint text as written, trimmed
 * @param line       1-based source line
 */
public record Constraint(Expression expression, String source, int line) {

    public Constraint {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }
}
