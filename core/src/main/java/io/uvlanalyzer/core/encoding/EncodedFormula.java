package io.uvlanalyzer.core.encoding;

import io.uvlanalyzer.core.model.Expression;
import java.util.Objects;

/**
 * The validity formula of a model in two forms: the {@link Expression} conjunction, used to
 * check a given configuration directly, and its {@link Cnf}, consumed by the solvers. Both are
 * over the same feature variables ({@link VariableMap}). Immutable and safe to share across
 * concurrent analyses.
 */
public final class EncodedFormula {

    private final Expression expression;
    private final Cnf cnf;
    private final VariableMap variables;

    public EncodedFormula(Expression expression, Cnf cnf, VariableMap variables) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.cnf = Objects.requireNonNull(cnf, "cnf must not be null");
        this.variables = Objects.requireNonNull(variables, "variables must not be null");
        if (cnf.featureCount() != variables.size()) {
            throw new IllegalStateException(
                    "cnf declares " + cnf.featureCount() + " feature variables but the map has " + variables.size());
        }
    }

    public Expression expression() {
        return expression;
    }

    public Cnf cnf() {
        return cnf;
    }

    public VariableMap variables() {
        return variables;
    }

    @Override
    public String toString() {
        return "EncodedFormula[" + cnf + "]";
    }
}
