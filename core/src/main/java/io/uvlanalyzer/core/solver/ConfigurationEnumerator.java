package io.uvlanalyzer.core.solver;

import io.uvlanalyzer.core.encoding.EncodedFormula;
import io.uvlanalyzer.core.encoding.VariableMap;
import io.uvlanalyzer.core.model.Configuration;
import io.uvlanalyzer.core.model.FeatureTree;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.IntPredicate;

/**
 * Lazy enumeration of every valid configuration.
 *
 * <p>
 * Depth-first over the feature variables in variable order, trying <em>selected</em> before
 * <em>unselected</em> at each level. Every partial assignment is checked with a solver call
 * under assumptions before the search descends, so no branch without a solution is ever
 * expanded and each configuration costs at most one call per feature. The last model found
 * satisfies the current prefix; a branch that agrees with it needs no new call.
 *
 * <p>
 * Each {@link #iterator()} opens a fresh solver and starts over, so iteration is restartable
 * and always yields the same order.
 */
final class ConfigurationEnumerator implements Iterable<Configuration> {

    private final FeatureTree tree;
    private final EncodedFormula formula;
    private final int[] units;
    private final Deadline deadline;

    /**
     * @param units literals every enumerated configuration must satisfy, may be empty
     */
    ConfigurationEnumerator(FeatureTree tree, EncodedFormula formula, int[] units, Deadline deadline) {
        this.tree = tree;
        this.formula = formula;
        this.units = units.clone();
        this.deadline = deadline;
    }

    @Override
    public Iterator<Configuration> iterator() {
        return new DepthFirstIterator(new SatSolver(formula.cnf(), units, deadline));
    }

    /** Builds a configuration in declaration order from per-variable values. */
    static Configuration configuration(FeatureTree tree, VariableMap variables, IntPredicate selected) {
        Map<String, Boolean> assignment = new LinkedHashMap<>();
        for (String name : tree.names()) {
            assignment.put(name, selected.test(variables.variable(name)));
        }
        return new Configuration(assignment);
    }

    private final class DepthFirstIterator implements Iterator<Configuration> {

        private static final int UNTRIED = 0;
        private static final int SELECTED = 1;
        private static final int BOTH = 2;

        private final SatSolver solver;
        private final int size;
        private final int[] assumptions;
        private final int[] state;
        /** Values of a model satisfying {@code assumptions[0..depth)}, or {@code null}. */
        private boolean[] witness;
        private int depth;
        private boolean exhausted;
        private Configuration next;

        private DepthFirstIterator(SatSolver solver) {
            this.solver = solver;
            this.size = solver.featureCount();
            this.assumptions = new int[size];
            this.state = new int[size];
        }

        @Override
        public boolean hasNext() {
            if (next == null && !exhausted) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public Configuration next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Configuration current = next;
            next = null;
            return current;
        }

        private Configuration advance() {
            while (true) {
                deadline.check();
                if (depth == size) {
                    int[] chosen = assumptions.clone();
                    depth--;
                    return configuration(tree, formula.variables(), variable -> chosen[variable - 1] > 0);
                }
                int variable = depth + 1;
                int literal;
                if (state[depth] == UNTRIED) {
                    state[depth] = SELECTED;
                    literal = variable;
                } else if (state[depth] == SELECTED) {
                    state[depth] = BOTH;
                    literal = -variable;
                } else {
                    state[depth] = UNTRIED;
                    depth--;
                    if (depth < 0) {
                        exhausted = true;
                        return null;
                    }
                    continue;
                }
                assumptions[depth] = literal;
                if (witness != null && witness[variable] == (literal > 0)) {
                    depth++;
                } else if (solver.isSatisfiable(assumptions, depth + 1)) {
                    witness = snapshot();
                    depth++;
                }
            }
        }

        private boolean[] snapshot() {
            boolean[] values = new boolean[size + 1];
            for (int variable = 1; variable <= size; variable++) {
                values[variable] = solver.isTrue(variable);
            }
            return values;
        }
    }
}
