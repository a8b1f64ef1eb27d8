package io.uvlanalyzer.core.encoding;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable clause set in DIMACS convention: variables are {@code 1..variableCount}, a literal
 * is a signed variable, and an empty clause is unsatisfiable. The first
 * {@code featureCount} variables are feature variables; the rest are auxiliary.
 *
 * <p>
 * A literal outside the declared range is rejected with {@link IllegalStateException}: such a
 * clause can only come from a broken encoder and must never reach a solver.
 */
public final class Cnf {

    private final int featureCount;
    private final int variableCount;
    private final List<int[]> clauses;

    public Cnf(int featureCount, int variableCount, List<int[]> clauses) {
        if (featureCount < 1 || variableCount < featureCount) {
            throw new IllegalStateException(
                    "invalid variable counts: features=" + featureCount + ", variables=" + variableCount);
        }
        List<int[]> copy = new ArrayList<>(clauses.size());
        for (int[] clause : clauses) {
            for (int literal : clause) {
                if (literal == 0 || Math.abs(literal) > variableCount) {
                    throw new IllegalStateException(
                            "clause " + Arrays.toString(clause) + " references undeclared variable " + Math.abs(literal)
                                    + " (declared: " + variableCount + ")");
                }
            }
            copy.add(clause.clone());
        }
        this.featureCount = featureCount;
        this.variableCount = variableCount;
        this.clauses = Collections.unmodifiableList(copy);
    }

    public int featureCount() {
        return featureCount;
    }

    public int variableCount() {
        return variableCount;
    }

    public int clauseCount() {
        return clauses.size();
    }

    /** A copy of the i-th clause. */
    public int[] clause(int index) {
        return clauses.get(index).clone();
    }

    /** Returns {@code true} if some clause is empty, making the set trivially unsatisfiable. */
    public boolean hasEmptyClause() {
        for (int[] clause : clauses) {
            if (clause.length == 0) {
                return true;
            }
        }
        return false;
    }

    /** Copies of all clauses, in encoding order. */
    public List<int[]> clauses() {
        List<int[]> copy = new ArrayList<>(clauses.size());
        for (int[] clause : clauses) {
            copy.add(clause.clone());
        }
        return copy;
    }

    @Override
    public String toString() {
        return "Cnf[features=" + featureCount + ", variables=" + variableCount + ", clauses=" + clauses.size() + "]";
    }
}
