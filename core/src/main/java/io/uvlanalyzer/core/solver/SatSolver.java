package io.uvlanalyzer.core.solver;

import io.uvlanalyzer.core.encoding.Cnf;
import org.sat4j.core.VecInt;
import org.sat4j.minisat.SolverFactory;
import org.sat4j.specs.ContradictionException;
import org.sat4j.specs.ISolver;
import org.sat4j.specs.TimeoutException;

/**
 * One Sat4j solver loaded with a {@link Cnf}. Each analysis opens its own instance from the
 * shared, immutable clause set, so solvers are never shared between threads.
 *
 * <p>
 * A contradiction found while loading clauses (conflicting units, an empty clause) marks the
 * solver unsatisfiable instead of failing: an unsatisfiable model is a valid result. Every
 * decision call is bounded by the {@link Deadline}; a Sat4j timeout surfaces as
 * {@link io.uvlanalyzer.core.error.AnalysisTimeoutException}.
 *
 * <p>
 * Not thread-safe.
 */
public final class SatSolver {

    static final long MAX_SOLVER_TIMEOUT_MS = Integer.MAX_VALUE;

    private final ISolver solver;
    private final Deadline deadline;
    private final int featureCount;
    private final int variableCount;
    private boolean contradiction;
    private boolean[] model;

    /**
     * @param cnf      clauses to load
     * @param units    extra unit literals conjoined with the clauses, may be empty
     * @param deadline budget for every decision call
     */
    public SatSolver(Cnf cnf, int[] units, Deadline deadline) {
        this.deadline = deadline;
        this.featureCount = cnf.featureCount();
        this.variableCount = cnf.variableCount();
        this.solver = SolverFactory.newDefault();
        solver.newVar(cnf.variableCount());
        solver.setExpectedNumberOfClauses(cnf.clauseCount() + units.length);
        if (cnf.hasEmptyClause()) {
            contradiction = true;
            return;
        }
        for (int i = 0; i < cnf.clauseCount() && !contradiction; i++) {
            addClause(cnf.clause(i));
        }
        for (int unit : units) {
            if (contradiction) {
                break;
            }
            if (unit == 0 || Math.abs(unit) > cnf.variableCount()) {
                throw new IllegalStateException("unit literal " + unit + " is outside the declared variables");
            }
            addClause(new int[] {unit});
        }
    }

    public SatSolver(Cnf cnf, Deadline deadline) {
        this(cnf, new int[0], deadline);
    }

    /** Number of feature variables; they occupy {@code 1..featureCount()}. */
    public int featureCount() {
        return featureCount;
    }

    /**
     * Adds a clause permanently, for example to block a configuration already found.
     *
     * @param clause non-empty clause over declared variables
     */
    public void addClause(int[] clause) {
        if (contradiction) {
            return;
        }
        try {
            solver.addClause(new VecInt(clause));
        } catch (ContradictionException e) {
            contradiction = true;
        }
    }

    /** Decides satisfiability with no assumptions. */
    public boolean isSatisfiable() {
        return isSatisfiable(new int[0], 0);
    }

    /** Decides satisfiability under the given assumption literals. */
    public boolean isSatisfiable(int... assumptions) {
        return isSatisfiable(assumptions, assumptions.length);
    }

    /**
     * Decides satisfiability under the first {@code length} assumption literals. On success the
     * model is available through {@link #isTrue(int)} and {@link #model()} until the next call.
     */
    public boolean isSatisfiable(int[] assumptions, int length) {
        model = null;
        if (contradiction) {
            return false;
        }
        deadline.check();
        // Sat4j schedules a java.util.Timer, which rejects delays near Long.MAX_VALUE.
        long remaining = Math.min(MAX_SOLVER_TIMEOUT_MS, Math.max(1, deadline.remainingMillis()));
        solver.setTimeoutMs(remaining);
        VecInt assumed = new VecInt(length);
        for (int i = 0; i < length; i++) {
            assumed.push(assumptions[i]);
        }
        Runnable unregister = deadline.onCancel(solver::expireTimeout);
        try {
            deadline.check();
            if (solver.isSatisfiable(assumed)) {
                boolean[] values = new boolean[variableCount + 1];
                for (int variable = 1; variable <= variableCount; variable++) {
                    values[variable] = solver.model(variable);
                }
                model = values;
                return true;
            }
            return false;
        } catch (TimeoutException e) {
            throw deadline.timeout(e);
        } finally {
            unregister.run();
        }
    }

    /**
     * Value of a variable in the last model.
     *
     * @throws IllegalStateException if the last call did not find a model
     */
    public boolean isTrue(int variable) {
        if (model == null) {
            throw new IllegalStateException("no model available");
        }
        return model[variable];
    }

    /** The last model as signed literals, one per variable. */
    public int[] model() {
        if (model == null) {
            throw new IllegalStateException("no model available");
        }
        int[] literals = new int[variableCount];
        for (int variable = 1; variable <= variableCount; variable++) {
            literals[variable - 1] = model[variable] ? variable : -variable;
        }
        return literals;
    }

    /** Returns {@code true} if the loaded clauses are already known to be contradictory. */
    public boolean isContradictory() {
        return contradiction;
    }
}
