package io.uvlanalyzer.core.solver;

import io.uvlanalyzer.core.encoding.EncodedFormula;
import io.uvlanalyzer.core.model.Configuration;
import io.uvlanalyzer.core.model.FeatureTree;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Draws distinct valid configurations. For each sample the feature variables are fixed one by
 * one in variable order; a seeded coin picks the value tried first and the solver confirms it
 * can still be extended, falling back to the opposite value otherwise. A blocking clause then
 * rules the configuration out, so samples never repeat and the loop ends once the space is
 * exhausted. The same seed always yields the same samples.
 */
final class ConfigurationSampler {

    private final FeatureTree tree;
    private final EncodedFormula formula;
    private final Deadline deadline;
    private final long seed;

    ConfigurationSampler(FeatureTree tree, EncodedFormula formula, Deadline deadline, long seed) {
        this.tree = tree;
        this.formula = formula;
        this.deadline = deadline;
        this.seed = seed;
    }

    List<Configuration> sample(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1, got: " + count);
        }
        SatSolver solver = new SatSolver(formula.cnf(), deadline);
        Random random = new Random(seed);
        int size = solver.featureCount();
        List<Configuration> samples = new ArrayList<>();

        while (samples.size() < count && solver.isSatisfiable()) {
            boolean[] witness = values(solver, size);
            int[] chosen = new int[size];
            for (int variable = 1; variable <= size; variable++) {
                deadline.check();
                boolean preferred = random.nextBoolean();
                int literal = preferred ? variable : -variable;
                if (witness[variable] == preferred) {
                    chosen[variable - 1] = literal;
                    continue;
                }
                chosen[variable - 1] = literal;
                if (solver.isSatisfiable(chosen, variable)) {
                    witness = values(solver, size);
                } else {
                    // the witness already proves the opposite value extends the prefix
                    chosen[variable - 1] = -literal;
                }
            }
            samples.add(ConfigurationEnumerator.configuration(
                    tree, formula.variables(), variable -> chosen[variable - 1] > 0));

            int[] blocking = new int[size];
            for (int i = 0; i < size; i++) {
                blocking[i] = -chosen[i];
            }
            solver.addClause(blocking);
        }
        return samples;
    }

    private static boolean[] values(SatSolver solver, int size) {
        boolean[] values = new boolean[size + 1];
        for (int variable = 1; variable <= size; variable++) {
            values[variable] = solver.isTrue(variable);
        }
        return values;
    }
}
