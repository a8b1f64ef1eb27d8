package io.uvlanalyzer.core.analysis;

import io.uvlanalyzer.core.encoding.VariableMap;
import io.uvlanalyzer.core.model.Feature;
import io.uvlanalyzer.core.model.FeatureTree;
import io.uvlanalyzer.core.model.GroupKind;
import io.uvlanalyzer.core.solver.ConfigurationSpace;
import io.uvlanalyzer.core.solver.ModelCounter;
import io.uvlanalyzer.core.solver.SatSolver;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Semantic classification of features: core, dead, variant, false-optional, atomic sets and the
 * commonality-based measures.
 *
 * <p>
 * Core and dead detection start from one witness configuration: a feature selected in it can
 * only be core, an unselected one only dead. Each remaining candidate costs one solver call
 * under a single assumption, and every model found along the way discards further candidates.
 * The models are kept as witnesses for atomic-set detection, which groups features by their
 * values across all witnesses and then proves each candidate equivalence with two
 * unsatisfiability checks.
 *
 * <p>
 * An unsatisfiable model has no core, variant, false-optional or unique features and no atomic
 * sets; every feature is dead and every ratio is {@code 0.0}.
 *
 * <p>
 * One instance serves one analysis run and memoises intermediate results. Not thread-safe.
 */
public final class FeatureClassifier {

    private final ConfigurationSpace space;
    private final FeatureTree tree;
    private final VariableMap variables;
    private final int size;
    private final List<boolean[]> witnesses = new ArrayList<>();

    private SatSolver solver;
    private Boolean satisfiable;
    private BitSet core;
    private BitSet dead;
    private ModelCounter counter;
    private BigInteger total;

    public FeatureClassifier(ConfigurationSpace space) {
        this.space = Objects.requireNonNull(space, "space must not be null");
        this.tree = space.model().tree();
        this.variables = space.formula().variables();
        this.size = variables.size();
    }

    /** Features selected in every valid configuration, in declaration order. */
    public List<String> coreFeatures() {
        classify();
        return names(core);
    }

    /** Features selected in no valid configuration, in declaration order. */
    public List<String> deadFeatures() {
        classify();
        return names(dead);
    }

    /** Features that are neither core nor dead, in declaration order. */
    public List<String> variantFeatures() {
        classify();
        BitSet variant = new BitSet();
        variant.set(1, size + 1);
        variant.andNot(core);
        variant.andNot(dead);
        return names(variant);
    }

    /** Core features that the tree declares in an {@code optional} group. */
    public List<String> falseOptionalFeatures() {
        classify();
        List<String> result = new ArrayList<>();
        for (Feature feature : tree.features()) {
            if (feature.declaredIn() == GroupKind.OPTIONAL && core.get(variables.variable(feature.name()))) {
                result.add(feature.name());
            }
        }
        return result;
    }

    /**
     * Maximal sets of features that are selected together in every valid configuration. Sets are
     * ordered by their first member and members by declaration order.
     */
    public List<List<String>> atomicSets() {
        classify();
        if (!isSatisfiable()) {
            return List.of();
        }
        Map<String, List<List<String>>> bySignature = new LinkedHashMap<>();
        for (String name : tree.names()) {
            int variable = variables.variable(name);
            List<List<String>> sets = bySignature.computeIfAbsent(signature(variable), key -> new ArrayList<>());
            List<String> home = null;
            for (List<String> set : sets) {
                if (equivalent(variables.variable(set.get(0)), variable)) {
                    home = set;
                    break;
                }
            }
            if (home == null) {
                home = new ArrayList<>();
                sets.add(home);
            }
            home.add(name);
        }

        List<String> order = tree.names();
        List<List<String>> result = new ArrayList<>();
        bySignature.values().forEach(result::addAll);
        result.sort(Comparator.comparingInt(set -> order.indexOf(set.get(0))));
        return result.stream().map(List::copyOf).toList();
    }

    /** Features that form an atomic set on their own. */
    public List<String> uniqueFeatures() {
        List<String> unique = new ArrayList<>();
        for (List<String> set : atomicSets()) {
            if (set.size() == 1) {
                unique.add(set.get(0));
            }
        }
        return unique;
    }

    /**
     * Fraction of valid configurations that select the feature.
     *
     * @throws io.uvlanalyzer.core.error.UnknownFeatureException if the model has no such feature
     */
    public double commonality(String name) {
        int variable = space.variableOf(name);
        BigInteger all = total();
        if (all.signum() == 0) {
            return 0.0;
        }
        return ratio(counter().count(variable), all);
    }

    /** Commonality of every feature, in declaration order. */
    public Map<String, Double> featureInclusionProbabilities() {
        Map<String, Double> probabilities = new LinkedHashMap<>();
        BigInteger all = total();
        if (all.signum() != 0) {
            classify();
        }
        for (String name : tree.names()) {
            int variable = variables.variable(name);
            double probability;
            if (all.signum() == 0 || dead.get(variable)) {
                probability = 0.0;
            } else if (core.get(variable)) {
                probability = 1.0;
            } else {
                probability = ratio(counter().count(variable), all);
            }
            probabilities.put(name, probability);
        }
        return probabilities;
    }

    /**
     * Mean, over all unordered feature pairs, of the fraction of valid configurations in which
     * both features have the same selection status. {@code 1.0} when the model has fewer than two
     * features.
     */
    public double homogeneity() {
        BigInteger all = total();
        if (all.signum() == 0) {
            return 0.0;
        }
        if (size < 2) {
            return 1.0;
        }
        classify();
        BigInteger[] selected = new BigInteger[size + 1];
        for (int variable = 1; variable <= size; variable++) {
            selected[variable] = core.get(variable)
                    ? all
                    : dead.get(variable) ? BigInteger.ZERO : counter().count(variable);
        }

        BigInteger agreeing = BigInteger.ZERO;
        for (int i = 1; i <= size; i++) {
            for (int j = i + 1; j <= size; j++) {
                space.deadline().check();
                BigInteger both = selectedTogether(i, j, selected);
                // both selected, plus neither selected (all - c(i) - c(j) + c(i & j))
                BigInteger equal = all.subtract(selected[i]).subtract(selected[j]).add(both.shiftLeft(1));
                agreeing = agreeing.add(equal);
            }
        }
        long pairs = (long) size * (size - 1) / 2;
        return ratio(agreeing, all.multiply(BigInteger.valueOf(pairs)));
    }

    /** Share of features that are variant; {@code 0.0} for an unsatisfiable model. */
    public double variability() {
        return (double) variantFeatures().size() / size;
    }

    // --- Core / dead ---

    private boolean isSatisfiable() {
        if (satisfiable == null) {
            satisfiable = solver().isSatisfiable();
            if (satisfiable) {
                witnesses.add(snapshot());
            }
        }
        return satisfiable;
    }

    private void classify() {
        if (core != null) {
            return;
        }
        BitSet coreFound = new BitSet();
        BitSet deadFound = new BitSet();
        if (!isSatisfiable()) {
            deadFound.set(1, size + 1);
            core = coreFound;
            dead = deadFound;
            return;
        }
        boolean[] first = witnesses.get(0);
        BitSet coreCandidates = new BitSet();
        BitSet deadCandidates = new BitSet();
        for (int variable = 1; variable <= size; variable++) {
            (first[variable] ? coreCandidates : deadCandidates).set(variable);
        }
        for (int variable = coreCandidates.nextSetBit(0); variable >= 0;
                variable = coreCandidates.nextSetBit(variable + 1)) {
            if (solver().isSatisfiable(-variable)) {
                refine(coreCandidates, deadCandidates);
            } else {
                coreFound.set(variable);
            }
        }
        for (int variable = deadCandidates.nextSetBit(0); variable >= 0;
                variable = deadCandidates.nextSetBit(variable + 1)) {
            if (solver().isSatisfiable(variable)) {
                refine(coreCandidates, deadCandidates);
            } else {
                deadFound.set(variable);
            }
        }
        core = coreFound;
        dead = deadFound;
    }

    /** Records the solver's current model and drops the candidates it refutes. */
    private void refine(BitSet coreCandidates, BitSet deadCandidates) {
        boolean[] model = snapshot();
        witnesses.add(model);
        for (int variable = 1; variable <= size; variable++) {
            if (model[variable]) {
                deadCandidates.clear(variable);
            } else {
                coreCandidates.clear(variable);
            }
        }
    }

    // --- Atomic sets ---

    private String signature(int variable) {
        StringBuilder bits = new StringBuilder(witnesses.size());
        for (boolean[] witness : witnesses) {
            bits.append(witness[variable] ? '1' : '0');
        }
        return bits.toString();
    }

    /** Returns {@code true} if {@code a <=> b} holds in every valid configuration. */
    private boolean equivalent(int a, int b) {
        if (core.get(a) || dead.get(a) || core.get(b) || dead.get(b)) {
            return (core.get(a) && core.get(b)) || (dead.get(a) && dead.get(b));
        }
        return !solver().isSatisfiable(a, -b) && !solver().isSatisfiable(-a, b);
    }

    // --- Counting ---

    private BigInteger selectedTogether(int i, int j, BigInteger[] selected) {
        if (dead.get(i) || dead.get(j)) {
            return BigInteger.ZERO;
        }
        if (core.get(i)) {
            return selected[j];
        }
        if (core.get(j)) {
            return selected[i];
        }
        return counter().count(i, j);
    }

    private BigInteger total() {
        if (total == null) {
            total = counter().count();
        }
        return total;
    }

    private ModelCounter counter() {
        if (counter == null) {
            counter = new ModelCounter(space.formula().cnf(), space.deadline());
        }
        return counter;
    }

    private static double ratio(BigInteger numerator, BigInteger denominator) {
        return new BigDecimal(numerator).divide(new BigDecimal(denominator), MathContext.DECIMAL64).doubleValue();
    }

    // --- Helpers ---

    private SatSolver solver() {
        if (solver == null) {
            solver = space.openSolver();
        }
        return solver;
    }

    private boolean[] snapshot() {
        boolean[] values = new boolean[size + 1];
        for (int variable = 1; variable <= size; variable++) {
            values[variable] = solver.isTrue(variable);
        }
        return values;
    }

    private List<String> names(BitSet selected) {
        List<String> result = new ArrayList<>();
        for (String name : tree.names()) {
            if (selected.get(variables.variable(name))) {
                result.add(name);
            }
        }
        return result;
    }
}
