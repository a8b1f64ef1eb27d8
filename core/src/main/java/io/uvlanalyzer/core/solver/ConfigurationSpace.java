package io.uvlanalyzer.core.solver;

import io.uvlanalyzer.core.encoding.EncodedFormula;
import io.uvlanalyzer.core.encoding.VariableMap;
import io.uvlanalyzer.core.model.Configuration;
import io.uvlanalyzer.core.model.Feature;
import io.uvlanalyzer.core.model.FeatureModel;
import io.uvlanalyzer.core.model.FeatureTree;
import io.uvlanalyzer.core.model.SelectionCriteria;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The set of valid configurations of one model, answering satisfiability, validity, counting,
 * enumeration, sampling and filtering questions against its {@link EncodedFormula}.
 *
 * <p>
 * Instances are cheap views: every call opens its own solver from the shared immutable clause
 * set and is bounded by the {@link Deadline} given at construction. A
 * {@link io.uvlanalyzer.core.error.AnalysisTimeoutException} aborts the call; no partial
 * result is ever returned.
 */
public final class ConfigurationSpace {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationSpace.class);

    private final FeatureModel model;
    private final EncodedFormula formula;
    private final Deadline deadline;
    private final long samplingSeed;

    public ConfigurationSpace(FeatureModel model, EncodedFormula formula, Deadline deadline, long samplingSeed) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.formula = Objects.requireNonNull(formula, "formula must not be null");
        this.deadline = Objects.requireNonNull(deadline, "deadline must not be null");
        this.samplingSeed = samplingSeed;
    }

    public FeatureModel model() {
        return model;
    }

    public EncodedFormula formula() {
        return formula;
    }

    public Deadline deadline() {
        return deadline;
    }

    /** Opens a fresh solver over the formula, for analyses that issue their own queries. */
    public SatSolver openSolver() {
        return new SatSolver(formula.cnf(), deadline);
    }

    /** Returns {@code true} if at least one valid configuration exists. */
    public boolean isSatisfiable() {
        return openSolver().isSatisfiable();
    }

    /**
     * Checks a selection. Features the selection does not mention are unselected.
     *
     * @param selection selected feature names
     * @return {@code true} if the completed assignment is a valid configuration
     * @throws io.uvlanalyzer.core.error.UnknownFeatureException if a name is not in the model
     */
    public boolean isConfigurationValid(Set<String> selection) {
        FeatureTree tree = model.tree();
        Set<String> selected = new HashSet<>();
        for (String name : selection) {
            selected.add(tree.requireFeature(name).name());
        }
        return formula.expression().evaluate(selected::contains);
    }

    /**
     * All valid configurations as a lazy, restartable sequence in a fixed order: variable order,
     * selected before unselected.
     */
    public Iterable<Configuration> allConfigurations() {
        return new ConfigurationEnumerator(model.tree(), formula, new int[0], deadline);
    }

    /** Exact number of valid configurations. */
    public BigInteger countConfigurations() {
        BigInteger count = new ModelCounter(formula.cnf(), deadline).count();
        LOG.debug("Counted {} configurations in {} ms", count, deadline.elapsedMillis());
        return count;
    }

    /** Upper bound from the group structure alone, ignoring cross-tree constraints. */
    public BigInteger estimateConfigurationCount() {
        return ConfigurationEstimator.estimate(model.tree());
    }

    /**
     * Up to {@code count} distinct valid configurations, all of them when fewer exist and none
     * for an unsatisfiable model.
     *
     * @param count requested number of samples, at least 1
     */
    public List<Configuration> sampleConfigurations(int count) {
        return new ConfigurationSampler(model.tree(), formula, deadline, samplingSeed).sample(count);
    }

    /**
     * Valid configurations consistent with a partial selection, in enumeration order.
     *
     * @throws io.uvlanalyzer.core.error.UnknownFeatureException if the criteria name an unknown
     *         feature
     */
    public Iterable<Configuration> filterConfigurations(SelectionCriteria criteria) {
        FeatureTree tree = model.tree();
        VariableMap variables = formula.variables();
        List<Integer> units = new ArrayList<>();
        for (String name : criteria.selected()) {
            units.add(variables.variable(tree.requireFeature(name).name()));
        }
        for (String name : criteria.deselected()) {
            units.add(-variables.variable(tree.requireFeature(name).name()));
        }
        return new ConfigurationEnumerator(
                tree, formula, units.stream().mapToInt(Integer::intValue).toArray(), deadline);
    }

    /** Variable of a feature, resolving the bare spelling of quoted names. */
    public int variableOf(String name) {
        Feature feature = model.tree().requireFeature(name);
        return formula.variables().variable(feature.name());
    }
}
