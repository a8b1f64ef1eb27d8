package io.uvlanalyzer.core.engine;

import java.util.Optional;

/**
 * The named analyses the engine dispatches, with their wire names, the kind of extra parameter
 * each one takes and the number of decimals a fractional result is rounded to.
 */
public enum Operation {
    CONFIGURATIONS("configurations", Parameter.NONE, "Generates all possible valid configurations from the feature model."),
    CONFIGURATIONS_NUMBER(
            "configurations_number", Parameter.NONE, "Returns the total number of valid configurations for the feature model."),
    ESTIMATED_NUMBER_OF_CONFIGURATIONS(
            "estimated_number_of_configurations",
            Parameter.NONE,
            "Estimates the total number of configurations from the group structure, ignoring constraints."),
    CORE_FEATURES("core_features", Parameter.NONE, "Identifies features that are present in all valid configurations."),
    DEAD_FEATURES(
            "dead_features",
            Parameter.NONE,
            "Identifies features that cannot be included in any valid configuration, often indicating model errors."),
    FALSE_OPTIONAL_FEATURES(
            "false_optional_features",
            Parameter.NONE,
            "Identifies features that are declared optional but are selected in every valid configuration."),
    LEAF_FEATURES("leaf_features", Parameter.NONE, "Identifies all leaf features in the model (features with no children)."),
    COUNT_LEAFS("count_leafs", Parameter.NONE, "Counts the number of leaf features in the model."),
    FEATURE_ANCESTORS(
            "feature_ancestors", Parameter.FEATURE, "Returns the ancestors of a feature, from its parent up to the root."),
    ATOMIC_SETS(
            "atomic_sets",
            Parameter.NONE,
            "Identifies atomic sets: groups of features that always appear together in valid configurations."),
    AVERAGE_BRANCHING_FACTOR(
            "average_branching_factor",
            Parameter.NONE,
            2,
            "Calculates the average number of children per parent feature."),
    MAX_DEPTH("max_depth", Parameter.NONE, "Finds the length of the longest path from the root to a leaf."),
    SATISFIABILITY("satisfiability", Parameter.NONE, "Checks whether the model admits at least one valid configuration."),
    SATISFIABLE_CONFIGURATION(
            "satisfiable_configuration",
            Parameter.SELECTION,
            "Checks whether a set of selected features forms a valid configuration."),
    COMMONALITY(
            "commonality",
            Parameter.FEATURE,
            2,
            "Measures the fraction of valid configurations that include a feature."),
    FEATURE_INCLUSION_PROBABILITY(
            "feature_inclusion_probability",
            Parameter.NONE,
            4,
            "Calculates the probability of each feature being included in a random valid configuration."),
    HOMOGENEITY(
            "homogeneity",
            Parameter.NONE,
            4,
            "Measures how similar valid configurations are; values close to 1 mean very similar configurations."),
    FILTER("filter", Parameter.CRITERIA, "Returns the valid configurations consistent with a partial selection."),
    SAMPLING("sampling", Parameter.COUNT, "Generates a sample of distinct valid configurations."),
    UNIQUE_FEATURES("unique_features", Parameter.NONE, "Identifies features that form an atomic set on their own."),
    VARIANT_FEATURES("variant_features", Parameter.NONE, "Identifies features that are neither core nor dead."),
    VARIABILITY(
            "variability", Parameter.NONE, 2, "Calculates the ratio of variant features to the total number of features.");

    /** Kind of the single extra parameter an operation takes. */
    public enum Parameter {
        NONE,
        FEATURE,
        SELECTION,
        CRITERIA,
        COUNT
    }

    private final String wireName;
    private final Parameter parameter;
    private final int decimals;
    private final String description;

    Operation(String wireName, Parameter parameter, String description) {
        this(wireName, parameter, -1, description);
    }

    Operation(String wireName, Parameter parameter, int decimals, String description) {
        this.wireName = wireName;
        this.parameter = parameter;
        this.decimals = decimals;
        this.description = description;
    }

    public String wireName() {
        return wireName;
    }

    public Parameter parameter() {
        return parameter;
    }

    /** Decimals a fractional result is rounded to, or {@code -1} when the result is not rounded. */
    public int decimals() {
        return decimals;
    }

    public String description() {
        return description;
    }

    /** Resolves a wire name such as {@code core_features}. */
    public static Optional<Operation> fromWireName(String wireName) {
        for (Operation operation : values()) {
            if (operation.wireName.equals(wireName)) {
                return Optional.of(operation);
            }
        }
        return Optional.empty();
    }
}
