package io.uvlanalyzer.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A parsed feature model: the feature tree plus its ordered constraint set. Created once per
 * parse and read-only afterwards.
 */
public final class FeatureModel {

    private final String namespace;
    private final FeatureTree tree;
    private final List<Constraint> constraints;

    /**
     * @param namespace   value of the {@code namespace} line, or {@code null}
     * @param tree        the feature tree
     * @param constraints cross-tree constraints in source order
     */
    public FeatureModel(String namespace, FeatureTree tree, List<Constraint> constraints) {
        this.namespace = namespace;
        this.tree = Objects.requireNonNull(tree, "tree must not be null");
        this.constraints = List.copyOf(constraints);
    }

    /** The declared namespace, or {@code null} when the model has none. */
    public String namespace() {
        return namespace;
    }

    public FeatureTree tree() {
        return tree;
    }

    public List<Constraint> constraints() {
        return constraints;
    }

    /** Returns {@code true} if the model has at least one cross-tree constraint. */
    public boolean hasConstraints() {
        return !constraints.isEmpty();
    }

    @Override
    public String toString() {
        return "FeatureModel[root=" + tree.root().name() + ", features=" + tree.size() + ", constraints="
                + constraints.size() + "]";
    }
}
