package io.uvlanalyzer.core.model;

import io.uvlanalyzer.core.error.UnknownFeatureException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Rooted, read-only tree of {@link Feature}s. Features are kept in declaration order
 * (document pre-order). The fixed order used to break ties (depth ascending, then name
 * ascending) is exposed as {@link #variableOrder()}.
 *
 * <p>
 * Thread-safe: all state is final and unmodifiable.
 */
public final class FeatureTree {

    private final String root;
    private final Map<String, Feature> features;
    private final Map<String, Integer> depths;
    private final List<String> variableOrder;

    /**
     * Creates a tree from features in declaration order. The caller guarantees the structural
     * invariants (one root, unique names, every child declared); they are re-checked here and a
     * violation is an internal inconsistency.
     *
     * @param features features in declaration order, root first
     */
    public FeatureTree(List<Feature> features) {
        if (features.isEmpty()) {
            throw new IllegalStateException("feature tree must have a root");
        }
        Map<String, Feature> byName = new LinkedHashMap<>();
        for (Feature feature : features) {
            if (byName.put(feature.name(), feature) != null) {
                throw new IllegalStateException("duplicate feature in tree: " + feature.name());
            }
        }
        Feature rootFeature = features.get(0);
        if (!rootFeature.isRoot()) {
            throw new IllegalStateException("first feature must be the root: " + rootFeature.name());
        }
        this.root = rootFeature.name();
        this.features = Collections.unmodifiableMap(byName);

        Map<String, Integer> depthByName = new LinkedHashMap<>();
        depthByName.put(root, 0);
        for (Feature feature : features) {
            Integer depth = depthByName.get(feature.name());
            if (depth == null) {
                throw new IllegalStateException("feature declared before its parent: " + feature.name());
            }
            for (String child : feature.children()) {
                Feature childFeature = byName.get(child);
                if (childFeature == null || !feature.name().equals(childFeature.parent())) {
                    throw new IllegalStateException("inconsistent child link: " + feature.name() + " -> " + child);
                }
                depthByName.put(child, depth + 1);
            }
        }
        this.depths = Collections.unmodifiableMap(depthByName);

        List<String> order = new ArrayList<>(byName.keySet());
        order.sort(Comparator.<String>comparingInt(depthByName::get).thenComparing(Comparator.naturalOrder()));
        this.variableOrder = List.copyOf(order);
    }

    /** The root feature. */
    public Feature root() {
        return features.get(root);
    }

    /** Number of features, root included. */
    public int size() {
        return features.size();
    }

    /** All features in declaration order. */
    public Collection<Feature> features() {
        return features.values();
    }

    /** All feature names in declaration order. */
    public List<String> names() {
        return List.copyOf(features.keySet());
    }

    /** Feature names in the fixed topological order (depth, then name). */
    public List<String> variableOrder() {
        return variableOrder;
    }

    /** Returns {@code true} if the tree declares the given name. */
    public boolean contains(String name) {
        return features.containsKey(name);
    }

    /** Looks up a feature by name. */
    public Optional<Feature> feature(String name) {
        return Optional.ofNullable(features.get(name));
    }

    /**
     * Resolves a caller-supplied feature name. Names are matched verbatim first; a bare name
     * also resolves a feature the model declares in double quotes.
     *
     * @param name the name as supplied by the caller
     * @return the feature
     * @throws UnknownFeatureException if no feature matches
     */
    public Feature requireFeature(String name) {
        Objects.requireNonNull(name, "name must not be null");
        Feature feature = features.get(name);
        if (feature == null) {
            feature = features.get('"' + name + '"');
        }
        if (feature == null) {
            throw new UnknownFeatureException(name);
        }
        return feature;
    }

    /** Edge count from the root to the given feature. */
    public int depth(String name) {
        Integer depth = depths.get(name);
        if (depth == null) {
            throw new UnknownFeatureException(name);
        }
        return depth;
    }

    /** The parent of the given feature, empty for the root. */
    public Optional<Feature> parent(String name) {
        Feature feature = requireFeature(name);
        return feature.isRoot() ? Optional.empty() : Optional.of(features.get(feature.parent()));
    }
}
