package io.uvlanalyzer.core.analysis;

import io.uvlanalyzer.core.model.Feature;
import io.uvlanalyzer.core.model.FeatureTree;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Shape metrics of a feature tree. Pure functions of the tree; no solving involved. */
public final class TreeMetrics {

    private final FeatureTree tree;

    public TreeMetrics(FeatureTree tree) {
        this.tree = Objects.requireNonNull(tree, "tree must not be null");
    }

    /** Features without children, in declaration order. */
    public List<String> leafFeatures() {
        List<String> leaves = new ArrayList<>();
        for (Feature feature : tree.features()) {
            if (feature.isLeaf()) {
                leaves.add(feature.name());
            }
        }
        return leaves;
    }

    public int countLeaves() {
        return leafFeatures().size();
    }

    /** Longest root-to-leaf path, in edges. A lone root has depth 0. */
    public int maxDepth() {
        int max = 0;
        for (Feature feature : tree.features()) {
            max = Math.max(max, tree.depth(feature.name()));
        }
        return max;
    }

    /** Mean number of children over features that have any; {@code 0.0} for a lone root. */
    public double averageBranchingFactor() {
        int parents = 0;
        int children = 0;
        for (Feature feature : tree.features()) {
            if (!feature.isLeaf()) {
                parents++;
                children += feature.children().size();
            }
        }
        return parents == 0 ? 0.0 : (double) children / parents;
    }

    /**
     * Ancestors from the immediate parent up to the root.
     *
     * @throws io.uvlanalyzer.core.error.UnknownFeatureException if the tree has no such feature
     */
    public List<String> featureAncestors(String name) {
        List<String> ancestors = new ArrayList<>();
        Optional<Feature> parent = tree.parent(tree.requireFeature(name).name());
        while (parent.isPresent()) {
            ancestors.add(parent.get().name());
            parent = tree.parent(parent.get().name());
        }
        return ancestors;
    }
}
