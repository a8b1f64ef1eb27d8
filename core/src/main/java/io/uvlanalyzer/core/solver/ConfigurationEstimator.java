package io.uvlanalyzer.core.solver;

import io.uvlanalyzer.core.model.Feature;
import io.uvlanalyzer.core.model.FeatureTree;
import io.uvlanalyzer.core.model.Group;
import java.math.BigInteger;
import java.util.Arrays;

/**
 * Upper bound on the number of configurations computed from the tree alone. Cross-tree
 * constraints are ignored; every group contributes the number of selections it allows in
 * isolation:
 *
 * <ul>
 * <li>mandatory: product of the children's counts;
 * <li>optional: product of (child count + 1), the extra case being "child absent";
 * <li>or: product of (child count + 1), minus the all-absent case;
 * <li>alternative: sum of the children's counts;
 * <li>cardinality {@code [l..u]}: for every selection size from l to u, the sum over the
 *     selections of that size of the product of the chosen children's counts.
 * </ul>
 *
 * A feature's count is the product over its groups and a leaf counts 1. Without constraints
 * the bound is exact; constraints can only remove configurations.
 */
final class ConfigurationEstimator {

    private ConfigurationEstimator() {}

    static BigInteger estimate(FeatureTree tree) {
        return estimate(tree, tree.root());
    }

    private static BigInteger estimate(FeatureTree tree, Feature feature) {
        BigInteger total = BigInteger.ONE;
        for (Group group : feature.groups()) {
            total = total.multiply(groupCount(tree, group));
        }
        return total;
    }

    private static BigInteger groupCount(FeatureTree tree, Group group) {
        return switch (group.kind()) {
            case MANDATORY -> {
                BigInteger product = BigInteger.ONE;
                for (String child : group.children()) {
                    product = product.multiply(childCount(tree, child));
                }
                yield product;
            }
            case OPTIONAL -> {
                BigInteger product = BigInteger.ONE;
                for (String child : group.children()) {
                    product = product.multiply(childCount(tree, child).add(BigInteger.ONE));
                }
                yield product;
            }
            case OR -> {
                BigInteger product = BigInteger.ONE;
                for (String child : group.children()) {
                    product = product.multiply(childCount(tree, child).add(BigInteger.ONE));
                }
                yield product.subtract(BigInteger.ONE);
            }
            case ALTERNATIVE -> {
                BigInteger sum = BigInteger.ZERO;
                for (String child : group.children()) {
                    sum = sum.add(childCount(tree, child));
                }
                yield sum;
            }
            case CARDINALITY -> boundedSelections(tree, group);
        };
    }

    /**
     * {@code bySize[i]} is the elementary symmetric sum of degree i over the children's counts,
     * that is the number of ways to select exactly i children, each in one of its own
     * configurations.
     */
    private static BigInteger boundedSelections(FeatureTree tree, Group group) {
        BigInteger[] bySize = new BigInteger[group.upper() + 1];
        Arrays.fill(bySize, BigInteger.ZERO);
        bySize[0] = BigInteger.ONE;
        int seen = 0;
        for (String child : group.children()) {
            BigInteger count = childCount(tree, child);
            seen++;
            for (int i = Math.min(seen, group.upper()); i >= 1; i--) {
                bySize[i] = bySize[i].add(bySize[i - 1].multiply(count));
            }
        }
        BigInteger total = BigInteger.ZERO;
        for (int i = group.lower(); i <= group.upper(); i++) {
            total = total.add(bySize[i]);
        }
        return total;
    }

    private static BigInteger childCount(FeatureTree tree, String child) {
        return estimate(tree, tree.feature(child).orElseThrow(() -> new IllegalStateException("undeclared child: " + child)));
    }
}
