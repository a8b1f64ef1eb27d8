package io.uvlanalyzer.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One group of a parent feature: its kind, the names of the children it owns in declaration
 * order, and how many of them a selected parent selects. Immutable.
 *
 * @param kind     the group semantics
 * @param children child feature names, never empty
 * @param lower    fewest children a selected parent selects
 * @param upper    most children a selected parent selects, at most {@code children.size()}
 */
public record Group(GroupKind kind, List<String> children, int lower, int upper) {

    public Group {
        Objects.requireNonNull(kind, "kind must not be null");
        children = List.copyOf(children);
        if (children.isEmpty()) {
            throw new IllegalArgumentException("group '" + describe(kind, lower, upper) + "' must own at least one child");
        }
        if (lower < 0 || lower > upper || upper > children.size()) {
            throw new IllegalArgumentException("invalid bounds " + describe(GroupKind.CARDINALITY, lower, upper)
                    + " for " + children.size() + " children");
        }
        if (kind != GroupKind.CARDINALITY
                && (lower != lowerOf(kind, children.size()) || upper != upperOf(kind, children.size()))) {
            throw new IllegalArgumentException(
                    "bounds [" + lower + ".." + upper + "] contradict group kind '" + kind.keyword() + "'");
        }
    }

    /** A keyword group; the bounds follow from the kind. */
    public Group(GroupKind kind, List<String> children) {
        this(kind, children, lowerOf(kind, children.size()), upperOf(kind, children.size()));
    }

    /** Number of children the group owns. */
    public int size() {
        return children.size();
    }

    /** The keyword, or {@code [n..m]} for a cardinality group. */
    public String describe() {
        return describe(kind, lower, upper);
    }

    private static String describe(GroupKind kind, int lower, int upper) {
        return kind == GroupKind.CARDINALITY ? "[" + lower + ".." + upper + "]" : kind.keyword();
    }

    private static int lowerOf(GroupKind kind, int size) {
        return switch (kind) {
            case MANDATORY -> size;
            case OPTIONAL -> 0;
            case OR, ALTERNATIVE -> 1;
            case CARDINALITY -> throw new IllegalArgumentException("a cardinality group needs explicit bounds");
        };
    }

    private static int upperOf(GroupKind kind, int size) {
        return switch (kind) {
            case MANDATORY, OPTIONAL, OR -> size;
            case ALTERNATIVE -> 1;
            case CARDINALITY -> throw new IllegalArgumentException("a cardinality group needs explicit bounds");
        };
    }
}
