package io.uvlanalyzer.core.model;

import java.util.Optional;

/**
 * The group kinds a feature may use to own its children. Consumers dispatch with an exhaustive
 * {@code switch} expression, so adding a kind is a compile error everywhere it has to be
 * handled.
 */
public enum GroupKind {
    /** Child is selected iff the parent is selected. */
    MANDATORY("mandatory"),
    /** Child may be selected only if the parent is selected. */
    OPTIONAL("optional"),
    /** At least one child is selected iff the parent is selected. */
    OR("or"),
    /** Exactly one child is selected iff the parent is selected. */
    ALTERNATIVE("alternative"),
    /**
     * A selected parent has between {@link Group#lower()} and {@link Group#upper()} selected
     * children. Written as {@code [n..m]}; it has no keyword.
     */
    CARDINALITY(null);

    private final String keyword;

    GroupKind(String keyword) {
        this.keyword = keyword;
    }

    /** The UVL keyword that opens a group of this kind, {@code null} for {@link #CARDINALITY}. */
    public String keyword() {
        return keyword;
    }

    /**
     * Resolves a UVL group keyword.
     *
     * @param keyword keyword as written in the model, case-sensitive
     * @return the kind, or empty if the keyword is not a group keyword
     */
    public static Optional<GroupKind> fromKeyword(String keyword) {
        for (GroupKind kind : values()) {
            if (keyword.equals(kind.keyword)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
