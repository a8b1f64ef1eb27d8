package io.uvlanalyzer.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A partial selection used to filter configurations: features forced selected and features
 * forced unselected. A feature in both sets makes the criteria unsatisfiable; that is not an
 * error, it simply filters out everything.
 *
 * @param selected   features every matching configuration must select
 * @param deselected features every matching configuration must leave out
 */
public record SelectionCriteria(Set<String> selected, Set<String> deselected) {

    public SelectionCriteria {
        selected = Collections.unmodifiableSet(new LinkedHashSet<>(selected));
        deselected = Collections.unmodifiableSet(new LinkedHashSet<>(deselected));
    }

    /** Criteria that match every configuration. */
    public static SelectionCriteria none() {
        return new SelectionCriteria(Set.of(), Set.of());
    }

    /** Returns {@code true} if no feature is forced either way. */
    public boolean isEmpty() {
        return selected.isEmpty() && deselected.isEmpty();
    }
}
