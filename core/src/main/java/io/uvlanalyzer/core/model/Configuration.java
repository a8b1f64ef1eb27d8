package io.uvlanalyzer.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One total assignment of the model's features. Entries follow the tree's
 * declaration order. Immutable value: equality is entry-wise.
 */
public final class Configuration {

    private final Map<String, Boolean> assignment;

    /**
     * @param assignment selection state for every feature, in declaration order
     */
    public Configuration(Map<String, Boolean> assignment) {
        Objects.requireNonNull(assignment, "assignment must not be null");
        this.assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
    }

    /** Every feature mapped to its selection state, in declaration order. */
    public Map<String, Boolean> assignment() {
        return assignment;
    }

    /** Returns {@code true} if the feature is selected; unknown names are unselected. */
    public boolean isSelected(String name) {
        return Boolean.TRUE.equals(assignment.get(name));
    }

    /** Names of the selected features, in declaration order. */
    public List<String> selectedFeatures() {
        List<String> selected = new ArrayList<>();
        assignment.forEach((name, value) -> {
            if (value) {
                selected.add(name);
            }
        });
        return selected;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Configuration other)) return false;
        return assignment.equals(other.assignment);
    }

    @Override
    public int hashCode() {
        return assignment.hashCode();
    }

    @Override
    public String toString() {
        return "Configuration" + selectedFeatures();
    }
}
