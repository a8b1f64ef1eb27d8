package io.uvlanalyzer.core.encoding;

import io.uvlanalyzer.core.error.UnknownFeatureException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Bijection between feature names and 1-based propositional variables. Variables are numbered
 * in the tree's variable order (depth, then name), so the same tree always gets the same
 * numbering.
 */
public final class VariableMap {

    private final List<String> names;
    private final Map<String, Integer> indices;

    public VariableMap(List<String> orderedNames) {
        this.names = List.copyOf(orderedNames);
        Map<String, Integer> byName = new HashMap<>();
        for (int i = 0; i < names.size(); i++) {
            if (byName.put(names.get(i), i + 1) != null) {
                throw new IllegalStateException("duplicate variable name: " + names.get(i));
            }
        }
        this.indices = Map.copyOf(byName);
    }

    /** Number of feature variables. */
    public int size() {
        return names.size();
    }

    /**
     * The variable of a feature.
     *
     * @throws UnknownFeatureException if the name has no variable
     */
    public int variable(String name) {
        Integer index = indices.get(name);
        if (index == null) {
            throw new UnknownFeatureException(name);
        }
        return index;
    }

    /** The feature of a variable in {@code 1..size()}. */
    public String name(int variable) {
        if (variable < 1 || variable > names.size()) {
            throw new IllegalStateException("variable " + variable + " is not a feature variable");
        }
        return names.get(variable - 1);
    }

    /** Feature names in variable order. */
    public List<String> names() {
        return names;
    }
}
