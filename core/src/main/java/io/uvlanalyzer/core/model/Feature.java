package io.uvlanalyzer.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named node of the feature tree. Immutable; ownership is expressed by name: {@code parent}
 * is the parent's name and each {@link Group} lists child names, so a {@link FeatureTree} can
 * hold every feature in one flat, read-only map.
 *
 * @param name       verbatim feature name, including quotes when the model quotes it
 * @param parent     name of the parent feature, or {@code null} for the root
 * @param declaredIn kind of the group that declares this feature, or {@code null} for the root
 * @param groups     child groups in declaration order
 * @param attributes attribute metadata from the {@code {...}} block; ignored by boolean
 *                   semantics
 * @param type       declared type keyword ({@code Boolean} when none was written)
 * @param line       1-based source line of the declaration
 */
public record Feature(
        String name,
        String parent,
        GroupKind declaredIn,
        List<Group> groups,
        Map<String, String> attributes,
        String type,
        int line) {

    public Feature {
        Objects.requireNonNull(name, "name must not be null");
        groups = List.copyOf(groups);
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        type = type != null ? type : "Boolean";
    }

    /** Returns {@code true} if this is the root of its tree. */
    public boolean isRoot() {
        return parent == null;
    }

    /** Returns {@code true} if the feature has no children. */
    public boolean isLeaf() {
        return groups.isEmpty();
    }

    /** Returns {@code true} if the model marks this feature {@code abstract}. */
    public boolean isAbstract() {
        return attributes.containsKey("abstract");
    }

    /** Child names across all groups, in declaration order. */
    public List<String> children() {
        List<String> children = new ArrayList<>();
        for (Group group : groups) {
            children.addAll(group.children());
        }
        return children;
    }
}
