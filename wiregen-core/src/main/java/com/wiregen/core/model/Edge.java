package com.wiregen.core.model;

import java.util.Objects;

/**
 * Directed dependency from a service to one implementation it requires.
 *
 * <p>Collection edges ask for every implementation of a type; they are validated per
 * implementation but never propagate cycles.
 *
 * @param from qualified name of the dependent type
 * @param to qualified name of the implementation
 * @param viaCollection whether the dependency is collection-wrapped
 * @param inherited whether the dependency was declared on a base type
 * @param dependency the dependency type in the dependent's context
 * @param declaringType qualified name of the type that declared the dependency
 */
public record Edge(
    String from,
    String to,
    boolean viaCollection,
    boolean inherited,
    TypeRef dependency,
    String declaringType
) {
    public Edge {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(dependency, "dependency must not be null");
        Objects.requireNonNull(declaringType, "declaringType must not be null");
    }

    /**
     * Hard edges take part in cycle detection.
     */
    public boolean isHard() {
        return !viaCollection;
    }
}
