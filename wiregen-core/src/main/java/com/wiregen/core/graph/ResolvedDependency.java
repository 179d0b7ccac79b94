package com.wiregen.core.graph;

import com.wiregen.core.model.DependencyDescriptor;
import com.wiregen.core.model.TypeRef;

import java.util.List;
import java.util.Objects;

/**
 * A dependency of a type after inheritance merging, substitution and implementation lookup.
 *
 * @param descriptor the declaration it came from
 * @param target dependency type in the owning type's context
 * @param inherited whether it was declared on a base type
 * @param declaringType qualified name of the declaring type
 * @param resolution how the dependency resolved
 * @param candidates qualified names of the implementations, sorted
 */
public record ResolvedDependency(
    DependencyDescriptor descriptor,
    TypeRef target,
    boolean inherited,
    String declaringType,
    Resolution resolution,
    List<String> candidates
) {
    public ResolvedDependency {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(declaringType, "declaringType must not be null");
        Objects.requireNonNull(resolution, "resolution must not be null");
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public boolean viaCollection() {
        return target.isCollection();
    }

    /**
     * Type whose implementations satisfy the dependency: the element type for collections.
     */
    public TypeRef element() {
        return target.elementType();
    }

    public boolean isExternal() {
        return resolution == Resolution.EXTERNAL;
    }
}
