package com.wiregen.core.model;

import java.util.Objects;

/**
 * One declared dependency of a type.
 *
 * @param owner qualified name of the declaring type
 * @param target dependency type as declared, possibly generic or collection-wrapped
 * @param source field marker or type-level declaration
 * @param naming naming settings for the generated identifier
 * @param external whether diagnostics are suppressed for this dependency
 * @param order position among all dependencies of the owner
 * @param declarationIndex which type-level declaration it belongs to, {@code -1} for fields
 * @param fieldName name of the injected field, {@code null} for type-level declarations
 */
public record DependencyDescriptor(
    String owner,
    TypeRef target,
    DependencySource source,
    NamingOptions naming,
    boolean external,
    int order,
    int declarationIndex,
    String fieldName
) {
    public DependencyDescriptor {
        Objects.requireNonNull(owner, "owner must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(source, "source must not be null");
        if (naming == null) {
            naming = NamingOptions.defaults();
        }
        if (source == DependencySource.FIELD) {
            Objects.requireNonNull(fieldName, "fieldName is required for field dependencies");
        }
    }

    public static DependencyDescriptor field(String owner, TypeRef target, String fieldName,
                                             boolean external, int order) {
        return new DependencyDescriptor(owner, target, DependencySource.FIELD, NamingOptions.defaults(),
            external, order, -1, fieldName);
    }

    public static DependencyDescriptor declared(String owner, TypeRef target, NamingOptions naming,
                                                boolean external, int order, int declarationIndex) {
        return new DependencyDescriptor(owner, target, DependencySource.DECLARATION, naming,
            external, order, declarationIndex, null);
    }

    public boolean isField() {
        return source == DependencySource.FIELD;
    }

    /**
     * Copy with the target replaced, used after generic substitution.
     */
    public DependencyDescriptor withTarget(TypeRef newTarget) {
        return new DependencyDescriptor(owner, newTarget, source, naming, external, order, declarationIndex, fieldName);
    }
}
