package com.wiregen.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Markers and structure of one analysed type declaration.
 *
 * @param qualifiedName fully qualified name, nested types joined with {@code .}
 * @param kind declaration kind
 * @param typeParameters names of declared type variables, in order
 * @param lifetime resolved lifetime, {@link Lifetime#UNASSIGNED} for non-services
 * @param lifetimeDeclared whether the lifetime comes from an explicit marker
 * @param external whether the type is excluded from validation and registration
 * @param isAbstract abstract class or interface
 * @param superclass extended class, {@code null} when none is declared
 * @param interfaces directly implemented (or, for interfaces, extended) interfaces
 * @param registration registration directive
 * @param conditions registration conditions, alternatives of which any one suffices; empty when unconditional
 * @param explicitConstructor whether the declaration already has a constructor
 * @param sourcePath path of the declaring source unit
 */
public record TypeDescriptor(
    String qualifiedName,
    TypeKind kind,
    List<String> typeParameters,
    Lifetime lifetime,
    boolean lifetimeDeclared,
    boolean external,
    boolean isAbstract,
    TypeRef superclass,
    List<TypeRef> interfaces,
    RegistrationDirective registration,
    List<ConditionalRule> conditions,
    boolean explicitConstructor,
    String sourcePath
) {
    public TypeDescriptor {
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(lifetime, "lifetime must not be null");
        Objects.requireNonNull(sourcePath, "sourcePath must not be null");
        typeParameters = typeParameters == null ? List.of() : List.copyOf(typeParameters);
        interfaces = interfaces == null ? List.of() : List.copyOf(interfaces);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        if (registration == null) {
            registration = RegistrationDirective.none();
        }
    }

    public String simpleName() {
        int lastDot = qualifiedName.lastIndexOf('.');
        return lastDot >= 0 ? qualifiedName.substring(lastDot + 1) : qualifiedName;
    }

    public boolean isInterface() {
        return kind == TypeKind.INTERFACE;
    }

    /**
     * Concrete types can be instantiated by a container.
     */
    public boolean isConcrete() {
        return kind != TypeKind.INTERFACE && !isAbstract;
    }

    public boolean isService() {
        return lifetime.isAssigned();
    }

    public boolean isConditional() {
        return !effectiveConditions().isEmpty();
    }

    /**
     * Conditions that constrain registration; conditions without any clause are left out.
     */
    public List<ConditionalRule> effectiveConditions() {
        return conditions.stream().filter(ConditionalRule::isEffective).toList();
    }

    /**
     * Reference to this type with its own type variables as arguments.
     */
    public TypeRef selfReference() {
        return new TypeRef(qualifiedName, typeParameters.stream().map(TypeRef::variable).toList(), false);
    }
}
