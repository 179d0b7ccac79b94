package com.wiregen.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reference to a type as written in a declaration, after name resolution.
 *
 * <p>{@code name} is the qualified raw name when the type could be resolved
 * ({@code com.acme.OrderRepository}), the name as written when it could not, or the name of a
 * type variable ({@code T}) when {@code typeVariable} is set. Two references are the same type
 * when name, arguments and variable flag are equal.
 *
 * @param name raw type name
 * @param arguments type arguments, empty for raw and non-generic types
 * @param typeVariable whether this is a type variable of an enclosing declaration
 */
public record TypeRef(
    String name,
    List<TypeRef> arguments,
    boolean typeVariable
) {
    private static final Set<String> COLLECTION_TYPES = Set.of(
        "java.util.List",
        "java.util.Collection",
        "java.util.Set",
        "java.lang.Iterable"
    );

    public TypeRef {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public static TypeRef of(String name, TypeRef... arguments) {
        return new TypeRef(name, List.of(arguments), false);
    }

    public static TypeRef variable(String name) {
        return new TypeRef(name, List.of(), true);
    }

    /**
     * Simple name without package, enclosing types or type arguments.
     */
    public String simpleName() {
        int lastDot = name.lastIndexOf('.');
        return lastDot >= 0 ? name.substring(lastDot + 1) : name;
    }

    public String packageName() {
        int lastDot = name.lastIndexOf('.');
        return lastDot >= 0 ? name.substring(0, lastDot) : "";
    }

    public boolean isParameterized() {
        return !arguments.isEmpty();
    }

    /**
     * Returns whether this is one of the collection types through which a dependency asks for
     * every implementation of its element type.
     */
    public boolean isCollection() {
        return !typeVariable && arguments.size() == 1 && COLLECTION_TYPES.contains(name);
    }

    /**
     * Element type of a collection, or this reference when it is not a collection.
     */
    public TypeRef elementType() {
        return isCollection() ? arguments.get(0) : this;
    }

    public boolean containsTypeVariable() {
        return typeVariable || arguments.stream().anyMatch(TypeRef::containsTypeVariable);
    }

    /**
     * Collects the names of all type variables used anywhere in this reference.
     */
    public Set<String> typeVariables() {
        if (typeVariable) {
            return Set.of(name);
        }
        return arguments.stream()
            .flatMap(argument -> argument.typeVariables().stream())
            .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Replaces type variables with the bound types. Unbound variables are kept.
     *
     * @param bindings type variable name to type
     * @return the substituted reference
     */
    public TypeRef substitute(Map<String, TypeRef> bindings) {
        if (typeVariable) {
            return bindings.getOrDefault(name, this);
        }
        if (arguments.isEmpty() || bindings.isEmpty()) {
            return this;
        }
        List<TypeRef> substituted = new ArrayList<>(arguments.size());
        for (TypeRef argument : arguments) {
            substituted.add(argument.substitute(bindings));
        }
        return new TypeRef(name, substituted, false);
    }

    /**
     * Source form with qualified names, e.g. {@code java.util.List<com.acme.Handler>}.
     */
    public String toSourceString() {
        if (arguments.isEmpty()) {
            return name;
        }
        return name + arguments.stream()
            .map(TypeRef::toSourceString)
            .collect(Collectors.joining(", ", "<", ">"));
    }

    /**
     * Readable form with simple names, e.g. {@code List<Handler>}.
     */
    public String toDisplayString() {
        if (arguments.isEmpty()) {
            return simpleName();
        }
        return simpleName() + arguments.stream()
            .map(TypeRef::toDisplayString)
            .collect(Collectors.joining(", ", "<", ">"));
    }

    @Override
    public String toString() {
        return toSourceString();
    }
}
