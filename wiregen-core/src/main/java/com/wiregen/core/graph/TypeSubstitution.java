package com.wiregen.core.graph;

import com.wiregen.core.model.TypeRef;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds the type variables of a generic declaration to the arguments of a reference to it.
 */
public final class TypeSubstitution {

    private TypeSubstitution() {
        // Utility class
    }

    /**
     * Binds {@code parameters} positionally to the arguments of {@code reference}.
     *
     * <p>A raw reference ({@code extends Base} for {@code Base<T>}) or an arity mismatch binds
     * nothing; dependencies that still mention the unbound variables are detected by
     * {@link #unboundVariables(TypeRef, List)}.
     *
     * @param parameters type variables of the referenced declaration
     * @param reference reference with arguments
     * @return variable name to argument
     */
    public static Map<String, TypeRef> bind(List<String> parameters, TypeRef reference) {
        if (parameters.isEmpty() || parameters.size() != reference.arguments().size()) {
            return Map.of();
        }
        Map<String, TypeRef> bindings = new HashMap<>();
        for (int i = 0; i < parameters.size(); i++) {
            bindings.put(parameters.get(i), reference.arguments().get(i));
        }
        return Map.copyOf(bindings);
    }

    /**
     * Type variables of {@code type} that are not among {@code visible}.
     *
     * @param type substituted type
     * @param visible type variables declared by the type the dependency now belongs to
     * @return unbound variable names, sorted
     */
    public static List<String> unboundVariables(TypeRef type, List<String> visible) {
        return type.typeVariables().stream()
            .filter(variable -> !visible.contains(variable))
            .sorted()
            .toList();
    }
}
