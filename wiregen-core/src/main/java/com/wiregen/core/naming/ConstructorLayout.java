package com.wiregen.core.naming;

import java.util.List;
import java.util.Objects;

/**
 * Shape of the constructor generated for one type.
 *
 * <p>Parameters forwarded to the base constructor come first, in the base constructor's order,
 * followed by the type's own parameters in declaration order.
 *
 * @param typeName qualified name of the constructed type
 * @param parameters constructor parameters
 * @param assignments field assignments for the type's own dependencies
 * @param configurationBindings fields of the type assigned from configuration values
 */
public record ConstructorLayout(
    String typeName,
    List<ConstructorParameter> parameters,
    List<FieldAssignment> assignments,
    List<ConfigurationBinding> configurationBindings
) {
    public ConstructorLayout {
        Objects.requireNonNull(typeName, "typeName must not be null");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        assignments = assignments == null ? List.of() : List.copyOf(assignments);
        configurationBindings = configurationBindings == null ? List.of() : List.copyOf(configurationBindings);
    }

    public ConstructorLayout(String typeName, List<ConstructorParameter> parameters, List<FieldAssignment> assignments) {
        this(typeName, parameters, assignments, List.of());
    }

    public List<ConstructorParameter> inheritedParameters() {
        return parameters.stream().filter(ConstructorParameter::inherited).toList();
    }

    public List<ConstructorParameter> ownParameters() {
        return parameters.stream().filter(p -> !p.inherited()).toList();
    }

    /**
     * Arguments of the base constructor call, empty when the base needs none.
     */
    public List<String> superArguments() {
        return inheritedParameters().stream().map(ConstructorParameter::name).toList();
    }

    public boolean hasSuperCall() {
        return !superArguments().isEmpty();
    }

    public List<FieldAssignment> generatedFields() {
        return assignments.stream().filter(FieldAssignment::declareField).toList();
    }
}
