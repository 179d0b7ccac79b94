package com.wiregen.core.naming;

import com.wiregen.core.model.TypeRef;

import java.util.Objects;

/**
 * One parameter of a generated constructor.
 *
 * @param name parameter identifier
 * @param type parameter type in the constructed type's context
 * @param inherited whether the parameter is forwarded to the base constructor
 * @param origin dependency the parameter was derived from, used in diagnostics
 */
public record ConstructorParameter(String name, TypeRef type, boolean inherited, String origin) {

    public ConstructorParameter {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (origin == null) {
            origin = type.toDisplayString();
        }
    }
}
