package com.wiregen.core.naming;

import com.wiregen.core.model.TypeRef;

import java.util.Objects;

/**
 * Assignment of a constructor parameter to a field of the constructed type.
 *
 * @param fieldName target field
 * @param type field type
 * @param parameterName source parameter
 * @param declareField whether the field has to be generated (type-level declarations) or
 *                     already exists in the source (injected fields)
 */
public record FieldAssignment(String fieldName, TypeRef type, String parameterName, boolean declareField) {

    public FieldAssignment {
        Objects.requireNonNull(fieldName, "fieldName must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(parameterName, "parameterName must not be null");
    }
}
