package com.wiregen.core.graph;

import com.wiregen.core.model.TypeRef;

/**
 * A superclass or interface of a type, with type arguments expressed in that type's context.
 *
 * @param type the supertype
 * @param isInterface whether it is an interface
 */
public record Supertype(TypeRef type, boolean isInterface) {
}
