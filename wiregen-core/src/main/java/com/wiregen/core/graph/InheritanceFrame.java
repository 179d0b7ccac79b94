package com.wiregen.core.graph;

import com.wiregen.core.model.TypeDescriptor;
import com.wiregen.core.model.TypeRef;

import java.util.Map;

/**
 * One level of an inheritance chain.
 *
 * @param type declaration at this level
 * @param bindings its type variables bound in the context of the most derived type
 */
public record InheritanceFrame(TypeDescriptor type, Map<String, TypeRef> bindings) {

    public InheritanceFrame {
        bindings = bindings == null ? Map.of() : Map.copyOf(bindings);
    }
}
