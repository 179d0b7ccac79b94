package com.wiregen.core.scanner;

import java.util.List;
import java.util.Set;

/**
 * Names visible inside a type declaration.
 *
 * @param enclosingTypes qualified names of the declaration and its enclosing declarations, innermost first
 * @param typeVariables type variables declared by those declarations
 */
record DeclarationScope(List<String> enclosingTypes, Set<String> typeVariables) {

    DeclarationScope {
        enclosingTypes = List.copyOf(enclosingTypes);
        typeVariables = Set.copyOf(typeVariables);
    }
}
