package com.wiregen.core.model;

/**
 * Where a dependency was declared.
 */
public enum DependencySource {
    /** An injected field on the type. */
    FIELD,
    /** An entry of a type-level dependency declaration. */
    DECLARATION
}
