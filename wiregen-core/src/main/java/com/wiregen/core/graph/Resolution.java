package com.wiregen.core.graph;

/**
 * Outcome of resolving a dependency to implementations.
 */
public enum Resolution {
    /** One or more implementations were found. */
    RESOLVED,
    /** Provided outside the graph: external dependency, external type or external implementations. */
    EXTERNAL,
    /** The dependency type is not declared in the snapshot. */
    UNKNOWN,
    /** The dependency type is declared but nothing implements it. */
    UNRESOLVED,
    /** Several unconditional implementations compete for a single dependency. */
    AMBIGUOUS
}
