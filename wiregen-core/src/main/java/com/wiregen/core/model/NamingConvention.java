package com.wiregen.core.model;

/**
 * Case convention applied to generated identifiers.
 */
public enum NamingConvention {
    CAMEL_CASE,
    PASCAL_CASE,
    SNAKE_CASE
}
