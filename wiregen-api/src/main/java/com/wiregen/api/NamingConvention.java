package com.wiregen.api;

/**
 * Case convention for generated field names.
 */
public enum NamingConvention {
    CAMEL_CASE,
    PASCAL_CASE,
    SNAKE_CASE
}
