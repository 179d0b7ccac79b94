package com.wiregen.core.model;

/**
 * Kind of an analysed type declaration.
 */
public enum TypeKind {
    CLASS,
    INTERFACE,
    RECORD
}
