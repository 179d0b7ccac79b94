package com.wiregen.core.registration;

/**
 * How a contract is bound to its implementation.
 */
public enum RegistrationKind {
    /** The container constructs the implementation for this contract. */
    DIRECT,
    /** The contract resolves the implementation's own registration, sharing its instance. */
    FORWARDING
}
