package com.wiregen.api;

/**
 * Which types a service is registered as.
 */
public enum RegistrationMode {
    /** The implementation type only. */
    DIRECT_ONLY,
    /** The implementation type and every implemented interface. */
    ALL,
    /** Every implemented interface, without the implementation type. */
    EXCLUSIONARY
}
