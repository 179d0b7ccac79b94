package com.wiregen.core.model;

/**
 * Which types a service is registered as.
 */
public enum RegistrationMode {
    DIRECT_ONLY,
    ALL,
    EXCLUSIONARY
}
