package com.wiregen.api;

/**
 * Whether the interface registrations of a service resolve to one shared instance.
 */
public enum InstanceSharing {
    /** Every interface is registered independently. */
    SEPARATE,
    /** Interfaces forward to the registration of the implementation type. */
    SHARED
}
