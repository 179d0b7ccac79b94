package com.wiregen.core.model;

/**
 * Whether interface registrations of one service resolve to a shared instance.
 */
public enum InstanceSharing {
    SEPARATE,
    SHARED
}
