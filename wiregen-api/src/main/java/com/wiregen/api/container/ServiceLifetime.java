package com.wiregen.api.container;

/**
 * How long a container keeps a constructed instance.
 */
public enum ServiceLifetime {
    SINGLETON,
    SCOPED,
    TRANSIENT
}
