package com.wiregen.core.model;

/**
 * Service lifetime resolved for a type.
 *
 * <p>Ordering from widest to narrowest: {@link #SINGLETON}, {@link #SCOPED}, {@link #TRANSIENT}.
 * {@link #UNASSIGNED} means the type is not a service and never takes part in lifetime checks.
 */
public enum Lifetime {
    UNASSIGNED("Unassigned", 0),
    SINGLETON("Singleton", 3),
    SCOPED("Scoped", 2),
    TRANSIENT("Transient", 1);

    private final String displayName;
    private final int width;

    Lifetime(String displayName, int width) {
        this.displayName = displayName;
        this.width = width;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isAssigned() {
        return this != UNASSIGNED;
    }

    /**
     * Returns whether instances of this lifetime outlive instances of {@code other}.
     *
     * @param other lifetime to compare with
     * @return true if both are assigned and this lifetime is strictly wider
     */
    public boolean isWiderThan(Lifetime other) {
        return isAssigned() && other.isAssigned() && width > other.width;
    }

    /**
     * Parses a lifetime name case-insensitively ("singleton", "Scoped", "TRANSIENT").
     *
     * @param value lifetime name
     * @return the lifetime
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Lifetime parse(String value) {
        for (Lifetime lifetime : values()) {
            if (lifetime.name().equalsIgnoreCase(value) || lifetime.displayName.equalsIgnoreCase(value)) {
                return lifetime;
            }
        }
        throw new IllegalArgumentException("Unknown lifetime: " + value);
    }
}
