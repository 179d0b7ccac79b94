package com.wiregen.core.model;

import java.util.Objects;

/**
 * Naming settings of one dependency declaration.
 *
 * @param convention case convention of the generated field
 * @param stripLeadingMarker strip an interface marker such as {@code I} in {@code IRepository}
 * @param prefix prefix of the generated field, may be empty
 */
public record NamingOptions(
    NamingConvention convention,
    boolean stripLeadingMarker,
    String prefix
) {
    public static final String DEFAULT_PREFIX = "_";

    public NamingOptions {
        Objects.requireNonNull(convention, "convention must not be null");
        if (prefix == null) {
            prefix = "";
        }
    }

    /**
     * Settings used when a declaration does not override anything: camelCase, marker stripped,
     * {@code _} prefix.
     */
    public static NamingOptions defaults() {
        return new NamingOptions(NamingConvention.CAMEL_CASE, true, DEFAULT_PREFIX);
    }
}
