package com.wiregen.core.diagnostic;

/**
 * Severity of a diagnostic. {@link #NONE} suppresses it.
 */
public enum Severity {
    ERROR,
    WARNING,
    INFO,
    NONE;

    /**
     * Parses a severity name case-insensitively; {@code "off"} and {@code "hidden"} map to NONE.
     *
     * @param value severity name
     * @return the severity
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Severity parse(String value) {
        String normalized = value.trim().toUpperCase();
        return switch (normalized) {
            case "OFF", "HIDDEN", "SUPPRESS" -> NONE;
            case "WARN" -> WARNING;
            default -> Severity.valueOf(normalized);
        };
    }
}
