package com.wiregen.core.renderer;

import java.util.Map;
import java.util.Objects;

/**
 * Where and how a renderer writes generated sources.
 *
 * @param outputDirectory root directory for generated sources
 * @param settings renderer options keyed by {@code <renderer>.<option>}
 */
public record RenderContext(
    String outputDirectory,
    Map<String, String> settings
) {
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    /**
     * Reads a {@code "true"}/{@code "false"} option; anything other than {@code "true"} is false.
     */
    public boolean isEnabled(String key, boolean defaultValue) {
        String value = settings.get(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }
}
