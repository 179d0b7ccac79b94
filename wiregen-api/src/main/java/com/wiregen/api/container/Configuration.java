package com.wiregen.api.container;

import java.util.Map;
import java.util.Optional;

/**
 * Key/value configuration that generated constructors read bound fields from.
 */
@FunctionalInterface
public interface Configuration {

    /**
     * Returns the value of a key.
     *
     * @param key configuration key
     * @return the value, empty when the key is missing
     */
    Optional<String> find(String key);

    /**
     * @throws IllegalStateException if the key is missing
     */
    default String require(String key) {
        return find(key).orElseThrow(() -> new IllegalStateException("Required configuration '" + key + "' is missing"));
    }

    default String getOrDefault(String key, String defaultValue) {
        return find(key).orElse(defaultValue);
    }

    /**
     * Configuration backed by a copy of {@code values}, which must not contain {@code null}
     * keys or values.
     */
    static Configuration of(Map<String, String> values) {
        Map<String, String> copy = Map.copyOf(values);
        return key -> Optional.ofNullable(copy.get(key));
    }
}
