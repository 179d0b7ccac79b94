package com.wiregen.core.model;

import java.util.Objects;

/**
 * A field bound to a configuration value.
 *
 * @param owner qualified name of the declaring type
 * @param fieldName name of the bound field
 * @param valueType field type
 * @param key configuration key
 * @param defaultValue value used when the key is missing, {@code null} when none is declared
 * @param required whether a missing key without default fails construction
 */
public record ConfigurationField(
    String owner,
    String fieldName,
    ConfigurationValueType valueType,
    String key,
    String defaultValue,
    boolean required
) {
    public ConfigurationField {
        Objects.requireNonNull(owner, "owner must not be null");
        Objects.requireNonNull(fieldName, "fieldName must not be null");
        Objects.requireNonNull(valueType, "valueType must not be null");
        Objects.requireNonNull(key, "key must not be null");
        if (key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
