package com.wiregen.core.naming;

import com.wiregen.core.model.ConfigurationField;

import java.util.Objects;

/**
 * Assignment of a configuration value to a bound field.
 *
 * @param field the bound field
 * @param parameterName constructor parameter holding the configuration
 */
public record ConfigurationBinding(ConfigurationField field, String parameterName) {

    public ConfigurationBinding {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(parameterName, "parameterName must not be null");
    }
}
