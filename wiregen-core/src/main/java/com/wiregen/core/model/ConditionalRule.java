package com.wiregen.core.model;

import java.util.List;

/**
 * Condition under which a service is registered.
 *
 * <p>All present clauses must hold. Environment and configuration comparisons are ordinal; a
 * missing configuration value compares as the empty string.
 *
 * @param environments environments in which the service is registered (any of)
 * @param notEnvironments environments in which it is not registered
 * @param configKey configuration key compared by {@code equalsValue} and {@code notEqualsValues}
 * @param equalsValue required configuration value, empty when absent
 * @param notEqualsValues rejected configuration values
 */
public record ConditionalRule(
    List<String> environments,
    List<String> notEnvironments,
    String configKey,
    String equalsValue,
    List<String> notEqualsValues
) {
    public ConditionalRule {
        environments = environments == null ? List.of() : List.copyOf(environments);
        notEnvironments = notEnvironments == null ? List.of() : List.copyOf(notEnvironments);
        configKey = configKey == null ? "" : configKey;
        equalsValue = equalsValue == null ? "" : equalsValue;
        notEqualsValues = notEqualsValues == null ? List.of() : List.copyOf(notEqualsValues);
    }

    public boolean hasEnvironmentClause() {
        return !environments.isEmpty() || !notEnvironments.isEmpty();
    }

    public boolean hasConfigKey() {
        return !configKey.isEmpty();
    }

    public boolean hasConfigComparison() {
        return !equalsValue.isEmpty() || !notEqualsValues.isEmpty();
    }

    /**
     * A configuration clause is usable only when both key and comparison are present.
     */
    public boolean hasConfigClause() {
        return hasConfigKey() && hasConfigComparison();
    }

    /**
     * Whether the rule contributes any usable clause; a rule without one registers unconditionally.
     */
    public boolean isEffective() {
        return hasEnvironmentClause() || hasConfigClause();
    }
}
