package com.wiregen.core.registration;

import com.wiregen.core.model.ConditionalRule;
import com.wiregen.core.model.TypeRef;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Conditional registrations of one contract, in type order.
 *
 * <p>When the conditions exclude each other the group is emitted as an if/else-if chain
 * evaluated once, so the first matching implementation wins; otherwise each registration is
 * guarded by its own {@code if}.
 *
 * @param contract the shared contract
 * @param registrations conditional registrations for it
 */
public record ConditionalGroup(TypeRef contract, List<PlannedRegistration> registrations) {

    public ConditionalGroup {
        Objects.requireNonNull(contract, "contract must not be null");
        registrations = List.copyOf(registrations);
    }

    public boolean isMutuallyExclusive() {
        return mutuallyExclusive(registrations.stream().map(PlannedRegistration::condition).toList());
    }

    /**
     * Conditions exclude each other when each names distinct environments, or each compares
     * the same configuration key against a distinct value.
     *
     * @param conditions conditions of one contract
     * @return true when at most one of them can hold
     */
    public static boolean mutuallyExclusive(List<ConditionalRule> conditions) {
        if (conditions.size() < 2) {
            return false;
        }
        return distinctEnvironments(conditions) || distinctConfigValues(conditions);
    }

    private static boolean distinctEnvironments(List<ConditionalRule> conditions) {
        Set<String> seen = new HashSet<>();
        for (ConditionalRule condition : conditions) {
            if (condition.environments().isEmpty()) {
                return false;
            }
            for (String environment : condition.environments()) {
                if (!seen.add(environment)) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean distinctConfigValues(List<ConditionalRule> conditions) {
        String key = conditions.get(0).configKey();
        if (key.isEmpty()) {
            return false;
        }
        Set<String> values = new HashSet<>();
        for (ConditionalRule condition : conditions) {
            if (!condition.configKey().equals(key) || condition.equalsValue().isEmpty()
                || !values.add(condition.equalsValue())) {
                return false;
            }
        }
        return true;
    }
}
