package com.wiregen.core.registration;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the generated registration code registers.
 *
 * @param unconditional registrations made unconditionally, in type order
 * @param conditionalGroups conditional registrations grouped by contract
 */
public record RegistrationPlan(
    List<PlannedRegistration> unconditional,
    List<ConditionalGroup> conditionalGroups
) {
    public RegistrationPlan {
        unconditional = unconditional == null ? List.of() : List.copyOf(unconditional);
        conditionalGroups = conditionalGroups == null ? List.of() : List.copyOf(conditionalGroups);
    }

    public static RegistrationPlan empty() {
        return new RegistrationPlan(List.of(), List.of());
    }

    public List<PlannedRegistration> all() {
        List<PlannedRegistration> all = new ArrayList<>(unconditional);
        conditionalGroups.forEach(group -> all.addAll(group.registrations()));
        return all;
    }

    /**
     * Returns whether anything is registered under a contract with this raw name.
     */
    public boolean isRegistered(String contractName) {
        return all().stream().anyMatch(registration -> registration.contract().name().equals(contractName));
    }

    public List<PlannedRegistration> registrationsOf(String implementation) {
        return all().stream().filter(registration -> registration.implementation().equals(implementation)).toList();
    }

    public boolean isEmpty() {
        return unconditional.isEmpty() && conditionalGroups.isEmpty();
    }
}
