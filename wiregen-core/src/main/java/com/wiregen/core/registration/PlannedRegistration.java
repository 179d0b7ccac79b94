package com.wiregen.core.registration;

import com.wiregen.core.model.ConditionalRule;
import com.wiregen.core.model.Lifetime;
import com.wiregen.core.model.TypeRef;

import java.util.Objects;

/**
 * One registration call of the generated registration code.
 *
 * @param contract type the service is resolved by
 * @param implementation qualified name of the implementation
 * @param lifetime service lifetime
 * @param kind direct or forwarding
 * @param condition registration condition, {@code null} when unconditional
 */
public record PlannedRegistration(
    TypeRef contract,
    String implementation,
    Lifetime lifetime,
    RegistrationKind kind,
    ConditionalRule condition
) {
    public PlannedRegistration {
        Objects.requireNonNull(contract, "contract must not be null");
        Objects.requireNonNull(implementation, "implementation must not be null");
        Objects.requireNonNull(lifetime, "lifetime must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (!lifetime.isAssigned()) {
            throw new IllegalArgumentException("Registrations need an assigned lifetime: " + implementation);
        }
    }

    public boolean isConditional() {
        return condition != null;
    }

    public boolean isSelfRegistration() {
        return contract.name().equals(implementation);
    }
}
