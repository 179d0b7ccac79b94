package com.wiregen.core.model;

import java.util.List;
import java.util.Objects;

/**
 * How a service is exposed to the container.
 *
 * @param mode registration mode, {@link RegistrationMode#DIRECT_ONLY} when nothing was declared
 * @param instanceSharing declared sharing, {@code null} when not specified
 * @param modeDeclared whether a register-as-all marker is present
 * @param explicitContracts contracts listed by a register-as marker, empty when absent
 * @param skipped contracts excluded from registration
 */
public record RegistrationDirective(
    RegistrationMode mode,
    InstanceSharing instanceSharing,
    boolean modeDeclared,
    List<TypeRef> explicitContracts,
    List<TypeRef> skipped
) {
    public RegistrationDirective {
        Objects.requireNonNull(mode, "mode must not be null");
        explicitContracts = explicitContracts == null ? List.of() : List.copyOf(explicitContracts);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    public static RegistrationDirective none() {
        return new RegistrationDirective(RegistrationMode.DIRECT_ONLY, null, false, List.of(), List.of());
    }

    public boolean hasExplicitContracts() {
        return !explicitContracts.isEmpty();
    }

    /**
     * Effective sharing: {@link InstanceSharing#SHARED} for singletons, otherwise the declared
     * value. Without one, {@link RegistrationMode#EXCLUSIONARY} shares and every other mode
     * uses {@link InstanceSharing#SEPARATE}.
     *
     * @param lifetime resolved lifetime of the service
     * @return sharing to plan with
     */
    public InstanceSharing effectiveSharing(Lifetime lifetime) {
        if (lifetime == Lifetime.SINGLETON) {
            return InstanceSharing.SHARED;
        }
        if (instanceSharing != null) {
            return instanceSharing;
        }
        return modeDeclared && mode == RegistrationMode.EXCLUSIONARY ? InstanceSharing.SHARED : InstanceSharing.SEPARATE;
    }
}
