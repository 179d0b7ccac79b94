package com.wiregen.core.generator;

import com.wiregen.core.graph.TypeRegistry;
import com.wiregen.core.model.DeclarationSnapshot;
import com.wiregen.core.model.TypeDescriptor;
import com.wiregen.core.naming.ConstructorLayout;
import com.wiregen.core.registration.RegistrationPlan;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a {@link CodeGenerator} reads.
 *
 * @param snapshot analysed source units
 * @param registry extracted types
 * @param layouts constructor layouts keyed by qualified type name
 * @param plan registration plan
 */
public record GenerationInput(
    DeclarationSnapshot snapshot,
    TypeRegistry registry,
    Map<String, ConstructorLayout> layouts,
    RegistrationPlan plan
) {
    public GenerationInput {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(registry, "registry must not be null");
        layouts = layouts == null ? Map.of() : Map.copyOf(layouts);
        if (plan == null) {
            plan = RegistrationPlan.empty();
        }
    }

    /**
     * Types declared in the source unit at {@code path} that have a constructor layout, in type order.
     */
    public List<TypeDescriptor> typesWithLayoutIn(String path) {
        return registry.all().stream()
            .filter(type -> type.sourcePath().equals(path))
            .filter(type -> layouts.containsKey(type.qualifiedName()))
            .toList();
    }
}
