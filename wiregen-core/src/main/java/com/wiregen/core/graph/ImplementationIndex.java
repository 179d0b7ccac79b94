package com.wiregen.core.graph;

import com.wiregen.core.model.TypeDescriptor;
import com.wiregen.core.model.TypeRef;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Maps each type to the concrete types of the snapshot that can be assigned to it.
 *
 * <p>A concrete class declared in the snapshot is its own single implementation. For interfaces
 * and abstract classes every concrete subtype is a candidate; generic contracts match when their
 * type arguments are equal, or by raw name when either side is raw or still open.
 */
public class ImplementationIndex {

    private final TypeRegistry registry;
    private final Map<String, List<Entry>> byContract = new HashMap<>();

    public ImplementationIndex(TypeRegistry registry) {
        this.registry = registry;
        for (TypeDescriptor type : registry.all()) {
            if (!type.isConcrete()) {
                continue;
            }
            for (Supertype supertype : registry.supertypesOf(type)) {
                byContract.computeIfAbsent(supertype.type().name(), k -> new ArrayList<>())
                    .add(new Entry(supertype.type(), type));
            }
        }
    }

    /**
     * Concrete implementations of {@code type}, external ones included, ordered by name.
     *
     * @param type dependency type
     * @return implementing descriptors
     */
    public List<TypeDescriptor> implementationsOf(TypeRef type) {
        Optional<TypeDescriptor> declared = registry.find(type.name());
        if (declared.isPresent() && declared.get().isConcrete()) {
            return List.of(declared.get());
        }
        TreeSet<String> names = new TreeSet<>();
        for (Entry entry : byContract.getOrDefault(type.name(), List.of())) {
            if (matches(entry.contract(), type)) {
                names.add(entry.implementation().qualifiedName());
            }
        }
        return names.stream().map(registry::get).toList();
    }

    private static boolean matches(TypeRef contract, TypeRef requested) {
        if (!contract.isParameterized() || !requested.isParameterized()) {
            return true;
        }
        if (contract.containsTypeVariable() || requested.containsTypeVariable()) {
            return true;
        }
        return contract.equals(requested);
    }

    private record Entry(TypeRef contract, TypeDescriptor implementation) {
    }
}
