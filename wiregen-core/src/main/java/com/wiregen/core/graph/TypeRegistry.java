package com.wiregen.core.graph;

import com.wiregen.core.model.TypeDescriptor;
import com.wiregen.core.model.TypeRef;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup of the type descriptors of one run by qualified name.
 */
public class TypeRegistry {

    private final Map<String, TypeDescriptor> types = new LinkedHashMap<>();

    public TypeRegistry(Collection<TypeDescriptor> descriptors) {
        descriptors.stream()
            .sorted((a, b) -> a.qualifiedName().compareTo(b.qualifiedName()))
            .forEach(descriptor -> types.putIfAbsent(descriptor.qualifiedName(), descriptor));
    }

    public Optional<TypeDescriptor> find(String qualifiedName) {
        return Optional.ofNullable(types.get(qualifiedName));
    }

    public TypeDescriptor get(String qualifiedName) {
        TypeDescriptor descriptor = types.get(qualifiedName);
        if (descriptor == null) {
            throw new IllegalArgumentException("Unknown type: " + qualifiedName);
        }
        return descriptor;
    }

    public boolean contains(String qualifiedName) {
        return types.containsKey(qualifiedName);
    }

    /**
     * All descriptors ordered by qualified name.
     */
    public List<TypeDescriptor> all() {
        return List.copyOf(types.values());
    }

    /**
     * Every superclass and interface of {@code type}, transitively, with type arguments
     * substituted into {@code type}'s context. Supertypes declared outside the snapshot are
     * included but not expanded further. Breadth first, so direct supertypes come first.
     *
     * @param type type whose supertypes to collect
     * @return supertypes without duplicates
     */
    public List<Supertype> supertypesOf(TypeDescriptor type) {
        Set<Supertype> result = new LinkedHashSet<>();
        Set<String> expanded = new HashSet<>();
        expanded.add(type.qualifiedName());

        Deque<Supertype> queue = new ArrayDeque<>(directSupertypes(type, Map.of()));
        while (!queue.isEmpty()) {
            Supertype current = queue.poll();
            if (!result.add(current)) {
                continue;
            }
            TypeDescriptor declaration = types.get(current.type().name());
            if (declaration == null || !expanded.add(declaration.qualifiedName())) {
                continue;
            }
            Map<String, TypeRef> bindings = TypeSubstitution.bind(declaration.typeParameters(), current.type());
            queue.addAll(directSupertypes(declaration, bindings));
        }
        return new ArrayList<>(result);
    }

    private List<Supertype> directSupertypes(TypeDescriptor type, Map<String, TypeRef> bindings) {
        List<Supertype> direct = new ArrayList<>();
        if (type.superclass() != null) {
            direct.add(new Supertype(type.superclass().substitute(bindings), isInterface(type.superclass(), false)));
        }
        for (TypeRef implemented : type.interfaces()) {
            direct.add(new Supertype(implemented.substitute(bindings), isInterface(implemented, true)));
        }
        return direct;
    }

    private boolean isInterface(TypeRef reference, boolean declaredAsInterface) {
        TypeDescriptor declaration = types.get(reference.name());
        return declaration != null ? declaration.isInterface() : declaredAsInterface;
    }
}
