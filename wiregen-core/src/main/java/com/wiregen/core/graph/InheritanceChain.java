package com.wiregen.core.graph;

import com.wiregen.core.model.TypeDescriptor;
import com.wiregen.core.model.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Superclass chain of a type within the snapshot, root-most first, the type itself last.
 *
 * @param frames chain frames
 * @param cyclic whether the superclass chain loops back on itself
 */
public record InheritanceChain(List<InheritanceFrame> frames, boolean cyclic) {

    public InheritanceChain {
        frames = List.copyOf(frames);
    }

    /**
     * Walks the superclass references of {@code type} until one leaves the snapshot.
     *
     * @param type most derived type
     * @param registry declarations of the run
     * @return the chain
     */
    public static InheritanceChain of(TypeDescriptor type, TypeRegistry registry) {
        List<InheritanceFrame> frames = new ArrayList<>();
        frames.add(new InheritanceFrame(type, Map.of()));
        Set<String> visited = new HashSet<>();
        visited.add(type.qualifiedName());

        TypeDescriptor current = type;
        Map<String, TypeRef> currentBindings = Map.of();
        boolean cyclic = false;
        while (current.superclass() != null) {
            TypeRef reference = current.superclass().substitute(currentBindings);
            Optional<TypeDescriptor> base = registry.find(reference.name());
            if (base.isEmpty()) {
                break;
            }
            if (!visited.add(base.get().qualifiedName())) {
                cyclic = true;
                break;
            }
            Map<String, TypeRef> bindings = TypeSubstitution.bind(base.get().typeParameters(), reference);
            frames.add(new InheritanceFrame(base.get(), bindings));
            current = base.get();
            currentBindings = bindings;
        }
        Collections.reverse(frames);
        return new InheritanceChain(frames, cyclic);
    }

    /**
     * The most derived type.
     */
    public TypeDescriptor owner() {
        return frames.get(frames.size() - 1).type();
    }

    /**
     * Frames of the base types, without the owner.
     */
    public List<InheritanceFrame> bases() {
        return frames.subList(0, frames.size() - 1);
    }

    /**
     * Direct superclass within the snapshot, if any.
     */
    public Optional<TypeDescriptor> directBase() {
        return frames.size() > 1 ? Optional.of(frames.get(frames.size() - 2).type()) : Optional.empty();
    }
}
