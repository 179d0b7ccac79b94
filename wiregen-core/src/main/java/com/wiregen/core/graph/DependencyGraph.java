package com.wiregen.core.graph;

import com.wiregen.core.model.Edge;
import com.wiregen.core.model.TypeDescriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only dependency graph of one run.
 *
 * <p>Holds, for every class and record, its full dependency list (inherited first, root-most
 * base first, then its own) and the edges from concrete, non-external types to the
 * implementations they require. Collection edges are tagged rather than kept in a separate
 * graph.
 */
public class DependencyGraph {

    private final TypeRegistry registry;
    private final Map<String, List<ResolvedDependency>> dependencies;
    private final Map<String, InheritanceChain> chains;
    private final List<Edge> edges;
    private final Map<String, List<Edge>> edgesFrom = new LinkedHashMap<>();

    public DependencyGraph(TypeRegistry registry,
                           Map<String, List<ResolvedDependency>> dependencies,
                           Map<String, InheritanceChain> chains,
                           List<Edge> edges) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.dependencies = Map.copyOf(dependencies);
        this.chains = Map.copyOf(chains);
        this.edges = List.copyOf(edges);
        for (Edge edge : this.edges) {
            edgesFrom.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge);
        }
    }

    public TypeRegistry registry() {
        return registry;
    }

    public List<TypeDescriptor> types() {
        return registry.all();
    }

    /**
     * Full dependency list of a type, empty for interfaces and unknown names.
     */
    public List<ResolvedDependency> dependenciesOf(String qualifiedName) {
        return dependencies.getOrDefault(qualifiedName, List.of());
    }

    public InheritanceChain chainOf(String qualifiedName) {
        InheritanceChain chain = chains.get(qualifiedName);
        if (chain == null) {
            throw new IllegalArgumentException("No inheritance chain for " + qualifiedName);
        }
        return chain;
    }

    public List<Edge> edges() {
        return edges;
    }

    public List<Edge> edgesFrom(String qualifiedName) {
        return edgesFrom.getOrDefault(qualifiedName, List.of());
    }

    /**
     * Targets of the non-collection edges leaving a type, in edge order.
     */
    public List<String> hardSuccessors(String qualifiedName) {
        return edgesFrom(qualifiedName).stream()
            .filter(Edge::isHard)
            .map(Edge::to)
            .distinct()
            .toList();
    }
}
