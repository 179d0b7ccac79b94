package com.wiregen.core.graph;

import com.wiregen.core.diagnostic.DiagnosticCode;
import com.wiregen.core.diagnostic.DiagnosticReporter;
import com.wiregen.core.model.DependencyDescriptor;
import com.wiregen.core.model.Edge;
import com.wiregen.core.model.TypeDescriptor;
import com.wiregen.core.model.TypeKind;
import com.wiregen.core.model.TypeRef;
import com.wiregen.core.scanner.ExtractionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the {@link DependencyGraph} from extracted descriptors.
 *
 * <p><b>Merging a type's own declarations:</b>
 * <ul>
 *   <li>a target repeated inside one type-level declaration is reported and kept once</li>
 *   <li>a target repeated across type-level declarations is reported and kept once</li>
 *   <li>a target declared both as an injected field and in a type-level declaration is
 *       reported; the field wins</li>
 *   <li>a target injected into several fields is reported; the first field carries the
 *       dependency and the others share its constructor parameter</li>
 * </ul>
 * External types and external declarations suppress these reports.
 *
 * <p><b>Inheritance:</b> dependencies of every base type in the snapshot are prepended,
 * root-most first, with the base's type variables substituted by the arguments the subclass
 * passes. A target already contributed by a base is not repeated. A dependency whose type
 * variables cannot be bound is reported and skipped; nothing else about the type is affected.
 */
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private final boolean reportUnknownTypes;

    public DependencyGraphBuilder() {
        this(false);
    }

    /**
     * @param reportUnknownTypes whether dependencies on types outside the snapshot are kept as
     *                           {@link Resolution#UNKNOWN} (reported later) instead of external
     */
    public DependencyGraphBuilder(boolean reportUnknownTypes) {
        this.reportUnknownTypes = reportUnknownTypes;
    }

    public DependencyGraph build(ExtractionResult extraction, DiagnosticReporter reporter) {
        Objects.requireNonNull(extraction, "extraction must not be null");
        TypeRegistry registry = new TypeRegistry(extraction.types());
        ImplementationIndex implementations = new ImplementationIndex(registry);

        Map<String, List<DependencyDescriptor>> declared = new HashMap<>();
        for (DependencyDescriptor dependency : extraction.dependencies()) {
            declared.computeIfAbsent(dependency.owner(), k -> new ArrayList<>()).add(dependency);
        }

        Map<String, List<DependencyDescriptor>> merged = new HashMap<>();
        for (TypeDescriptor type : registry.all()) {
            merged.put(type.qualifiedName(),
                mergeOwnDeclarations(type, declared.getOrDefault(type.qualifiedName(), List.of()), reporter));
        }

        Map<String, List<ResolvedDependency>> dependencies = new LinkedHashMap<>();
        Map<String, InheritanceChain> chains = new LinkedHashMap<>();
        List<Edge> edges = new ArrayList<>();
        for (TypeDescriptor type : registry.all()) {
            if (type.kind() == TypeKind.INTERFACE) {
                continue;
            }
            InheritanceChain chain = InheritanceChain.of(type, registry);
            chains.put(type.qualifiedName(), chain);
            if (chain.cyclic() && !type.external()) {
                reporter.report(DiagnosticCode.MALFORMED_MARKER, List.of(type.qualifiedName()), type.sourcePath(),
                    type.qualifiedName(), "superclass chain is cyclic");
            }
            List<ResolvedDependency> resolved = flatten(chain, merged, implementations, registry, reporter);
            dependencies.put(type.qualifiedName(), resolved);
            if (type.isConcrete() && !type.external()) {
                addEdges(type, resolved, edges);
            }
        }

        log.info("Built dependency graph: {} types, {} edges", registry.all().size(), edges.size());
        return new DependencyGraph(registry, dependencies, chains, edges);
    }

    private List<DependencyDescriptor> mergeOwnDeclarations(TypeDescriptor type, List<DependencyDescriptor> own,
                                                            DiagnosticReporter reporter) {
        Map<TypeRef, DependencyDescriptor> firstFields = new HashMap<>();
        for (DependencyDescriptor dependency : own) {
            if (dependency.isField()) {
                firstFields.putIfAbsent(dependency.target(), dependency);
            }
        }
        String owner = type.simpleName();

        List<DependencyDescriptor> result = new ArrayList<>();
        Map<TypeRef, DependencyDescriptor> firstDeclarations = new HashMap<>();
        for (DependencyDescriptor dependency : own) {
            TypeRef target = dependency.target();
            if (dependency.isField()) {
                DependencyDescriptor first = firstFields.get(target);
                if (!first.fieldName().equals(dependency.fieldName())) {
                    // Later fields are assigned from the first field's constructor parameter
                    if (reportable(type, first, dependency)) {
                        reporter.report(DiagnosticCode.DUPLICATE_ACROSS_DECLARATIONS, List.of(type.qualifiedName()),
                            type.sourcePath(), owner, target.toDisplayString());
                    }
                    continue;
                }
                result.add(dependency);
                continue;
            }

            DependencyDescriptor firstDeclaration = firstDeclarations.putIfAbsent(target, dependency);
            if (firstDeclaration != null) {
                if (reportable(type, firstDeclaration, dependency)) {
                    DiagnosticCode code = firstDeclaration.declarationIndex() == dependency.declarationIndex()
                        ? DiagnosticCode.DUPLICATE_IN_DECLARATION
                        : DiagnosticCode.DUPLICATE_ACROSS_DECLARATIONS;
                    reporter.report(code, List.of(type.qualifiedName()), type.sourcePath(), owner,
                        target.toDisplayString());
                }
                continue;
            }
            DependencyDescriptor field = firstFields.get(target);
            if (field != null) {
                if (reportable(type, field, dependency)) {
                    reporter.report(DiagnosticCode.CONFLICTING_DECLARATION_STYLES, List.of(type.qualifiedName()),
                        type.sourcePath(), owner, target.toDisplayString(), field.fieldName());
                }
                continue;
            }
            result.add(dependency);
        }
        return result;
    }

    /**
     * A clash is diagnosed only when neither the type nor either declaration is external.
     */
    private static boolean reportable(TypeDescriptor type, DependencyDescriptor first, DependencyDescriptor second) {
        return !type.external() && !first.external() && !second.external();
    }

    private List<ResolvedDependency> flatten(InheritanceChain chain, Map<String, List<DependencyDescriptor>> merged,
                                             ImplementationIndex implementations, TypeRegistry registry,
                                             DiagnosticReporter reporter) {
        TypeDescriptor owner = chain.owner();
        List<ResolvedDependency> result = new ArrayList<>();
        Set<TypeRef> seen = new HashSet<>();
        for (InheritanceFrame frame : chain.frames()) {
            boolean inherited = frame.type() != owner;
            for (DependencyDescriptor dependency : merged.getOrDefault(frame.type().qualifiedName(), List.of())) {
                TypeRef target = dependency.target().substitute(frame.bindings());
                List<String> unbound = TypeSubstitution.unboundVariables(target, owner.typeParameters());
                if (!unbound.isEmpty()) {
                    if (!owner.external()) {
                        reporter.report(DiagnosticCode.GENERIC_SUBSTITUTION_FAILED, List.of(owner.qualifiedName()),
                            owner.sourcePath(), unbound, dependency.target().toDisplayString(), owner.simpleName());
                    }
                    continue;
                }
                if (!seen.add(target)) {
                    log.debug("{}: dependency {} from {} already provided by a base type",
                        owner.qualifiedName(), target, frame.type().qualifiedName());
                    continue;
                }
                result.add(resolve(dependency.withTarget(target), inherited, frame.type(), implementations, registry));
            }
        }
        return result;
    }

    private ResolvedDependency resolve(DependencyDescriptor dependency, boolean inherited, TypeDescriptor declaring,
                                       ImplementationIndex implementations, TypeRegistry registry) {
        TypeRef target = dependency.target();
        TypeRef element = target.elementType();
        String declaringType = declaring.qualifiedName();

        if (dependency.external()) {
            return new ResolvedDependency(dependency, target, inherited, declaringType, Resolution.EXTERNAL, List.of());
        }
        if (element.typeVariable()) {
            return new ResolvedDependency(dependency, target, inherited, declaringType, Resolution.EXTERNAL, List.of());
        }
        Optional<TypeDescriptor> elementType = registry.find(element.name());
        if (elementType.isEmpty()) {
            Resolution resolution = reportUnknownTypes ? Resolution.UNKNOWN : Resolution.EXTERNAL;
            return new ResolvedDependency(dependency, target, inherited, declaringType, resolution, List.of());
        }
        if (elementType.get().external()) {
            return new ResolvedDependency(dependency, target, inherited, declaringType, Resolution.EXTERNAL, List.of());
        }

        List<TypeDescriptor> all = implementations.implementationsOf(element);
        List<TypeDescriptor> internal = all.stream().filter(t -> !t.external()).toList();
        if (internal.isEmpty()) {
            Resolution resolution = all.isEmpty() ? Resolution.UNRESOLVED : Resolution.EXTERNAL;
            return new ResolvedDependency(dependency, target, inherited, declaringType, resolution, List.of());
        }
        if (target.isCollection()) {
            return new ResolvedDependency(dependency, target, inherited, declaringType, Resolution.RESOLVED,
                names(internal));
        }

        List<TypeDescriptor> services = internal.stream().filter(TypeDescriptor::isService).toList();
        List<TypeDescriptor> pool = services.isEmpty() ? internal : services;
        long unconditional = pool.stream().filter(t -> !t.isConditional()).count();
        Resolution resolution = unconditional > 1 ? Resolution.AMBIGUOUS : Resolution.RESOLVED;
        return new ResolvedDependency(dependency, target, inherited, declaringType, resolution, names(pool));
    }

    private static void addEdges(TypeDescriptor owner, List<ResolvedDependency> dependencies, List<Edge> edges) {
        Set<String> keys = new HashSet<>();
        for (ResolvedDependency dependency : dependencies) {
            if (dependency.resolution() != Resolution.RESOLVED) {
                continue;
            }
            for (String candidate : dependency.candidates()) {
                Edge edge = new Edge(owner.qualifiedName(), candidate, dependency.viaCollection(),
                    dependency.inherited(), dependency.target(), dependency.declaringType());
                if (keys.add(edgeKey(edge))) {
                    edges.add(edge);
                }
            }
        }
    }

    private static String edgeKey(Edge edge) {
        return edge.from() + "->" + edge.to() + (edge.viaCollection() ? "[*]" : "");
    }

    private static List<String> names(List<TypeDescriptor> types) {
        return types.stream().map(TypeDescriptor::qualifiedName).toList();
    }
}
