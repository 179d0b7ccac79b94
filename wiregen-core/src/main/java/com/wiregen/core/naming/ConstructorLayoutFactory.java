package com.wiregen.core.naming;

import com.wiregen.core.diagnostic.DiagnosticCode;
import com.wiregen.core.diagnostic.DiagnosticReporter;
import com.wiregen.core.graph.DependencyGraph;
import com.wiregen.core.graph.InheritanceChain;
import com.wiregen.core.graph.InheritanceFrame;
import com.wiregen.core.graph.ResolvedDependency;
import com.wiregen.core.graph.TypeSubstitution;
import com.wiregen.core.model.ConfigurationField;
import com.wiregen.core.model.DependencyDescriptor;
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
import java.util.stream.Collectors;

/**
 * Computes the {@link ConstructorLayout} of every class that needs a generated constructor.
 *
 * <p>A class gets a layout when it has at least one dependency (own or inherited), declares no
 * constructor of its own and is not external. The parameters forwarded to the base are those of
 * the direct base's own layout, with the base's type variables bound as the class extends it. A
 * base without a layout takes no arguments.
 *
 * <p>An own dependency that a base already provides reuses the inherited parameter for its field,
 * and a field repeating the type of an earlier injected field reuses that field's parameter.
 * Two parameters or two fields with the same identifier are reported and no layout is produced
 * for the class.
 *
 * <p>Fields bound to configuration read from one {@code configuration} parameter, which goes
 * last and is forwarded to the base like any other parameter. A class whose base takes
 * arguments gets a layout even without dependencies of its own.
 */
public class ConstructorLayoutFactory {

    private static final Logger log = LoggerFactory.getLogger(ConstructorLayoutFactory.class);

    /** Type of the parameter that configuration-bound fields are read from. */
    public static final TypeRef CONFIGURATION_TYPE = TypeRef.of("com.wiregen.api.container.Configuration");

    private static final String CONFIGURATION_PARAMETER = "configuration";
    private static final String CONFIGURATION_ORIGIN = "configuration";

    private final NamingResolver naming;

    public ConstructorLayoutFactory(NamingResolver naming) {
        this.naming = Objects.requireNonNull(naming, "naming must not be null");
    }

    /**
     * @param graph dependency graph of the run
     * @param extraction extracted descriptors, for own declarations hidden by inherited ones
     * @param reporter receives collision and explicit constructor diagnostics
     * @return layouts keyed by qualified type name, in type order
     */
    public Map<String, ConstructorLayout> createAll(DependencyGraph graph, ExtractionResult extraction,
                                                    DiagnosticReporter reporter) {
        Map<String, Optional<ConstructorLayout>> cache = new HashMap<>();
        Map<String, ConstructorLayout> layouts = new LinkedHashMap<>();
        for (TypeDescriptor type : graph.types()) {
            layoutOf(type, graph, extraction, reporter, cache)
                .ifPresent(layout -> layouts.put(type.qualifiedName(), layout));
        }
        log.debug("Computed {} constructor layout(s)", layouts.size());
        return layouts;
    }

    private Optional<ConstructorLayout> layoutOf(TypeDescriptor type, DependencyGraph graph,
                                                 ExtractionResult extraction, DiagnosticReporter reporter,
                                                 Map<String, Optional<ConstructorLayout>> cache) {
        Optional<ConstructorLayout> cached = cache.get(type.qualifiedName());
        if (cached != null) {
            return cached;
        }
        // Placeholder stops recursion through cyclic superclass chains
        cache.put(type.qualifiedName(), Optional.empty());
        Optional<ConstructorLayout> layout = create(type, graph, extraction, reporter, cache);
        cache.put(type.qualifiedName(), layout);
        return layout;
    }

    private Optional<ConstructorLayout> create(TypeDescriptor type, DependencyGraph graph,
                                               ExtractionResult extraction, DiagnosticReporter reporter,
                                               Map<String, Optional<ConstructorLayout>> cache) {
        String name = type.qualifiedName();
        if (type.kind() != TypeKind.CLASS || type.external()) {
            return Optional.empty();
        }
        List<ResolvedDependency> dependencies = graph.dependenciesOf(name);
        List<ConfigurationField> configurationFields = extraction.configurationFieldsOf(name);
        InheritanceChain chain = graph.chainOf(name);
        Optional<ConstructorLayout> baseLayout = chain.directBase()
            .flatMap(base -> layoutOf(base, graph, extraction, reporter, cache));
        if (dependencies.isEmpty() && configurationFields.isEmpty() && baseLayout.isEmpty()) {
            return Optional.empty();
        }
        if (type.explicitConstructor()) {
            reporter.report(DiagnosticCode.EXPLICIT_CONSTRUCTOR, List.of(name), type.sourcePath(), type.simpleName());
            return Optional.empty();
        }

        List<ConstructorParameter> parameters = new ArrayList<>();
        if (baseLayout.isPresent()) {
            InheritanceFrame baseFrame = chain.frames().get(chain.frames().size() - 2);
            for (ConstructorParameter parameter : baseLayout.get().parameters()) {
                TypeRef forwarded = parameter.type().substitute(baseFrame.bindings());
                List<String> unbound = TypeSubstitution.unboundVariables(forwarded, type.typeParameters());
                if (!unbound.isEmpty()) {
                    reporter.report(DiagnosticCode.EMISSION_FAILED, List.of(name), type.sourcePath(),
                        type.simpleName(), "cannot forward base constructor parameter '" + parameter.name()
                            + "' of type " + parameter.type().toDisplayString());
                    return Optional.empty();
                }
                parameters.add(new ConstructorParameter(parameter.name(), forwarded, true, parameter.origin()));
            }
        }

        List<FieldAssignment> assignments = new ArrayList<>();
        for (ResolvedDependency dependency : dependencies) {
            if (dependency.inherited()) {
                continue;
            }
            DependencyDescriptor descriptor = dependency.descriptor();
            TypeRef target = dependency.target();
            String parameterName = descriptor.isField()
                ? naming.parameterNameForField(descriptor.fieldName())
                : naming.parameterName(target, descriptor.naming());
            parameters.add(new ConstructorParameter(parameterName, target, false, target.toDisplayString()));
            assignments.add(assignment(descriptor, target, parameterName));
        }
        assignments.addAll(sharedAssignments(name, parameters, assignments, extraction));
        List<ConfigurationBinding> bindings = configurationBindings(configurationFields, parameters);

        List<Identifier> fields = new ArrayList<>();
        assignments.forEach(a -> fields.add(new Identifier(a.fieldName(), a.type().toDisplayString())));
        bindings.forEach(b -> fields.add(new Identifier(b.field().fieldName(), CONFIGURATION_ORIGIN)));
        if (hasCollision(type, parameters.stream().map(p -> new Identifier(p.name(), p.origin())).toList(), reporter)
            || hasCollision(type, fields, reporter)) {
            return Optional.empty();
        }
        return Optional.of(new ConstructorLayout(name, parameters, assignments, bindings));
    }

    /**
     * Binds configuration fields to the configuration parameter forwarded from the base, or to
     * a new own parameter when the base has none.
     */
    private static List<ConfigurationBinding> configurationBindings(List<ConfigurationField> configurationFields,
                                                                    List<ConstructorParameter> parameters) {
        if (configurationFields.isEmpty()) {
            return List.of();
        }
        String parameterName = null;
        for (ConstructorParameter parameter : parameters) {
            if (parameter.inherited() && parameter.type().equals(CONFIGURATION_TYPE)) {
                parameterName = parameter.name();
                break;
            }
        }
        if (parameterName == null) {
            parameterName = CONFIGURATION_PARAMETER;
            parameters.add(new ConstructorParameter(parameterName, CONFIGURATION_TYPE, false, CONFIGURATION_ORIGIN));
        }
        List<ConfigurationBinding> bindings = new ArrayList<>();
        for (ConfigurationField field : configurationFields) {
            bindings.add(new ConfigurationBinding(field, parameterName));
        }
        return bindings;
    }

    /**
     * Own declarations that carry no dependency of their own: fields repeating the target of an
     * earlier field, and declarations whose target a base already provides. Their fields are
     * assigned from the parameter of that target. An injected field wins over a type-level
     * declaration of the same target.
     */
    private List<FieldAssignment> sharedAssignments(String owner, List<ConstructorParameter> parameters,
                                                    List<FieldAssignment> assignments,
                                                    ExtractionResult extraction) {
        Map<TypeRef, String> ownParameters = new HashMap<>();
        Set<String> assignedFields = new HashSet<>();
        for (FieldAssignment assignment : assignments) {
            ownParameters.putIfAbsent(assignment.type(), assignment.parameterName());
            assignedFields.add(assignment.fieldName());
        }
        List<DependencyDescriptor> declared = extraction.dependenciesOf(owner);
        Set<TypeRef> fieldTargets = declared.stream()
            .filter(DependencyDescriptor::isField)
            .map(DependencyDescriptor::target)
            .collect(Collectors.toSet());

        List<FieldAssignment> shared = new ArrayList<>();
        Set<TypeRef> hiddenDeclarations = new HashSet<>();
        for (DependencyDescriptor descriptor : declared) {
            TypeRef target = descriptor.target();
            if (descriptor.isField()) {
                if (!assignedFields.add(descriptor.fieldName())) {
                    continue;
                }
            } else if (ownParameters.containsKey(target) || fieldTargets.contains(target)
                || !hiddenDeclarations.add(target)) {
                continue;
            }
            Optional<String> parameter = Optional.ofNullable(ownParameters.get(target))
                .or(() -> inheritedParameter(parameters, target));
            parameter.ifPresent(name -> shared.add(assignment(descriptor, target, name)));
        }
        return shared;
    }

    private static Optional<String> inheritedParameter(List<ConstructorParameter> parameters, TypeRef type) {
        return parameters.stream()
            .filter(ConstructorParameter::inherited)
            .filter(p -> p.type().equals(type))
            .map(ConstructorParameter::name)
            .findFirst();
    }

    private FieldAssignment assignment(DependencyDescriptor descriptor, TypeRef target, String parameterName) {
        if (descriptor.isField()) {
            return new FieldAssignment(descriptor.fieldName(), target, parameterName, false);
        }
        return new FieldAssignment(naming.fieldName(target, descriptor.naming()), target, parameterName, true);
    }

    private static boolean hasCollision(TypeDescriptor type, List<Identifier> identifiers,
                                        DiagnosticReporter reporter) {
        Map<String, Identifier> seen = new HashMap<>();
        boolean collision = false;
        for (Identifier identifier : identifiers) {
            Identifier previous = seen.putIfAbsent(identifier.name(), identifier);
            if (previous != null) {
                reporter.report(DiagnosticCode.IDENTIFIER_COLLISION, List.of(type.qualifiedName()), type.sourcePath(),
                    previous.origin(), identifier.origin(), type.simpleName(), identifier.name());
                collision = true;
            }
        }
        return collision;
    }

    private record Identifier(String name, String origin) {
    }
}
