package com.wiregen.core.validation;

import com.wiregen.core.diagnostic.DiagnosticCode;
import com.wiregen.core.diagnostic.DiagnosticReporter;
import com.wiregen.core.graph.DependencyGraph;
import com.wiregen.core.graph.ResolvedDependency;
import com.wiregen.core.model.TypeDescriptor;
import com.wiregen.core.registration.RegistrationPlan;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Checks that the dependencies of every registered service can be satisfied by the planned
 * registrations.
 *
 * <ul>
 *   <li>declared type without implementations: unresolved (collections may be empty)</li>
 *   <li>type outside the snapshot: unresolved, only when unknown types are reported</li>
 *   <li>implementations exist but none is registered as the dependency type: unregistered</li>
 *   <li>several unconditional implementations: ambiguous</li>
 * </ul>
 */
public class DependencyResolutionValidator {

    public void validate(DependencyGraph graph, RegistrationPlan plan, DiagnosticReporter reporter) {
        for (TypeDescriptor owner : graph.types()) {
            if (!owner.isConcrete() || !owner.isService() || owner.external()) {
                continue;
            }
            for (ResolvedDependency dependency : graph.dependenciesOf(owner.qualifiedName())) {
                check(owner, dependency, graph, plan, reporter);
            }
        }
    }

    private static void check(TypeDescriptor owner, ResolvedDependency dependency, DependencyGraph graph,
                              RegistrationPlan plan, DiagnosticReporter reporter) {
        List<String> affected = List.of(owner.qualifiedName());
        String dependencyName = dependency.element().toDisplayString();
        switch (dependency.resolution()) {
            case EXTERNAL -> {
                // Provided outside the analysed sources
            }
            case UNKNOWN -> reporter.report(DiagnosticCode.UNRESOLVED_DEPENDENCY, affected, owner.sourcePath(),
                dependencyName, owner.simpleName());
            case UNRESOLVED -> {
                if (!dependency.viaCollection()) {
                    reporter.report(DiagnosticCode.UNRESOLVED_DEPENDENCY, affected, owner.sourcePath(),
                        dependencyName, owner.simpleName());
                }
            }
            case AMBIGUOUS -> reporter.report(DiagnosticCode.AMBIGUOUS_IMPLEMENTATION, affected, owner.sourcePath(),
                dependency.target().toDisplayString(), owner.simpleName(),
                dependency.candidates().stream()
                    .map(name -> graph.registry().get(name).simpleName())
                    .collect(Collectors.joining(", ")));
            case RESOLVED -> {
                for (String candidate : dependency.candidates()) {
                    boolean registered = plan.registrationsOf(candidate).stream()
                        .anyMatch(r -> r.contract().name().equals(dependency.element().name()));
                    if (!registered) {
                        reporter.report(DiagnosticCode.UNREGISTERED_IMPLEMENTATION,
                            List.of(owner.qualifiedName(), candidate), owner.sourcePath(),
                            owner.simpleName(), dependencyName, graph.registry().get(candidate).simpleName());
                    }
                }
            }
        }
    }
}
