package com.wiregen.core.validation;

import com.wiregen.core.diagnostic.DiagnosticCode;
import com.wiregen.core.diagnostic.DiagnosticReporter;
import com.wiregen.core.graph.DependencyGraph;
import com.wiregen.core.model.Edge;
import com.wiregen.core.model.Lifetime;
import com.wiregen.core.model.TypeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Checks that no singleton captures a shorter-lived service.
 *
 * <p>Every edge leaving a singleton is checked against the lifetime of the implementation it
 * resolves to: Scoped is an error, Transient a warning, anything else is fine. Edges a type
 * inherits from its base chain are reported with their own codes. Collection edges are checked
 * per implementation, so one collection can produce several diagnostics. External types and
 * dependencies have no edges and are never checked.
 */
public class LifetimeValidator {

    private static final Logger log = LoggerFactory.getLogger(LifetimeValidator.class);

    /**
     * @param graph dependency graph
     * @param reporter receives lifetime diagnostics
     * @return number of violating edges
     */
    public int validate(DependencyGraph graph, DiagnosticReporter reporter) {
        int violations = 0;
        for (Edge edge : graph.edges()) {
            TypeDescriptor dependent = graph.registry().get(edge.from());
            TypeDescriptor dependency = graph.registry().get(edge.to());
            if (dependent.lifetime() != Lifetime.SINGLETON || !dependent.lifetime().isWiderThan(dependency.lifetime())) {
                continue;
            }
            violations++;
            String dependencyName = edge.viaCollection()
                ? edge.dependency().toDisplayString() + " -> " + dependency.simpleName()
                : dependency.simpleName();
            List<String> types = List.of(dependent.qualifiedName(), dependency.qualifiedName());
            boolean scoped = dependency.lifetime() == Lifetime.SCOPED;
            if (edge.inherited()) {
                String declaring = graph.registry().get(edge.declaringType()).simpleName();
                DiagnosticCode code = scoped
                    ? DiagnosticCode.INHERITANCE_LIFETIME_MISMATCH
                    : DiagnosticCode.INHERITANCE_LIFETIME_TRANSIENT;
                reporter.report(code, types, dependent.sourcePath(), dependent.simpleName(), dependencyName, declaring);
            } else {
                DiagnosticCode code = scoped
                    ? DiagnosticCode.LIFETIME_NARROWER_ERROR
                    : DiagnosticCode.LIFETIME_NARROWER_WARNING;
                reporter.report(code, types, dependent.sourcePath(), dependent.simpleName(), dependencyName);
            }
        }
        log.debug("Lifetime validation found {} violating edge(s)", violations);
        return violations;
    }
}
