package com.wiregen.core.engine;

import com.wiregen.core.diagnostic.Diagnostic;
import com.wiregen.core.diagnostic.Severity;
import com.wiregen.core.graph.DependencyGraph;
import com.wiregen.core.naming.ConstructorLayout;
import com.wiregen.core.registration.RegistrationPlan;
import com.wiregen.core.scanner.ExtractionResult;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of analysing one snapshot.
 *
 * @param extraction extracted descriptors and statistics
 * @param graph dependency graph
 * @param cycles detected cycles, each a list of qualified names closing on its first element
 * @param layouts constructor layouts keyed by qualified type name
 * @param plan registration plan
 * @param diagnostics reported diagnostics, in pipeline order
 * @param suppressedCount diagnostics dropped by configuration
 */
public record AnalysisResult(
    ExtractionResult extraction,
    DependencyGraph graph,
    List<List<String>> cycles,
    Map<String, ConstructorLayout> layouts,
    RegistrationPlan plan,
    List<Diagnostic> diagnostics,
    int suppressedCount
) {
    public AnalysisResult {
        Objects.requireNonNull(extraction, "extraction must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(plan, "plan must not be null");
        cycles = cycles == null ? List.of() : cycles.stream().map(List::copyOf).toList();
        layouts = layouts == null ? Map.of() : Map.copyOf(layouts);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public long count(Severity severity) {
        return diagnostics.stream().filter(d -> d.severity() == severity).count();
    }

    AnalysisResult withDiagnostics(List<Diagnostic> allDiagnostics, int suppressed) {
        return new AnalysisResult(extraction, graph, cycles, layouts, plan, allDiagnostics, suppressed);
    }
}
