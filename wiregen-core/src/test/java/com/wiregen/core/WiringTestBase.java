package com.wiregen.core;

import com.wiregen.core.diagnostic.Diagnostic;
import com.wiregen.core.diagnostic.DiagnosticCode;
import com.wiregen.core.diagnostic.DiagnosticReporter;
import com.wiregen.core.graph.DependencyGraph;
import com.wiregen.core.graph.DependencyGraphBuilder;
import com.wiregen.core.model.DeclarationSnapshot;
import com.wiregen.core.model.SourceUnit;
import com.wiregen.core.scanner.ExtractionResult;
import com.wiregen.core.scanner.MetadataExtractor;
import org.junit.jupiter.api.BeforeEach;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for tests that analyse in-memory Java sources.
 *
 * <p>Sources are added with {@link #source(String, String)}; every helper analyses the current
 * set from scratch and reports into {@link #reporter}.
 */
public abstract class WiringTestBase {

    private final List<SourceUnit> units = new ArrayList<>();

    protected DiagnosticReporter reporter;

    @BeforeEach
    void resetReporter() {
        reporter = new DiagnosticReporter();
    }

    /**
     * Adds a source unit.
     *
     * @param path path relative to the source root (e.g., "com/acme/Cache.java")
     * @param content Java source
     */
    protected void source(String path, String content) {
        units.add(new SourceUnit(path, content));
    }

    protected DeclarationSnapshot snapshot() {
        return new DeclarationSnapshot(units);
    }

    protected ExtractionResult extract() {
        return new MetadataExtractor().extract(snapshot(), reporter);
    }

    protected DependencyGraph buildGraph() {
        return new DependencyGraphBuilder().build(extract(), reporter);
    }

    protected List<Diagnostic> diagnostics(DiagnosticCode code) {
        return reporter.diagnostics(code);
    }

    protected List<String> reportedIds() {
        return reporter.diagnostics().stream().map(d -> d.code().id()).toList();
    }
}
