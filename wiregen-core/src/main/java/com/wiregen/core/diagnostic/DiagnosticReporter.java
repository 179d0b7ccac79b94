package com.wiregen.core.diagnostic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Collects diagnostics for one run, applying {@link DiagnosticSettings}.
 *
 * <p>Identical diagnostics (same code, message and location) are kept once. Not thread-safe;
 * one reporter belongs to one run.
 */
public class DiagnosticReporter {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticReporter.class);

    private final DiagnosticSettings settings;
    private final Set<Diagnostic> diagnostics = new LinkedHashSet<>();
    private int suppressed;

    public DiagnosticReporter(DiagnosticSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public DiagnosticReporter() {
        this(DiagnosticSettings.defaults());
    }

    /**
     * Reports a diagnostic.
     *
     * @param code diagnostic code
     * @param types affected types
     * @param location source path, may be {@code null}
     * @param args template arguments
     */
    public void report(DiagnosticCode code, List<String> types, String location, Object... args) {
        Severity severity = settings.severityOf(code);
        if (!settings.enabled() || severity == Severity.NONE) {
            suppressed++;
            return;
        }
        Diagnostic diagnostic = new Diagnostic(code, severity, code.format(args), types, location);
        if (diagnostics.add(diagnostic)) {
            log.debug("{}", diagnostic.format());
        }
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public List<Diagnostic> diagnostics(DiagnosticCode code) {
        return diagnostics.stream().filter(d -> d.code() == code).toList();
    }

    public long count(Severity severity) {
        return diagnostics.stream().filter(d -> d.severity() == severity).count();
    }

    public boolean hasErrors() {
        return count(Severity.ERROR) > 0;
    }

    /**
     * Number of diagnostics dropped by the global switch or a {@code NONE} override.
     */
    public int suppressedCount() {
        return suppressed;
    }
}
