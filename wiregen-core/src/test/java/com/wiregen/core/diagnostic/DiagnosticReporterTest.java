package com.wiregen.core.diagnostic;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticReporterTest {

    @Test
    void report_defaultSettings_usesDefaultSeverityAndTemplate() {
        DiagnosticReporter reporter = new DiagnosticReporter();

        reporter.report(DiagnosticCode.LIFETIME_NARROWER_WARNING, List.of("com.acme.Cache", "com.acme.Helper"),
            "com/acme/Cache.java", "Cache", "Helper");

        assertThat(reporter.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.severity()).isEqualTo(Severity.WARNING);
            assertThat(d.message()).startsWith("Singleton service 'Cache' depends on Transient service 'Helper'.");
            assertThat(d.format()).startsWith("com/acme/Cache.java: warning WG013: Singleton service 'Cache'");
        });
        assertThat(reporter.hasErrors()).isFalse();
    }

    @Test
    void report_override_changesSeverity() {
        DiagnosticReporter reporter = new DiagnosticReporter(new DiagnosticSettings(true,
            Map.of(DiagnosticCode.LIFETIME_NARROWER_WARNING, Severity.ERROR)));

        reporter.report(DiagnosticCode.LIFETIME_NARROWER_WARNING, List.of(), null, "Cache", "Helper");

        assertThat(reporter.hasErrors()).isTrue();
        assertThat(reporter.count(Severity.ERROR)).isEqualTo(1);
        assertThat(reporter.diagnostics().get(0).format()).startsWith("error WG013: ");
    }

    @Test
    void report_noneSeverity_isSuppressedAndCounted() {
        DiagnosticReporter reporter = new DiagnosticReporter(new DiagnosticSettings(true,
            Map.of(DiagnosticCode.CYCLE_DETECTED, Severity.NONE)));

        reporter.report(DiagnosticCode.CYCLE_DETECTED, List.of("a.A"), null, "A → A");
        reporter.report(DiagnosticCode.CONDITIONAL_EMPTY, List.of("a.B"), null, "B");

        assertThat(reporter.diagnostics()).extracting(Diagnostic::code).containsExactly(DiagnosticCode.CONDITIONAL_EMPTY);
        assertThat(reporter.suppressedCount()).isEqualTo(1);
    }

    @Test
    void report_globallyDisabled_suppressesEverything() {
        DiagnosticReporter reporter = new DiagnosticReporter(new DiagnosticSettings(false, Map.of()));

        reporter.report(DiagnosticCode.MALFORMED_MARKER, List.of("a.A"), null, "A", "broken");
        reporter.report(DiagnosticCode.SKIP_TARGET_NOT_IMPLEMENTED, List.of("a.A"), null, "A", "IB");

        assertThat(reporter.diagnostics()).isEmpty();
        assertThat(reporter.suppressedCount()).isEqualTo(2);
    }

    @Test
    void report_identicalDiagnostic_isKeptOnce() {
        DiagnosticReporter reporter = new DiagnosticReporter();

        reporter.report(DiagnosticCode.CONDITIONAL_EMPTY, List.of("a.B"), "a/B.java", "B");
        reporter.report(DiagnosticCode.CONDITIONAL_EMPTY, List.of("a.B"), "a/B.java", "B");
        reporter.report(DiagnosticCode.CONDITIONAL_EMPTY, List.of("a.B"), "b/B.java", "B");

        assertThat(reporter.diagnostics()).hasSize(2);
    }
}
