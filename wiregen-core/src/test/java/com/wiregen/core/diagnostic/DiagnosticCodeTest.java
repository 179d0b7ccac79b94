package com.wiregen.core.diagnostic;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiagnosticCodeTest {

    @Test
    void idsAndNames_areUnique() {
        assertThat(Arrays.stream(DiagnosticCode.values()).map(DiagnosticCode::id)).doesNotHaveDuplicates();
        assertThat(Arrays.stream(DiagnosticCode.values()).map(DiagnosticCode::codeName)).doesNotHaveDuplicates();
    }

    @Test
    void defaultSeverities_matchRuleClasses() {
        assertThat(DiagnosticCode.LIFETIME_NARROWER_ERROR.defaultSeverity()).isEqualTo(Severity.ERROR);
        assertThat(DiagnosticCode.LIFETIME_NARROWER_WARNING.defaultSeverity()).isEqualTo(Severity.WARNING);
        assertThat(DiagnosticCode.SKIP_TARGET_NOT_IMPLEMENTED.defaultSeverity()).isEqualTo(Severity.ERROR);
        assertThat(DiagnosticCode.UNREGISTERED_IMPLEMENTATION.defaultSeverity()).isEqualTo(Severity.WARNING);
        assertThat(DiagnosticCode.EXPLICIT_CONSTRUCTOR.defaultSeverity()).isEqualTo(Severity.INFO);
    }

    @ParameterizedTest
    @CsvSource({
        "WG012, LIFETIME_NARROWER_ERROR",
        "wg012, LIFETIME_NARROWER_ERROR",
        "lifetime-narrower-error, LIFETIME_NARROWER_ERROR",
        "' cycle-detected ', CYCLE_DETECTED"
    })
    void find_acceptsIdOrName(String key, DiagnosticCode expected) {
        assertThat(DiagnosticCode.find(key)).contains(expected);
    }

    @Test
    void find_unknownKey_isEmpty() {
        assertThat(DiagnosticCode.find("WG999")).isEmpty();
        assertThat(DiagnosticCode.find(null)).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
        "error, ERROR",
        "Warning, WARNING",
        "warn, WARNING",
        "info, INFO",
        "off, NONE",
        "hidden, NONE"
    })
    void severityParse_acceptsAliases(String value, Severity expected) {
        assertThat(Severity.parse(value)).isEqualTo(expected);
    }

    @Test
    void severityParse_unknown_throws() {
        assertThatThrownBy(() -> Severity.parse("loud")).isInstanceOf(IllegalArgumentException.class);
    }
}
