package com.wiregen.core.diagnostic;

import java.util.EnumMap;
import java.util.Map;

/**
 * Run-wide diagnostic configuration: a global switch and per-code severity overrides.
 *
 * @param enabled when {@code false} nothing is reported
 * @param overrides severity per code
 */
public record DiagnosticSettings(boolean enabled, Map<DiagnosticCode, Severity> overrides) {

    public DiagnosticSettings {
        overrides = overrides == null || overrides.isEmpty()
            ? Map.of()
            : Map.copyOf(new EnumMap<>(overrides));
    }

    public static DiagnosticSettings defaults() {
        return new DiagnosticSettings(true, Map.of());
    }

    public Severity severityOf(DiagnosticCode code) {
        return overrides.getOrDefault(code, code.defaultSeverity());
    }
}
