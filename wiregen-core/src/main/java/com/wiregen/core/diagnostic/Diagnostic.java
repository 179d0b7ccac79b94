package com.wiregen.core.diagnostic;

import java.util.List;
import java.util.Objects;

/**
 * A reported problem.
 *
 * @param code diagnostic code
 * @param severity effective severity after configuration overrides
 * @param message formatted message
 * @param types qualified names of the affected types
 * @param location source path the problem was found in, {@code null} if not tied to one file
 */
public record Diagnostic(
    DiagnosticCode code,
    Severity severity,
    String message,
    List<String> types,
    String location
) {
    public Diagnostic {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
        types = types == null ? List.of() : List.copyOf(types);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Single-line form: {@code location: error WG012: message}.
     */
    public String format() {
        String prefix = location != null ? location + ": " : "";
        return prefix + severity.name().toLowerCase() + " " + code.id() + ": " + message;
    }
}
