package com.wiregen.core.diagnostic;

import java.util.Arrays;
import java.util.Optional;

/**
 * All diagnostics WireGen can report, with their default severities and message templates.
 *
 * <p>Templates use {@link String#format(String, Object...)} placeholders.
 */
public enum DiagnosticCode {

    UNRESOLVED_DEPENDENCY("WG001", "unresolved-dependency", Severity.WARNING,
        "No implementation of '%s' is declared for service '%s'."),
    UNREGISTERED_IMPLEMENTATION("WG002", "unregistered-implementation", Severity.WARNING,
        "Service '%s' depends on '%s', but its implementation '%s' is not registered as that type."),
    CYCLE_DETECTED("WG003", "cycle-detected", Severity.WARNING,
        "Circular dependency detected: %s"),
    SKIP_WITHOUT_REGISTRATION_MODE("WG005", "skip-without-registration-mode", Severity.WARNING,
        "'%s' skips registration of '%s' without @RegisterAsAll; the skip has no effect."),
    DUPLICATE_ACROSS_DECLARATIONS("WG006", "duplicate-across-declarations", Severity.WARNING,
        "'%s' declares dependency '%s' more than once; only the first declaration is used."),
    CONFLICTING_DECLARATION_STYLES("WG007", "conflicting-declaration-styles", Severity.WARNING,
        "'%s' declares '%s' both as an injected field and in a type-level declaration; the field '%s' is used."),
    DUPLICATE_IN_DECLARATION("WG008", "duplicate-in-declaration", Severity.WARNING,
        "'%s' lists '%s' more than once in the same dependency declaration."),
    SKIP_TARGET_NOT_IMPLEMENTED("WG009", "skip-target-not-implemented", Severity.ERROR,
        "'%s' skips registration of '%s', which it does not implement."),
    LIFETIME_NARROWER_ERROR("WG012", "lifetime-narrower-error", Severity.ERROR,
        "Singleton service '%s' depends on Scoped service '%s'. Singleton services cannot capture shorter-lived dependencies."),
    LIFETIME_NARROWER_WARNING("WG013", "lifetime-narrower-warning", Severity.WARNING,
        "Singleton service '%s' depends on Transient service '%s'. Consider whether the transient service should be a singleton or whether the dependency is appropriate."),
    INHERITANCE_LIFETIME_MISMATCH("WG015", "inheritance-lifetime-mismatch", Severity.ERROR,
        "Singleton service '%s' inherits a dependency on Scoped service '%s' from '%s'. Singleton services cannot capture shorter-lived dependencies."),
    INHERITANCE_LIFETIME_TRANSIENT("WG016", "inheritance-lifetime-transient", Severity.WARNING,
        "Singleton service '%s' inherits a dependency on Transient service '%s' from '%s'. Consider whether the transient service should be a singleton."),
    CONDITIONAL_CONFLICTING_ENVIRONMENT("WG020", "conditional-conflicting-environment", Severity.WARNING,
        "'%s' both requires and excludes environment '%s'; it can never be registered."),
    CONDITIONAL_EMPTY("WG022", "conditional-empty", Severity.WARNING,
        "'%s' is marked conditional but declares no condition; it is registered unconditionally."),
    CONDITIONAL_KEY_WITHOUT_COMPARISON("WG023", "conditional-config-key-without-comparison", Severity.WARNING,
        "'%s' names configuration key '%s' without a value to compare; the configuration clause is ignored."),
    CONDITIONAL_COMPARISON_WITHOUT_KEY("WG024", "conditional-comparison-without-config-key", Severity.WARNING,
        "'%s' compares a configuration value without naming a configuration key; the configuration clause is ignored."),
    REGISTER_AS_NOT_IMPLEMENTED("WG029", "register-as-not-implemented", Severity.ERROR,
        "'%s' registers as '%s', which it does not implement."),
    REGISTER_AS_DUPLICATE("WG030", "register-as-duplicate", Severity.WARNING,
        "'%s' lists '%s' more than once in its registration contracts."),
    REGISTER_AS_NOT_INTERFACE("WG031", "register-as-not-interface", Severity.ERROR,
        "'%s' registers as '%s', which is not an interface."),
    IDENTIFIER_COLLISION("WG040", "identifier-collision", Severity.ERROR,
        "Dependencies '%s' and '%s' of '%s' both map to identifier '%s'; no constructor is generated for this type."),
    GENERIC_SUBSTITUTION_FAILED("WG041", "generic-substitution-failed", Severity.WARNING,
        "Cannot resolve type variable(s) %s of dependency '%s' inherited by '%s'; the dependency is skipped."),
    AMBIGUOUS_IMPLEMENTATION("WG042", "ambiguous-implementation", Severity.WARNING,
        "Dependency '%s' of '%s' has several unconditional implementations: %s."),
    MALFORMED_MARKER("WG043", "malformed-marker", Severity.ERROR,
        "Malformed marker on '%s': %s"),
    EMISSION_FAILED("WG044", "emission-failed", Severity.ERROR,
        "Code generation for '%s' failed: %s"),
    EXPLICIT_CONSTRUCTOR("WG045", "explicit-constructor", Severity.INFO,
        "'%s' declares its own constructor; no constructor is generated for it."),
    SOURCE_PARSE_FAILED("WG046", "source-parse-failed", Severity.WARNING,
        "Source file '%s' could not be parsed: %s");

    private final String id;
    private final String codeName;
    private final Severity defaultSeverity;
    private final String template;

    DiagnosticCode(String id, String codeName, Severity defaultSeverity, String template) {
        this.id = id;
        this.codeName = codeName;
        this.defaultSeverity = defaultSeverity;
        this.template = template;
    }

    public String id() {
        return id;
    }

    public String codeName() {
        return codeName;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }

    public String template() {
        return template;
    }

    public String format(Object... args) {
        return String.format(template, args);
    }

    /**
     * Finds a code by id ({@code WG012}) or name ({@code lifetime-narrower-error}), ignoring case.
     *
     * @param key id or name
     * @return the code, empty if unknown
     */
    public static Optional<DiagnosticCode> find(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String trimmed = key.trim();
        return Arrays.stream(values())
            .filter(code -> code.id.equalsIgnoreCase(trimmed) || code.codeName.equalsIgnoreCase(trimmed))
            .findFirst();
    }
}
