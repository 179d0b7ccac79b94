package com.wiregen.core.generator.impl;

import com.wiregen.core.diagnostic.DiagnosticCode;
import com.wiregen.core.diagnostic.DiagnosticReporter;
import com.wiregen.core.generator.CodeGenerator;
import com.wiregen.core.generator.GenerationInput;
import com.wiregen.core.generator.GeneratorConfig;
import com.wiregen.core.model.ConditionalRule;
import com.wiregen.core.registration.ConditionalGroup;
import com.wiregen.core.registration.PlannedRegistration;
import com.wiregen.core.registration.RegistrationKind;
import com.wiregen.core.registration.RegistrationPlan;
import com.wiregen.core.renderer.GeneratedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.lang.model.SourceVersion;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Generates the registration entry point: one static method that adds every planned
 * registration to a {@code ServiceCollection}.
 *
 * <h2>Output shape</h2>
 * <pre>{@code
 * public static ServiceCollection addWireGenServices(ServiceCollection services,
 *                                                    Map<String, String> configuration) {
 *     String environment = Objects.requireNonNullElse(System.getenv("WIREGEN_ENVIRONMENT"), "");
 *     services.add(ServiceLifetime.SINGLETON, com.acme.Cache.class, com.acme.Cache.class);
 *     services.addFactory(ServiceLifetime.SINGLETON, com.acme.ICache.class,
 *         provider -> provider.getRequiredService(com.acme.Cache.class));
 *     if ("Dev".equals(environment)) {
 *         services.add(ServiceLifetime.SCOPED, com.acme.IEmail.class, com.acme.FakeEmail.class);
 *     } else if ("Prod".equals(environment)) {
 *         services.add(ServiceLifetime.SCOPED, com.acme.IEmail.class, com.acme.SmtpEmail.class);
 *     }
 *     return services;
 * }
 * }</pre>
 *
 * <p>When a generated constructor binds configuration values, the configuration map is first
 * registered as a singleton {@code Configuration}. Unconditional registrations come next, then
 * one block per conditional contract. Contracts
 * are written as raw class literals; a registration whose names are not valid Java names is
 * reported and left out.
 */
public class RegistrationGenerator implements CodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(RegistrationGenerator.class);

    private static final String GENERATOR_ID = "registrations";
    private static final String GENERATOR_DISPLAY_NAME = "Registration Generator";

    private static final String API_PACKAGE = "com.wiregen.api.container";
    private static final String INDENT = "    ";
    private static final String BODY_INDENT = INDENT + INDENT;
    private static final String ENVIRONMENT = "environment";
    private static final String CONFIGURATION = "configuration";

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public List<GeneratedFile> generate(GenerationInput input, GeneratorConfig config, DiagnosticReporter reporter) {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(config, "config must not be null");
        RegistrationPlan plan = input.plan();

        List<String> body = new ArrayList<>();
        boolean bindsConfiguration = input.layouts().values().stream()
            .anyMatch(layout -> !layout.configurationBindings().isEmpty());
        if (bindsConfiguration) {
            body.add(BODY_INDENT + "services.addFactory(ServiceLifetime.SINGLETON, Configuration.class, "
                + "provider -> Configuration.of(" + CONFIGURATION + "));");
        }
        for (PlannedRegistration registration : plan.unconditional()) {
            if (isRenderable(registration, input, reporter)) {
                body.add(BODY_INDENT + registrationCall(registration));
            }
        }
        for (ConditionalGroup group : plan.conditionalGroups()) {
            body.addAll(conditionalBlock(group, input, reporter));
        }

        boolean usesEnvironment = plan.conditionalGroups().stream()
            .flatMap(group -> group.registrations().stream())
            .anyMatch(registration -> registration.condition().hasEnvironmentClause());

        String content = renderClass(config, body, usesEnvironment, bindsConfiguration);
        log.info("Generated {} with {} registration statement(s)", config.registrationPath(), plan.all().size());
        return List.of(new GeneratedFile(config.registrationPath(), content, GENERATOR_ID));
    }

    private String renderClass(GeneratorConfig config, List<String> body, boolean usesEnvironment,
                               boolean bindsConfiguration) {
        StringBuilder sb = new StringBuilder();
        sb.append("// Generated by WireGen. Do not edit.\n");
        if (!config.packageName().isEmpty()) {
            sb.append("package ").append(config.packageName()).append(";\n\n");
        }
        if (bindsConfiguration) {
            sb.append("import ").append(API_PACKAGE).append(".Configuration;\n");
        }
        sb.append("import ").append(API_PACKAGE).append(".ServiceCollection;\n");
        sb.append("import ").append(API_PACKAGE).append(".ServiceLifetime;\n\n");
        sb.append("import java.util.Map;\n");
        if (usesEnvironment) {
            sb.append("import java.util.Objects;\n");
        }
        sb.append('\n');

        sb.append("public final class ").append(config.className()).append(" {\n\n");
        sb.append(INDENT).append("private ").append(config.className()).append("() {\n");
        sb.append(INDENT).append("}\n\n");
        sb.append(INDENT).append("public static ServiceCollection ").append(config.methodName())
            .append("(ServiceCollection services, Map<String, String> ").append(CONFIGURATION).append(") {\n");
        if (usesEnvironment) {
            sb.append(BODY_INDENT).append("String ").append(ENVIRONMENT)
                .append(" = Objects.requireNonNullElse(System.getenv(")
                .append(literal(config.environmentVariable())).append("), \"\");\n");
        }
        body.forEach(line -> sb.append(line).append('\n'));
        sb.append(BODY_INDENT).append("return services;\n");
        sb.append(INDENT).append("}\n");
        sb.append("}\n");
        return sb.toString();
    }

    /**
     * Mutually exclusive conditions become one if/else-if chain, anything else one {@code if} per
     * registration. Exclusivity is judged over the registrations that are actually written.
     * Adjacent alternatives of one implementation share a single {@code if} joined with {@code ||}.
     */
    private List<String> conditionalBlock(ConditionalGroup group, GenerationInput input, DiagnosticReporter reporter) {
        List<PlannedRegistration> registrations = group.registrations().stream()
            .filter(registration -> isRenderable(registration, input, reporter))
            .toList();
        List<String> lines = new ArrayList<>();
        if (ConditionalGroup.mutuallyExclusive(registrations.stream().map(PlannedRegistration::condition).toList())) {
            for (int i = 0; i < registrations.size(); i++) {
                PlannedRegistration registration = registrations.get(i);
                if (i > 0) {
                    lines.set(lines.size() - 1,
                        BODY_INDENT + "} else if (" + condition(registration.condition()) + ") {");
                } else {
                    lines.add(BODY_INDENT + "if (" + condition(registration.condition()) + ") {");
                }
                lines.add(BODY_INDENT + INDENT + registrationCall(registration));
                lines.add(BODY_INDENT + "}");
            }
            return lines;
        }
        int start = 0;
        while (start < registrations.size()) {
            PlannedRegistration first = registrations.get(start);
            int end = start + 1;
            while (end < registrations.size() && sameRegistration(first, registrations.get(end))) {
                end++;
            }
            List<String> alternatives = registrations.subList(start, end).stream()
                .map(registration -> condition(registration.condition()))
                .toList();
            String guard = alternatives.size() == 1
                ? alternatives.get(0)
                : alternatives.stream()
                    .map(alternative -> "(" + alternative + ")")
                    .collect(Collectors.joining(" || "));
            lines.add(BODY_INDENT + "if (" + guard + ") {");
            lines.add(BODY_INDENT + INDENT + registrationCall(first));
            lines.add(BODY_INDENT + "}");
            start = end;
        }
        return lines;
    }

    private static boolean sameRegistration(PlannedRegistration a, PlannedRegistration b) {
        return a.implementation().equals(b.implementation()) && a.kind() == b.kind()
            && a.contract().equals(b.contract());
    }

    private static String registrationCall(PlannedRegistration registration) {
        String lifetime = "ServiceLifetime." + registration.lifetime().name();
        String contract = registration.contract().name() + ".class";
        String implementation = registration.implementation() + ".class";
        if (registration.kind() == RegistrationKind.FORWARDING) {
            return "services.addFactory(" + lifetime + ", " + contract
                + ", provider -> provider.getRequiredService(" + implementation + "));";
        }
        return "services.add(" + lifetime + ", " + contract + ", " + implementation + ");";
    }

    /**
     * Renders the clauses of a rule joined with {@code &&}, in the order: environment equals,
     * environment not equals, configuration equals, configuration not equals. An incomplete
     * configuration clause is left out.
     */
    static String condition(ConditionalRule rule) {
        List<String> clauses = new ArrayList<>();
        if (!rule.environments().isEmpty()) {
            String any = rule.environments().stream()
                .map(environment -> literal(environment) + ".equals(" + ENVIRONMENT + ")")
                .collect(Collectors.joining(" || "));
            clauses.add(rule.environments().size() > 1 ? "(" + any + ")" : any);
        }
        rule.notEnvironments()
            .forEach(environment -> clauses.add("!" + literal(environment) + ".equals(" + ENVIRONMENT + ")"));
        if (rule.hasConfigClause()) {
            String value = CONFIGURATION + ".getOrDefault(" + literal(rule.configKey()) + ", \"\")";
            if (!rule.equalsValue().isEmpty()) {
                clauses.add(literal(rule.equalsValue()) + ".equals(" + value + ")");
            }
            rule.notEqualsValues().forEach(rejected -> clauses.add("!" + literal(rejected) + ".equals(" + value + ")"));
        }
        return clauses.isEmpty() ? "true" : String.join(" && ", clauses);
    }

    private static boolean isRenderable(PlannedRegistration registration, GenerationInput input,
                                        DiagnosticReporter reporter) {
        if (SourceVersion.isName(registration.contract().name()) && SourceVersion.isName(registration.implementation())) {
            return true;
        }
        String location = input.registry().find(registration.implementation())
            .map(type -> type.sourcePath())
            .orElse(null);
        reporter.report(DiagnosticCode.EMISSION_FAILED, List.of(registration.implementation()), location,
            registration.implementation(), "cannot register as '" + registration.contract().name() + "'");
        return false;
    }

    static String literal(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
