package com.wiregen.core.validation;

import com.wiregen.core.diagnostic.DiagnosticCode;
import com.wiregen.core.diagnostic.DiagnosticReporter;
import com.wiregen.core.graph.TypeRegistry;
import com.wiregen.core.model.ConditionalRule;
import com.wiregen.core.model.TypeDescriptor;

import java.util.List;

/**
 * Reports registration conditions that are empty, contradictory or incomplete.
 */
public class ConditionalRuleValidator {

    public void validate(TypeRegistry registry, DiagnosticReporter reporter) {
        for (TypeDescriptor type : registry.all()) {
            if (type.external()) {
                continue;
            }
            for (ConditionalRule rule : type.conditions()) {
                validate(type, rule, reporter);
            }
        }
    }

    private static void validate(TypeDescriptor type, ConditionalRule rule, DiagnosticReporter reporter) {
        List<String> affected = List.of(type.qualifiedName());
        String name = type.simpleName();

        if (!rule.hasEnvironmentClause() && !rule.hasConfigKey() && !rule.hasConfigComparison()) {
            // An empty alternative next to effective ones is ignored
            if (!type.isConditional()) {
                reporter.report(DiagnosticCode.CONDITIONAL_EMPTY, affected, type.sourcePath(), name);
            }
            return;
        }
        rule.environments().stream()
            .filter(rule.notEnvironments()::contains)
            .forEach(environment -> reporter.report(DiagnosticCode.CONDITIONAL_CONFLICTING_ENVIRONMENT,
                affected, type.sourcePath(), name, environment));
        if (rule.hasConfigKey() && !rule.hasConfigComparison()) {
            reporter.report(DiagnosticCode.CONDITIONAL_KEY_WITHOUT_COMPARISON, affected, type.sourcePath(),
                name, rule.configKey());
        }
        if (rule.hasConfigComparison() && !rule.hasConfigKey()) {
            reporter.report(DiagnosticCode.CONDITIONAL_COMPARISON_WITHOUT_KEY, affected, type.sourcePath(), name);
        }
    }
}
