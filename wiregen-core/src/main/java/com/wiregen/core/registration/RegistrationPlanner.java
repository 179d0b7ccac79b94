package com.wiregen.core.registration;

import com.wiregen.core.diagnostic.DiagnosticCode;
import com.wiregen.core.diagnostic.DiagnosticReporter;
import com.wiregen.core.graph.Supertype;
import com.wiregen.core.graph.TypeRegistry;
import com.wiregen.core.model.ConditionalRule;
import com.wiregen.core.model.InstanceSharing;
import com.wiregen.core.model.RegistrationDirective;
import com.wiregen.core.model.RegistrationMode;
import com.wiregen.core.model.TypeDescriptor;
import com.wiregen.core.model.TypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which contracts each service is registered as.
 *
 * <p>Only concrete, non-external types with an assigned lifetime are registered.
 *
 * <table>
 *   <caption>Registrations per mode</caption>
 *   <tr><th>Mode</th><th>Separate</th><th>Shared (and every singleton)</th></tr>
 *   <tr><td>(none)</td><td>implementation + each interface directly</td><td>implementation + interfaces forwarding to it</td></tr>
 *   <tr><td>DirectOnly</td><td>implementation</td><td>implementation</td></tr>
 *   <tr><td>All</td><td>implementation + each interface directly</td><td>implementation + interfaces forwarding to it</td></tr>
 *   <tr><td>Exclusionary</td><td>each interface directly</td><td>implementation + interfaces forwarding to it</td></tr>
 *   <tr><td>RegisterAs</td><td>implementation + listed interfaces directly</td><td>implementation + listed interfaces forwarding</td></tr>
 * </table>
 *
 * <p>Interfaces from {@code java.*} and {@code javax.*} are never registered. Skipped contracts
 * are removed in the All and Exclusionary modes and ignored (with a warning) otherwise;
 * skipping something the type does not implement is an error.
 */
public class RegistrationPlanner {

    private static final Logger log = LoggerFactory.getLogger(RegistrationPlanner.class);

    public RegistrationPlan plan(TypeRegistry registry, DiagnosticReporter reporter) {
        List<PlannedRegistration> unconditional = new ArrayList<>();
        Map<TypeRef, List<PlannedRegistration>> conditional = new LinkedHashMap<>();

        for (TypeDescriptor type : registry.all()) {
            if (type.external() || type.isInterface()) {
                continue;
            }
            List<Supertype> supertypes = registry.supertypesOf(type);
            validateSkips(type, supertypes, reporter);
            if (!type.isConcrete() || !type.isService()) {
                continue;
            }
            for (PlannedRegistration registration : planType(type, supertypes, registry, reporter)) {
                if (registration.isConditional()) {
                    conditional.computeIfAbsent(registration.contract(), k -> new ArrayList<>()).add(registration);
                } else {
                    unconditional.add(registration);
                }
            }
        }

        List<ConditionalGroup> groups = new ArrayList<>();
        conditional.forEach((contract, registrations) -> groups.add(new ConditionalGroup(contract, registrations)));

        RegistrationPlan plan = new RegistrationPlan(unconditional, groups);
        log.info("Planned {} registrations ({} conditional groups)", plan.all().size(), groups.size());
        return plan;
    }

    private List<PlannedRegistration> planType(TypeDescriptor type, List<Supertype> supertypes, TypeRegistry registry,
                                               DiagnosticReporter reporter) {
        RegistrationDirective directive = type.registration();
        InstanceSharing sharing = directive.effectiveSharing(type.lifetime());

        boolean includeImplementation;
        List<TypeRef> contracts;
        if (directive.hasExplicitContracts()) {
            includeImplementation = true;
            contracts = explicitContracts(type, supertypes, registry, reporter);
        } else if (!directive.modeDeclared()) {
            includeImplementation = true;
            contracts = interfaces(supertypes);
        } else if (directive.mode() == RegistrationMode.DIRECT_ONLY) {
            includeImplementation = true;
            contracts = List.of();
        } else {
            contracts = interfaces(supertypes).stream()
                .filter(contract -> directive.skipped().stream().noneMatch(skip -> sameRawType(skip, contract)))
                .toList();
            // Exclusionary keeps the implementation only as the target of forwarding entries
            includeImplementation = directive.mode() == RegistrationMode.ALL
                || (sharing == InstanceSharing.SHARED && !contracts.isEmpty());
        }

        RegistrationKind kind = includeImplementation && sharing == InstanceSharing.SHARED
            ? RegistrationKind.FORWARDING
            : RegistrationKind.DIRECT;
        List<PlannedRegistration> registrations = new ArrayList<>();
        if (!type.isConditional()) {
            addRegistrations(type, includeImplementation, contracts, kind, null, registrations);
        }
        // One set per alternative condition
        for (ConditionalRule condition : type.effectiveConditions()) {
            addRegistrations(type, includeImplementation, contracts, kind, condition, registrations);
        }
        log.debug("{}: {} registration(s)", type.qualifiedName(), registrations.size());
        return registrations;
    }

    private static void addRegistrations(TypeDescriptor type, boolean includeImplementation, List<TypeRef> contracts,
                                         RegistrationKind kind, ConditionalRule condition,
                                         List<PlannedRegistration> registrations) {
        if (includeImplementation) {
            registrations.add(new PlannedRegistration(type.selfReference(), type.qualifiedName(), type.lifetime(),
                RegistrationKind.DIRECT, condition));
        }
        for (TypeRef contract : contracts) {
            registrations.add(new PlannedRegistration(contract, type.qualifiedName(), type.lifetime(), kind, condition));
        }
    }

    private List<TypeRef> explicitContracts(TypeDescriptor type, List<Supertype> supertypes, TypeRegistry registry,
                                            DiagnosticReporter reporter) {
        List<TypeRef> contracts = new ArrayList<>();
        Set<String> listed = new HashSet<>();
        for (TypeRef requested : type.registration().explicitContracts()) {
            if (!listed.add(requested.name())) {
                reporter.report(DiagnosticCode.REGISTER_AS_DUPLICATE, List.of(type.qualifiedName()), type.sourcePath(),
                    type.simpleName(), requested.toDisplayString());
                continue;
            }
            Optional<TypeDescriptor> declaration = registry.find(requested.name());
            if (declaration.isPresent() && !declaration.get().isInterface()) {
                reporter.report(DiagnosticCode.REGISTER_AS_NOT_INTERFACE, List.of(type.qualifiedName()),
                    type.sourcePath(), type.simpleName(), requested.toDisplayString());
                continue;
            }
            Optional<TypeRef> implemented = interfaces(supertypes).stream()
                .filter(contract -> sameRawType(requested, contract))
                .findFirst();
            if (implemented.isEmpty()) {
                reporter.report(DiagnosticCode.REGISTER_AS_NOT_IMPLEMENTED, List.of(type.qualifiedName()),
                    type.sourcePath(), type.simpleName(), requested.toDisplayString());
                continue;
            }
            contracts.add(implemented.get());
        }
        return contracts;
    }

    private static void validateSkips(TypeDescriptor type, List<Supertype> supertypes, DiagnosticReporter reporter) {
        RegistrationDirective directive = type.registration();
        for (TypeRef skipped : directive.skipped()) {
            boolean implemented = supertypes.stream().anyMatch(supertype -> sameRawType(skipped, supertype.type()));
            if (!implemented) {
                reporter.report(DiagnosticCode.SKIP_TARGET_NOT_IMPLEMENTED, List.of(type.qualifiedName()),
                    type.sourcePath(), type.simpleName(), skipped.toDisplayString());
            } else if (!directive.modeDeclared()) {
                reporter.report(DiagnosticCode.SKIP_WITHOUT_REGISTRATION_MODE, List.of(type.qualifiedName()),
                    type.sourcePath(), type.simpleName(), skipped.toDisplayString());
            }
        }
    }

    private static List<TypeRef> interfaces(List<Supertype> supertypes) {
        return supertypes.stream()
            .filter(Supertype::isInterface)
            .map(Supertype::type)
            .filter(contract -> !isPlatformType(contract))
            .toList();
    }

    private static boolean isPlatformType(TypeRef type) {
        return type.name().startsWith("java.") || type.name().startsWith("javax.");
    }

    private static boolean sameRawType(TypeRef a, TypeRef b) {
        return a.name().equals(b.name());
    }
}
