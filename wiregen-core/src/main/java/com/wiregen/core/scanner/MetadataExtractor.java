package com.wiregen.core.scanner;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.TypeParameter;
import com.wiregen.core.diagnostic.DiagnosticCode;
import com.wiregen.core.diagnostic.DiagnosticReporter;
import com.wiregen.core.model.ConditionalRule;
import com.wiregen.core.model.ConfigurationField;
import com.wiregen.core.model.ConfigurationValueType;
import com.wiregen.core.model.DeclarationSnapshot;
import com.wiregen.core.model.DependencyDescriptor;
import com.wiregen.core.model.InstanceSharing;
import com.wiregen.core.model.Lifetime;
import com.wiregen.core.model.NamingConvention;
import com.wiregen.core.model.NamingOptions;
import com.wiregen.core.model.RegistrationDirective;
import com.wiregen.core.model.RegistrationMode;
import com.wiregen.core.model.SourceUnit;
import com.wiregen.core.model.TypeDescriptor;
import com.wiregen.core.model.TypeKind;
import com.wiregen.core.model.TypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns the source units of a snapshot into type and dependency descriptors.
 *
 * <p>Extraction runs in two passes: every unit is parsed and the qualified names of all declared
 * types are collected, then each class, interface and record declaration (nested ones
 * included) is read. A unit that fails to parse, or a declaration whose markers cannot be read,
 * is reported and skipped without affecting the others.
 *
 * <p><b>Lifetime resolution:</b> an explicit lifetime marker wins. Otherwise a type that
 * declares dependencies, registration settings or a condition gets the configured default
 * lifetime; any other type stays {@link Lifetime#UNASSIGNED}.
 */
public class MetadataExtractor {

    private static final Logger log = LoggerFactory.getLogger(MetadataExtractor.class);

    private static final List<String> LIFETIME_MARKERS = List.of(
        MarkerNames.SINGLETON, MarkerNames.SCOPED, MarkerNames.TRANSIENT);

    private final JavaParser javaParser;
    private final Lifetime defaultLifetime;

    public MetadataExtractor(Lifetime defaultLifetime) {
        Objects.requireNonNull(defaultLifetime, "defaultLifetime must not be null");
        if (!defaultLifetime.isAssigned()) {
            throw new IllegalArgumentException("defaultLifetime must be Singleton, Scoped or Transient");
        }
        this.defaultLifetime = defaultLifetime;
        this.javaParser = new JavaParser(new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    public MetadataExtractor() {
        this(Lifetime.SCOPED);
    }

    /**
     * Extracts descriptors from every unit of the snapshot.
     *
     * @param snapshot source units to analyse
     * @param reporter receives parse failures and malformed-marker diagnostics
     * @return extracted descriptors and statistics
     */
    public ExtractionResult extract(DeclarationSnapshot snapshot, DiagnosticReporter reporter) {
        ScanStatistics.Builder statistics = new ScanStatistics.Builder();

        Map<SourceUnit, CompilationUnit> parsed = new LinkedHashMap<>();
        for (SourceUnit unit : snapshot.units()) {
            statistics.incrementFilesScanned();
            parseUnit(unit, statistics, reporter).ifPresent(cu -> parsed.put(unit, cu));
        }

        Set<String> knownTypes = new HashSet<>();
        for (CompilationUnit cu : parsed.values()) {
            for (TypeDeclaration<?> type : cu.findAll(TypeDeclaration.class)) {
                type.getFullyQualifiedName().ifPresent(knownTypes::add);
            }
        }

        Map<String, ExtractedType> extracted = new LinkedHashMap<>();
        for (Map.Entry<SourceUnit, CompilationUnit> entry : parsed.entrySet()) {
            SourceUnit unit = entry.getKey();
            CompilationUnit cu = entry.getValue();
            AnnotationReader reader = new AnnotationReader(new TypeReferenceResolver(cu, knownTypes), javaParser);
            for (TypeDeclaration<?> type : cu.getTypes()) {
                extractRecursively(type, List.of(), Set.of(), unit, reader, extracted, statistics, reporter);
            }
        }

        List<ExtractedType> ordered = new ArrayList<>(extracted.values());
        ordered.sort(Comparator.comparing(e -> e.type().qualifiedName()));

        List<TypeDescriptor> types = new ArrayList<>();
        List<DependencyDescriptor> dependencies = new ArrayList<>();
        List<ConfigurationField> configurationFields = new ArrayList<>();
        for (ExtractedType type : ordered) {
            types.add(type.type());
            dependencies.addAll(type.dependencies());
            configurationFields.addAll(type.configurationFields());
        }

        ScanStatistics stats = statistics.build();
        log.info("Extracted {} types and {} dependencies from {} source files ({} failed)",
            types.size(), dependencies.size(), stats.filesScanned(), stats.filesFailed());
        return new ExtractionResult(types, dependencies, configurationFields, stats);
    }

    private Optional<CompilationUnit> parseUnit(SourceUnit unit, ScanStatistics.Builder statistics,
                                                DiagnosticReporter reporter) {
        ParseResult<CompilationUnit> result = javaParser.parse(unit.content());
        if (result.isSuccessful() && result.getResult().isPresent()) {
            statistics.incrementFilesParsed();
            return result.getResult();
        }
        String problem = result.getProblems().isEmpty()
            ? "unknown parse error"
            : result.getProblems().get(0).getVerboseMessage();
        log.debug("Failed to parse {}", unit.path());
        result.getProblems().forEach(p -> log.debug("  - {}", p));
        statistics.incrementFilesFailed();
        statistics.addError("Parse failure", unit.path() + ": " + problem);
        reporter.report(DiagnosticCode.SOURCE_PARSE_FAILED, List.of(), unit.path(), unit.path(), problem);
        return Optional.empty();
    }

    private void extractRecursively(TypeDeclaration<?> type, List<String> outerTypes, Set<String> outerVariables,
                                    SourceUnit unit, AnnotationReader reader,
                                    Map<String, ExtractedType> extracted, ScanStatistics.Builder statistics,
                                    DiagnosticReporter reporter) {
        Optional<String> qualifiedName = type.getFullyQualifiedName();
        if (qualifiedName.isEmpty()) {
            return;
        }
        String name = qualifiedName.get();

        List<String> enclosing = new ArrayList<>();
        enclosing.add(name);
        enclosing.addAll(outerTypes);
        Set<String> variables = new LinkedHashSet<>(outerVariables);
        typeParametersOf(type).forEach(p -> variables.add(p.getNameAsString()));
        DeclarationScope scope = new DeclarationScope(enclosing, variables);

        if (type.isClassOrInterfaceDeclaration() || type.isRecordDeclaration()) {
            if (extracted.containsKey(name)) {
                reporter.report(DiagnosticCode.MALFORMED_MARKER, List.of(name), unit.path(), name,
                    "type is declared more than once in the snapshot");
                statistics.incrementTypesFailed();
            } else {
                try {
                    extracted.put(name, extractType(type, name, scope, unit, reader, reporter));
                    statistics.incrementTypesExtracted();
                } catch (RuntimeException e) {
                    log.warn("Skipping {} in {}: {}", name, unit.path(), e.getMessage());
                    log.debug("Extraction failure", e);
                    statistics.incrementTypesFailed();
                    statistics.addError("Extraction failure", name + ": " + e.getMessage());
                    reporter.report(DiagnosticCode.MALFORMED_MARKER, List.of(name), unit.path(), name,
                        "declaration could not be analysed (" + e.getMessage() + ")");
                }
            }
        }

        for (BodyDeclaration<?> member : type.getMembers()) {
            if (member.isTypeDeclaration()) {
                TypeDeclaration<?> nested = member.asTypeDeclaration();
                Set<String> visible = isStaticContext(type, nested) ? Set.of() : variables;
                extractRecursively(nested, enclosing, visible, unit, reader, extracted, statistics, reporter);
            }
        }
    }

    private ExtractedType extractType(TypeDeclaration<?> type, String name, DeclarationScope scope, SourceUnit unit,
                                      AnnotationReader reader, DiagnosticReporter reporter) {
        NodeList<AnnotationExpr> annotations = type.getAnnotations();
        TypeReferenceResolver resolver = reader.resolver();

        TypeKind kind;
        boolean isAbstract;
        TypeRef superclass = null;
        List<TypeRef> interfaces = new ArrayList<>();
        if (type.isRecordDeclaration()) {
            RecordDeclaration record = type.asRecordDeclaration();
            kind = TypeKind.RECORD;
            isAbstract = false;
            record.getImplementedTypes().forEach(t -> interfaces.add(resolveType(resolver, t, scope)));
        } else {
            ClassOrInterfaceDeclaration declaration = type.asClassOrInterfaceDeclaration();
            if (declaration.isInterface()) {
                kind = TypeKind.INTERFACE;
                isAbstract = true;
                declaration.getExtendedTypes().forEach(t -> interfaces.add(resolveType(resolver, t, scope)));
            } else {
                kind = TypeKind.CLASS;
                isAbstract = declaration.isAbstract();
                if (declaration.getExtendedTypes().isNonEmpty()) {
                    superclass = resolveType(resolver, declaration.getExtendedTypes().get(0), scope);
                }
                declaration.getImplementedTypes().forEach(t -> interfaces.add(resolveType(resolver, t, scope)));
            }
        }

        List<DependencyDescriptor> dependencies = new ArrayList<>();
        readDeclaredDependencies(name, annotations, scope, unit, reader, reporter, dependencies);
        readInjectedFields(name, type, scope, unit, reader, reporter, dependencies);
        List<ConfigurationField> configurationFields = readConfigurationFields(name, type, unit, reader, reporter);

        RegistrationDirective registration = readRegistration(name, annotations, scope, unit, reader, reporter);
        List<ConditionalRule> conditions = readConditions(name, annotations, unit, reader, reporter);
        boolean external = reader.hasMarker(annotations, MarkerNames.EXTERNAL_SERVICE);

        Lifetime declared = readLifetime(name, annotations, unit, reader, reporter);
        if (kind == TypeKind.INTERFACE && declared.isAssigned()) {
            reporter.report(DiagnosticCode.MALFORMED_MARKER, List.of(name), unit.path(), name,
                "lifetime markers have no effect on interfaces");
            declared = Lifetime.UNASSIGNED;
        }
        boolean serviceIntent = !dependencies.isEmpty()
            || !configurationFields.isEmpty()
            || registration.modeDeclared()
            || registration.hasExplicitContracts()
            || !conditions.isEmpty();
        Lifetime lifetime = declared;
        if (!declared.isAssigned() && serviceIntent && kind != TypeKind.INTERFACE) {
            lifetime = defaultLifetime;
        }

        TypeDescriptor descriptor = new TypeDescriptor(
            name,
            kind,
            typeParametersOf(type).stream().map(TypeParameter::getNameAsString).toList(),
            lifetime,
            declared.isAssigned(),
            external,
            isAbstract,
            superclass,
            interfaces,
            registration,
            conditions,
            kind == TypeKind.CLASS && !type.getConstructors().isEmpty(),
            unit.path()
        );
        log.debug("Extracted {} ({}, {}, {} dependencies)", name, kind, lifetime.displayName(), dependencies.size());
        return new ExtractedType(descriptor, dependencies, configurationFields);
    }

    private void readDeclaredDependencies(String owner, NodeList<AnnotationExpr> annotations, DeclarationScope scope,
                                          SourceUnit unit, AnnotationReader reader, DiagnosticReporter reporter,
                                          List<DependencyDescriptor> dependencies) {
        List<AnnotationExpr> declarations;
        try {
            declarations = reader.findAll(annotations, MarkerNames.DEPENDS_ON);
        } catch (MalformedMarkerException e) {
            reporter.report(DiagnosticCode.MALFORMED_MARKER, List.of(owner), unit.path(), owner, e.getMessage());
            return;
        }
        int declarationIndex = 0;
        for (AnnotationExpr declaration : declarations) {
            try {
                List<TypeRef> targets = new ArrayList<>(reader.classLiterals(declaration, "value", scope));
                targets.addAll(reader.typeTexts(declaration, "types", scope));
                NamingOptions naming = new NamingOptions(
                    reader.enumConstant(declaration, "namingConvention", NamingConvention.class, NamingConvention.CAMEL_CASE),
                    reader.bool(declaration, "stripI", true),
                    reader.string(declaration, "prefix", NamingOptions.DEFAULT_PREFIX)
                );
                boolean external = reader.bool(declaration, "external", false);
                if (targets.isEmpty()) {
                    reporter.report(DiagnosticCode.MALFORMED_MARKER, List.of(owner), unit.path(), owner,
                        "@DependsOn declares no dependency types");
                }
                for (TypeRef target : targets) {
                    dependencies.add(DependencyDescriptor.declared(owner, target, naming, external,
                        dependencies.size(), declarationIndex));
                }
            } catch (MalformedMarkerException e) {
                reporter.report(DiagnosticCode.MALFORMED_MARKER, List.of(owner), unit.path(), owner, e.getMessage());
            }
            declarationIndex++;
        }
    }

    private void readInjectedFields(String owner, TypeDeclaration<?> type, DeclarationScope scope, SourceUnit unit,
                                    AnnotationReader reader, DiagnosticReporter reporter,
                                    List<DependencyDescriptor> dependencies) {
        for (FieldDeclaration field : type.getFields()) {
            Optional<AnnotationExpr> inject = reader.find(field.getAnnotations(), MarkerNames.INJECT);
            if (inject.isEmpty()) {
                continue;
            }
            if (field.isStatic()) {
                reporter.report(DiagnosticCode.MALFORMED_MARKER, List.of(owner), unit.path(), owner,
                    "static field '" + field.getVariable(0).getNameAsString() + "' cannot be injected");
                continue;
            }
            boolean external;
            try {
                external = reader.bool(inject.get(), "external", false);
            } catch (MalformedMarkerException e) {
                reporter.report(DiagnosticCode.MALFORMED_MARKER, List.of(owner), unit.path(), owner, e.getMessage());
                continue;
            }
            for (VariableDeclarator variable : field.getVariables()) {
                if (variable.getInitializer().isPresent()) {
                    reporter.report(DiagnosticCode.MALFORMED_MARKER, List.of(owner), unit.path(), owner,
                        "injected field '" + variable.getNameAsString() + "' must not have an initializer");
                    continue;
                }
                TypeRef target = reader.resolver().resolve(variable.getType(), scope.enclosingTypes(), scope.typeVariables());
                dependencies.add(DependencyDescriptor.field(owner, target, variable.getNameAsString(), external,
                    dependencies.size()));
            }
        }
    }

    private List<ConfigurationField> readConfigurationFields(String owner, TypeDeclaration<?> type, SourceUnit unit,
                                                             AnnotationReader reader, DiagnosticReporter reporter) {
        List<ConfigurationField> fields = new ArrayList<>();
        for (FieldDeclaration field : type.getFields()) {
            Optional<AnnotationExpr> binding = reader.find(field.getAnnotations(), MarkerNames.INJECT_CONFIGURATION);
            if (binding.isEmpty()) {
                continue;
            }
            String fieldName = field.getVariable(0).getNameAsString();
            if (field.isStatic()) {
                reporter.report(DiagnosticCode.MALFORMED_MARKER, List.of(owner), unit.path(), owner,
                    "static field '" + fieldName + "' cannot be bound to configuration");
                continue;
            }
            if (reader.hasMarker(field.getAnnotations(), MarkerNames.INJECT)) {
                reporter.report(DiagnosticCode.MALFORMED_MARKER, List.of(owner), unit.path(), owner,
                    "field '" + fieldName + "' is both injected and bound to configuration");
                continue;
            }
            String key;
            String defaultValue;
            boolean required;
            try {
                key = reader.string(binding.get(), "value", "").trim();
                defaultValue = reader.member(binding.get(), "defaultValue").isPresent()
                    ? reader.string(binding.get(), "defaultValue", "")
                    : null;
                required = reader.bool(binding.get(), "required", true);
            } catch (MalformedMarkerException e) {
                reporter.report(DiagnosticCode.MALFORMED_MARKER, List.of(owner), unit.path(), owner, e.getMessage());
                continue;
            }
            if (key.isEmpty()) {
                reporter.report(DiagnosticCode.MALFORMED_MARKER, List.of(owner), unit.path(), owner,
                    "configuration field '" + fieldName + "' declares no key");
                continue;
            }
            for (VariableDeclarator variable : field.getVariables()) {
                String name = variable.getNameAsString();
                if (variable.getInitializer().isPresent()) {
                    reporter.report(DiagnosticCode.MALFORMED_MARKER, List.of(owner), unit.path(), owner,
                        "configuration field '" + name + "' must not have an initializer");
                    continue;
                }
                String typeSource = variable.getType().asString();
                Optional<ConfigurationValueType> valueType = ConfigurationValueType.fromSource(typeSource);
                if (valueType.isEmpty()) {
                    reporter.report(DiagnosticCode.MALFORMED_MARKER, List.of(owner), unit.path(), owner,
                        "configuration field '" + name + "' has unsupported type '" + typeSource + "'");
                    continue;
                }
                if (defaultValue != null && !valueType.get().accepts(defaultValue)) {
                    reporter.report(DiagnosticCode.MALFORMED_MARKER, List.of(owner), unit.path(), owner,
                        "default value '" + defaultValue + "' of configuration field '" + name
                            + "' is not a valid " + typeSource);
                    continue;
                }
                fields.add(new ConfigurationField(owner, name, valueType.get(), key, defaultValue, required));
            }
        }
        return fields;
    }

    private RegistrationDirective readRegistration(String owner, NodeList<AnnotationExpr> annotations,
                                                   DeclarationScope scope, SourceUnit unit, AnnotationReader reader,
                                                   DiagnosticReporter reporter) {
        RegistrationMode mode = RegistrationMode.DIRECT_ONLY;
        InstanceSharing sharing = null;
        boolean modeDeclared = false;
        List<TypeRef> explicitContracts = new ArrayList<>();
        List<TypeRef> skipped = new ArrayList<>();
        try {
            Optional<AnnotationExpr> registerAsAll = reader.find(annotations, MarkerNames.REGISTER_AS_ALL);
            Optional<AnnotationExpr> registerAs = reader.find(annotations, MarkerNames.REGISTER_AS);
            if (registerAsAll.isPresent() && registerAs.isPresent()) {
                reporter.report(DiagnosticCode.MALFORMED_MARKER, List.of(owner), unit.path(), owner,
                    "@RegisterAsAll and @RegisterAs cannot be combined; @RegisterAs is used");
            }
            if (registerAs.isPresent()) {
                explicitContracts.addAll(reader.classLiterals(registerAs.get(), "value", scope));
                sharing = reader.enumConstant(registerAs.get(), "instanceSharing", InstanceSharing.class, null);
            } else if (registerAsAll.isPresent()) {
                modeDeclared = true;
                mode = reader.enumConstant(registerAsAll.get(), "value", RegistrationMode.class, RegistrationMode.ALL);
                sharing = reader.enumConstant(registerAsAll.get(), "instanceSharing", InstanceSharing.class, null);
            }
            for (AnnotationExpr skip : reader.findAll(annotations, MarkerNames.SKIP_REGISTRATION)) {
                skipped.addAll(reader.classLiterals(skip, "value", scope));
            }
        } catch (MalformedMarkerException e) {
            reporter.report(DiagnosticCode.MALFORMED_MARKER, List.of(owner), unit.path(), owner, e.getMessage());
            return RegistrationDirective.none();
        }
        return new RegistrationDirective(mode, sharing, modeDeclared, explicitContracts, skipped);
    }

    private List<ConditionalRule> readConditions(String owner, NodeList<AnnotationExpr> annotations, SourceUnit unit,
                                                 AnnotationReader reader, DiagnosticReporter reporter) {
        List<AnnotationExpr> declared;
        try {
            declared = reader.findAll(annotations, MarkerNames.CONDITIONAL_SERVICE);
        } catch (MalformedMarkerException e) {
            reporter.report(DiagnosticCode.MALFORMED_MARKER, List.of(owner), unit.path(), owner, e.getMessage());
            return List.of();
        }
        List<ConditionalRule> conditions = new ArrayList<>();
        for (AnnotationExpr annotation : declared) {
            try {
                conditions.add(new ConditionalRule(
                    reader.stringList(annotation, "environment"),
                    reader.stringList(annotation, "notEnvironment"),
                    reader.string(annotation, "configKey", "").trim(),
                    reader.string(annotation, "equalsValue", ""),
                    reader.stringList(annotation, "notEquals")
                ));
            } catch (MalformedMarkerException e) {
                reporter.report(DiagnosticCode.MALFORMED_MARKER, List.of(owner), unit.path(), owner, e.getMessage());
            }
        }
        return conditions;
    }

    private Lifetime readLifetime(String owner, NodeList<AnnotationExpr> annotations, SourceUnit unit,
                                  AnnotationReader reader, DiagnosticReporter reporter) {
        List<String> present = LIFETIME_MARKERS.stream()
            .filter(marker -> reader.hasMarker(annotations, marker))
            .toList();
        if (present.isEmpty()) {
            return Lifetime.UNASSIGNED;
        }
        if (present.size() > 1) {
            reporter.report(DiagnosticCode.MALFORMED_MARKER, List.of(owner), unit.path(), owner,
                "multiple lifetime markers " + present + "; @" + present.get(0) + " is used");
        }
        return Lifetime.parse(present.get(0));
    }

    private static TypeRef resolveType(TypeReferenceResolver resolver, ClassOrInterfaceType type, DeclarationScope scope) {
        return resolver.resolve(type, scope.enclosingTypes(), scope.typeVariables());
    }

    /**
     * Nested declarations that cannot see the type variables of the enclosing declaration.
     */
    private static boolean isStaticContext(TypeDeclaration<?> outer, TypeDeclaration<?> nested) {
        if (nested.isStatic() || !nested.isClassOrInterfaceDeclaration()) {
            return true;
        }
        if (nested.asClassOrInterfaceDeclaration().isInterface()) {
            return true;
        }
        return outer.isClassOrInterfaceDeclaration() && outer.asClassOrInterfaceDeclaration().isInterface();
    }

    private static List<TypeParameter> typeParametersOf(TypeDeclaration<?> type) {
        if (type.isClassOrInterfaceDeclaration()) {
            return type.asClassOrInterfaceDeclaration().getTypeParameters();
        }
        if (type.isRecordDeclaration()) {
            return type.asRecordDeclaration().getTypeParameters();
        }
        return List.of();
    }

    private record ExtractedType(TypeDescriptor type, List<DependencyDescriptor> dependencies,
                                 List<ConfigurationField> configurationFields) {
    }
}
