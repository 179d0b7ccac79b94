package com.wiregen.core.generator.impl;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExplicitConstructorInvocationStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.type.Type;
import com.wiregen.core.diagnostic.DiagnosticCode;
import com.wiregen.core.diagnostic.DiagnosticReporter;
import com.wiregen.core.generator.CodeGenerator;
import com.wiregen.core.generator.GenerationInput;
import com.wiregen.core.generator.GeneratorConfig;
import com.wiregen.core.model.ConfigurationField;
import com.wiregen.core.model.ConfigurationValueType;
import com.wiregen.core.model.SourceUnit;
import com.wiregen.core.model.TypeDescriptor;
import com.wiregen.core.model.TypeRef;
import com.wiregen.core.naming.ConfigurationBinding;
import com.wiregen.core.naming.ConstructorLayout;
import com.wiregen.core.naming.ConstructorParameter;
import com.wiregen.core.naming.FieldAssignment;
import com.wiregen.core.renderer.GeneratedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Adds the wiring constructor to every class that needs one.
 *
 * <p>Java has no partial classes, so the output is a copy of each source unit that declares such
 * a class, at the same relative path, with:
 * <ul>
 *   <li>a {@code private final} field for every type-level dependency, before existing members</li>
 *   <li>a constructor after the last field: inherited parameters first, forwarded with
 *       {@code super(...)}, then own parameters assigned to their fields</li>
 *   <li>an assignment from the configuration parameter for every configuration-bound field</li>
 * </ul>
 *
 * <p>Abstract classes get a {@code protected} constructor, all others a {@code public} one.
 * A failure affects only the class it occurs in; the other classes of the unit are still emitted.
 */
public class ConstructorGenerator implements CodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ConstructorGenerator.class);

    private final JavaParser javaParser = new JavaParser(new ParserConfiguration()
        .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));

    @Override
    public String getId() {
        return "constructors";
    }

    @Override
    public String getDisplayName() {
        return "Constructor Generator";
    }

    @Override
    public List<GeneratedFile> generate(GenerationInput input, GeneratorConfig config, DiagnosticReporter reporter) {
        List<GeneratedFile> files = new ArrayList<>();
        for (SourceUnit unit : input.snapshot().units()) {
            List<TypeDescriptor> types = input.typesWithLayoutIn(unit.path());
            if (!types.isEmpty()) {
                generateUnit(unit, types, input, reporter).ifPresent(files::add);
            }
        }
        log.info("Generated constructors in {} source file(s)", files.size());
        return files;
    }

    private Optional<GeneratedFile> generateUnit(SourceUnit unit, List<TypeDescriptor> types, GenerationInput input,
                                                 DiagnosticReporter reporter) {
        ParseResult<CompilationUnit> result = javaParser.parse(unit.content());
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            types.forEach(type -> reporter.report(DiagnosticCode.EMISSION_FAILED, List.of(type.qualifiedName()),
                unit.path(), type.simpleName(), "source unit could not be re-parsed"));
            return Optional.empty();
        }
        CompilationUnit cu = result.getResult().get();

        int emitted = 0;
        for (TypeDescriptor type : types) {
            try {
                ClassOrInterfaceDeclaration declaration = findDeclaration(cu, type.qualifiedName())
                    .orElseThrow(() -> new IllegalStateException("declaration not found in " + unit.path()));
                addConstructor(declaration, type, input.layouts().get(type.qualifiedName()));
                emitted++;
            } catch (RuntimeException e) {
                log.warn("Constructor generation failed for {}: {}", type.qualifiedName(), e.getMessage());
                log.debug("Constructor generation failure details", e);
                reporter.report(DiagnosticCode.EMISSION_FAILED, List.of(type.qualifiedName()), unit.path(),
                    type.simpleName(), e.getMessage());
            }
        }
        if (emitted == 0) {
            return Optional.empty();
        }
        return Optional.of(new GeneratedFile(unit.path(), cu.toString(), getId()));
    }

    private static Optional<ClassOrInterfaceDeclaration> findDeclaration(CompilationUnit cu, String qualifiedName) {
        return cu.findAll(ClassOrInterfaceDeclaration.class).stream()
            .filter(declaration -> declaration.getFullyQualifiedName().map(qualifiedName::equals).orElse(false))
            .findFirst();
    }

    /**
     * Builds every node first and only then changes the declaration, so a failure leaves it untouched.
     */
    private void addConstructor(ClassOrInterfaceDeclaration declaration, TypeDescriptor type,
                                ConstructorLayout layout) {
        for (FieldAssignment field : layout.generatedFields()) {
            if (declaration.getFieldByName(field.fieldName()).isPresent()) {
                throw new IllegalStateException("field '" + field.fieldName() + "' is already declared");
            }
        }

        List<FieldDeclaration> fields = new ArrayList<>();
        for (FieldAssignment field : layout.generatedFields()) {
            fields.add(new FieldDeclaration(
                new NodeList<>(Modifier.privateModifier(), Modifier.finalModifier()),
                new VariableDeclarator(parseType(field.type()), field.fieldName())));
        }

        Modifier visibility = type.isAbstract() ? Modifier.protectedModifier() : Modifier.publicModifier();
        ConstructorDeclaration constructor = new ConstructorDeclaration(new NodeList<>(visibility),
            declaration.getNameAsString());
        for (ConstructorParameter parameter : layout.parameters()) {
            constructor.addParameter(new Parameter(parseType(parameter.type()), parameter.name()));
        }

        BlockStmt body = new BlockStmt();
        if (layout.hasSuperCall()) {
            NodeList<Expression> arguments = new NodeList<>();
            layout.superArguments().forEach(argument -> arguments.add(new NameExpr(argument)));
            body.addStatement(new ExplicitConstructorInvocationStmt(false, null, arguments));
        }
        for (FieldAssignment assignment : layout.assignments()) {
            body.addStatement(new ExpressionStmt(new AssignExpr(
                new FieldAccessExpr(new ThisExpr(), assignment.fieldName()),
                new NameExpr(assignment.parameterName()),
                AssignExpr.Operator.ASSIGN)));
        }
        for (ConfigurationBinding binding : layout.configurationBindings()) {
            body.addStatement(new ExpressionStmt(new AssignExpr(
                new FieldAccessExpr(new ThisExpr(), binding.field().fieldName()),
                parseExpression(bindingExpression(binding)),
                AssignExpr.Operator.ASSIGN)));
        }
        constructor.setBody(body);

        NodeList<BodyDeclaration<?>> members = declaration.getMembers();
        for (int i = 0; i < fields.size(); i++) {
            members.add(i, fields.get(i));
        }
        members.add(lastFieldIndex(members) + 1, constructor);
    }

    private static int lastFieldIndex(NodeList<BodyDeclaration<?>> members) {
        int last = -1;
        for (int i = 0; i < members.size(); i++) {
            if (members.get(i).isFieldDeclaration()) {
                last = i;
            }
        }
        return last;
    }

    /**
     * Value expression of a configuration-bound field: the declared default when the key is
     * missing, otherwise a required lookup, otherwise the field type's absent value.
     */
    static String bindingExpression(ConfigurationBinding binding) {
        ConfigurationField field = binding.field();
        ConfigurationValueType valueType = field.valueType();
        String source = binding.parameterName();
        String key = RegistrationGenerator.literal(field.key());
        if (field.hasDefault()) {
            return valueType.convert(source + ".getOrDefault(" + key + ", "
                + RegistrationGenerator.literal(field.defaultValue()) + ")");
        }
        if (field.required()) {
            return valueType.convert(source + ".require(" + key + ")");
        }
        String lookup = source + ".find(" + key + ")";
        if (valueType.converterReference() != null) {
            lookup += ".map(" + valueType.converterReference() + ")";
        }
        return lookup + ".orElse(" + valueType.absentValue() + ")";
    }

    private Expression parseExpression(String source) {
        ParseResult<Expression> result = javaParser.parseExpression(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new IllegalStateException("cannot render expression " + source);
        }
        return result.getResult().get();
    }

    private Type parseType(TypeRef type) {
        String source = type.toSourceString();
        ParseResult<Type> result = javaParser.parseType(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new IllegalStateException("cannot render type " + source);
        }
        return result.getResult().get();
    }
}
