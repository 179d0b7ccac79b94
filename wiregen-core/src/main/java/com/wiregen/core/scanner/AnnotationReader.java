package com.wiregen.core.scanner;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.wiregen.core.model.TypeRef;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Reads marker annotations and their member values from the AST of one compilation unit.
 *
 * <p>Member values are read syntactically: class literals, string literals, boolean literals,
 * enum constants (qualified or statically imported) and array initializers of those.
 */
class AnnotationReader {

    private static final String VALUE = "value";

    private final TypeReferenceResolver resolver;
    private final JavaParser javaParser;

    AnnotationReader(TypeReferenceResolver resolver, JavaParser javaParser) {
        this.resolver = resolver;
        this.javaParser = javaParser;
    }

    TypeReferenceResolver resolver() {
        return resolver;
    }

    /**
     * Returns whether the annotation is the given marker, written either by simple name (and
     * not imported from another package) or qualified with the api package.
     */
    boolean isMarker(AnnotationExpr annotation, String marker) {
        String name = annotation.getNameAsString();
        if (name.equals(MarkerNames.API_PACKAGE + "." + marker)) {
            return true;
        }
        if (!name.equals(marker)) {
            return false;
        }
        int dot = marker.indexOf('.');
        String head = dot >= 0 ? marker.substring(0, dot) : marker;
        return !resolver.isImportedFromOtherPackage(head, MarkerNames.API_PACKAGE);
    }

    boolean hasMarker(NodeList<AnnotationExpr> annotations, String marker) {
        return annotations.stream().anyMatch(annotation -> isMarker(annotation, marker));
    }

    /**
     * All occurrences of a repeatable marker in source order, including occurrences wrapped in
     * the marker's container annotation.
     */
    List<AnnotationExpr> findAll(NodeList<AnnotationExpr> annotations, String marker) {
        List<AnnotationExpr> found = new ArrayList<>();
        String container = marker + MarkerNames.CONTAINER_SUFFIX;
        for (AnnotationExpr annotation : annotations) {
            if (isMarker(annotation, marker)) {
                found.add(annotation);
            } else if (isMarker(annotation, container)) {
                for (Expression element : elements(member(annotation, VALUE).orElse(null))) {
                    if (!element.isAnnotationExpr()) {
                        throw new MalformedMarkerException("@" + container + " must contain @" + marker + " annotations");
                    }
                    found.add(element.asAnnotationExpr());
                }
            }
        }
        return found;
    }

    Optional<AnnotationExpr> find(NodeList<AnnotationExpr> annotations, String marker) {
        return annotations.stream().filter(annotation -> isMarker(annotation, marker)).findFirst();
    }

    /**
     * Value of an annotation member; a single-member annotation only has {@code value}.
     */
    Optional<Expression> member(AnnotationExpr annotation, String memberName) {
        if (annotation.isSingleMemberAnnotationExpr()) {
            return VALUE.equals(memberName)
                ? Optional.of(annotation.asSingleMemberAnnotationExpr().getMemberValue())
                : Optional.empty();
        }
        if (annotation.isNormalAnnotationExpr()) {
            return annotation.asNormalAnnotationExpr().getPairs().stream()
                .filter(pair -> pair.getNameAsString().equals(memberName))
                .map(MemberValuePair::getValue)
                .findFirst();
        }
        return Optional.empty();
    }

    List<TypeRef> classLiterals(AnnotationExpr annotation, String memberName, DeclarationScope scope) {
        List<TypeRef> types = new ArrayList<>();
        for (Expression element : elements(member(annotation, memberName).orElse(null))) {
            if (!element.isClassExpr()) {
                throw new MalformedMarkerException("@" + annotation.getNameAsString() + "." + memberName
                    + " expects class literals but found '" + element + "'");
            }
            types.add(resolver.resolve(element.asClassExpr().getType(), scope.enclosingTypes(), scope.typeVariables()));
        }
        return types;
    }

    /**
     * Types given as source text, such as {@code "List<IHandler>"}.
     */
    List<TypeRef> typeTexts(AnnotationExpr annotation, String memberName, DeclarationScope scope) {
        List<TypeRef> types = new ArrayList<>();
        for (Expression element : elements(member(annotation, memberName).orElse(null))) {
            if (!element.isStringLiteralExpr()) {
                throw new MalformedMarkerException("@" + annotation.getNameAsString() + "." + memberName
                    + " expects string literals but found '" + element + "'");
            }
            String text = element.asStringLiteralExpr().asString();
            ParseResult<ClassOrInterfaceType> parsed = javaParser.parseClassOrInterfaceType(text);
            if (!parsed.isSuccessful() || parsed.getResult().isEmpty()) {
                throw new MalformedMarkerException("'" + text + "' is not a valid type");
            }
            types.add(resolver.resolve(parsed.getResult().get(), scope.enclosingTypes(), scope.typeVariables()));
        }
        return types;
    }

    String string(AnnotationExpr annotation, String memberName, String defaultValue) {
        Optional<Expression> value = member(annotation, memberName);
        if (value.isEmpty()) {
            return defaultValue;
        }
        Expression expression = value.get();
        if (!expression.isStringLiteralExpr()) {
            throw new MalformedMarkerException("@" + annotation.getNameAsString() + "." + memberName
                + " must be a string literal but was '" + expression + "'");
        }
        return expression.asStringLiteralExpr().asString();
    }

    /**
     * Comma separated string member, split and trimmed; blank entries are dropped.
     */
    List<String> stringList(AnnotationExpr annotation, String memberName) {
        String raw = string(annotation, memberName, "");
        return Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .toList();
    }

    boolean bool(AnnotationExpr annotation, String memberName, boolean defaultValue) {
        Optional<Expression> value = member(annotation, memberName);
        if (value.isEmpty()) {
            return defaultValue;
        }
        if (!value.get().isBooleanLiteralExpr()) {
            throw new MalformedMarkerException("@" + annotation.getNameAsString() + "." + memberName
                + " must be a boolean literal but was '" + value.get() + "'");
        }
        return value.get().asBooleanLiteralExpr().getValue();
    }

    /**
     * Enum constant member, written as {@code Type.CONSTANT} or a statically imported {@code CONSTANT}.
     */
    <E extends Enum<E>> E enumConstant(AnnotationExpr annotation, String memberName, Class<E> enumType, E defaultValue) {
        Optional<Expression> value = member(annotation, memberName);
        if (value.isEmpty()) {
            return defaultValue;
        }
        Expression expression = value.get();
        String constant;
        if (expression.isFieldAccessExpr()) {
            constant = expression.asFieldAccessExpr().getNameAsString();
        } else if (expression.isNameExpr()) {
            constant = expression.asNameExpr().getNameAsString();
        } else {
            throw new MalformedMarkerException("@" + annotation.getNameAsString() + "." + memberName
                + " must be an enum constant but was '" + expression + "'");
        }
        try {
            return Enum.valueOf(enumType, constant);
        } catch (IllegalArgumentException e) {
            throw new MalformedMarkerException("Unknown " + enumType.getSimpleName() + " constant '" + constant + "'");
        }
    }

    private static List<Expression> elements(Expression value) {
        if (value == null) {
            return List.of();
        }
        if (value.isArrayInitializerExpr()) {
            return new ArrayList<>(value.asArrayInitializerExpr().getValues());
        }
        return List.of(value);
    }
}
