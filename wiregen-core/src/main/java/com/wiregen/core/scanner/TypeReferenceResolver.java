package com.wiregen.core.scanner;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.WildcardType;
import com.wiregen.core.model.TypeRef;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves type names written in one compilation unit to qualified names.
 *
 * <p>Lookup order for a simple name follows Java scoping: type variables, member types of the
 * enclosing declarations, single-type imports, the unit's package, on-demand imports and
 * {@code java.lang}. Only names declared in the snapshot are resolved through the package and
 * on-demand rules; anything else keeps its written name (or is assumed to live in the unit's
 * package when no on-demand import could supply it).
 */
public class TypeReferenceResolver {

    private static final Set<String> JAVA_LANG_TYPES = Set.of(
        "Object", "String", "CharSequence", "Number", "Integer", "Long", "Short", "Byte", "Double",
        "Float", "Boolean", "Character", "Void", "Class", "Enum", "Record", "Iterable", "Runnable",
        "AutoCloseable", "Comparable", "Thread", "ClassLoader", "Exception", "RuntimeException",
        "Throwable", "Error", "StringBuilder", "System", "Math", "Process", "Module"
    );

    private final String packageName;
    private final Set<String> knownTypes;
    private final Map<String, String> singleImports = new HashMap<>();
    private final List<String> onDemandImports = new ArrayList<>();

    /**
     * @param unit compilation unit whose imports apply
     * @param knownTypes qualified names of all types declared in the snapshot
     */
    public TypeReferenceResolver(CompilationUnit unit, Set<String> knownTypes) {
        this.packageName = unit.getPackageDeclaration().map(pd -> pd.getNameAsString()).orElse("");
        this.knownTypes = knownTypes;
        for (ImportDeclaration importDeclaration : unit.getImports()) {
            if (importDeclaration.isStatic()) {
                continue;
            }
            String name = importDeclaration.getNameAsString();
            if (importDeclaration.isAsterisk()) {
                onDemandImports.add(name);
            } else {
                singleImports.put(simpleNameOf(name), name);
            }
        }
    }

    public String packageName() {
        return packageName;
    }

    /**
     * Returns whether a simple annotation name is imported from a package other than {@code pkg}.
     */
    public boolean isImportedFromOtherPackage(String simpleName, String pkg) {
        String imported = singleImports.get(simpleName);
        return imported != null && !imported.equals(pkg + "." + simpleName);
    }

    /**
     * Resolves a parsed type.
     *
     * @param type type as written
     * @param enclosingTypes qualified names of the enclosing declarations, innermost first
     * @param typeVariables type variable names in scope
     * @return the resolved reference
     */
    public TypeRef resolve(Type type, List<String> enclosingTypes, Set<String> typeVariables) {
        if (type.isClassOrInterfaceType()) {
            ClassOrInterfaceType classType = type.asClassOrInterfaceType();
            String written = classType.getNameWithScope();
            List<TypeRef> arguments = new ArrayList<>();
            classType.getTypeArguments().ifPresent(args ->
                args.forEach(argument -> arguments.add(resolve(argument, enclosingTypes, typeVariables))));
            if (arguments.isEmpty() && typeVariables.contains(written)) {
                return TypeRef.variable(written);
            }
            return new TypeRef(resolveName(written, enclosingTypes), arguments, false);
        }
        if (type.isWildcardType()) {
            WildcardType wildcard = type.asWildcardType();
            if (wildcard.getExtendedType().isPresent()) {
                return resolve(wildcard.getExtendedType().get(), enclosingTypes, typeVariables);
            }
            return TypeRef.of("java.lang.Object");
        }
        if (type.isTypeParameter()) {
            return TypeRef.variable(type.asTypeParameter().getNameAsString());
        }
        // Primitives and arrays are kept as written
        return TypeRef.of(type.asString());
    }

    /**
     * Resolves a possibly scoped name such as {@code Repository} or {@code Outer.Inner}.
     */
    public String resolveName(String written, List<String> enclosingTypes) {
        int firstDot = written.indexOf('.');
        if (firstDot < 0) {
            return resolveSimpleName(written, enclosingTypes);
        }
        String head = written.substring(0, firstDot);
        String rest = written.substring(firstDot);
        String resolvedHead = lookup(head, enclosingTypes);
        return resolvedHead != null ? resolvedHead + rest : written;
    }

    private String resolveSimpleName(String simpleName, List<String> enclosingTypes) {
        String resolved = lookup(simpleName, enclosingTypes);
        if (resolved != null) {
            return resolved;
        }
        if (onDemandImports.isEmpty() && !packageName.isEmpty()) {
            return packageName + "." + simpleName;
        }
        return simpleName;
    }

    private String lookup(String simpleName, List<String> enclosingTypes) {
        for (String enclosing : enclosingTypes) {
            String member = enclosing + "." + simpleName;
            if (knownTypes.contains(member)) {
                return member;
            }
            if (simpleNameOf(enclosing).equals(simpleName)) {
                return enclosing;
            }
        }
        String imported = singleImports.get(simpleName);
        if (imported != null) {
            return imported;
        }
        String samePackage = packageName.isEmpty() ? simpleName : packageName + "." + simpleName;
        if (knownTypes.contains(samePackage)) {
            return samePackage;
        }
        for (String onDemand : onDemandImports) {
            String candidate = onDemand + "." + simpleName;
            if (knownTypes.contains(candidate)) {
                return candidate;
            }
        }
        if (JAVA_LANG_TYPES.contains(simpleName)) {
            return "java.lang." + simpleName;
        }
        return null;
    }

    private static String simpleNameOf(String qualifiedName) {
        int lastDot = qualifiedName.lastIndexOf('.');
        return lastDot >= 0 ? qualifiedName.substring(lastDot + 1) : qualifiedName;
    }
}
