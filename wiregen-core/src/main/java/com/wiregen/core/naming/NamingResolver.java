package com.wiregen.core.naming;

import com.wiregen.core.model.NamingConvention;
import com.wiregen.core.model.NamingOptions;
import com.wiregen.core.model.TypeRef;

import javax.lang.model.SourceVersion;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Derives generated identifiers from type and field names.
 *
 * <p>Resolution strips a configured prefix already present on the input, then a single leading
 * interface marker (only when the next character is upper case), applies the case convention
 * and finally prepends the prefix. Applying it to its own output returns the output unchanged.
 *
 * <p><b>Examples</b> with marker {@code I}:
 * <pre>{@code
 * resolve("IOrderRepository", CAMEL_CASE, true, "_")  -> "_orderRepository"
 * resolve("IOrderRepository", SNAKE_CASE, true, "")   -> "order_repository"
 * resolve("Inventory", PASCAL_CASE, true, "m")        -> "mInventory"
 * resolve("IOrderRepository", CAMEL_CASE, false, "_") -> "_iOrderRepository"
 * }</pre>
 */
public final class NamingResolver {

    public static final char DEFAULT_MARKER = 'I';

    private static final Pattern UPPER_CASE_TRANSITION = Pattern.compile("(?<!^)([A-Z])");

    private final char marker;

    public NamingResolver(char marker) {
        this.marker = marker;
    }

    public NamingResolver() {
        this(DEFAULT_MARKER);
    }

    public char marker() {
        return marker;
    }

    /**
     * Resolves an identifier.
     *
     * @param rawName type or field name without package
     * @param convention case convention
     * @param stripLeadingMarker whether to strip the interface marker
     * @param prefix prefix to prepend, may be empty; a name already carrying it keeps its marker
     * @return the identifier
     */
    public String resolve(String rawName, NamingConvention convention, boolean stripLeadingMarker, String prefix) {
        Objects.requireNonNull(rawName, "rawName must not be null");
        Objects.requireNonNull(convention, "convention must not be null");
        String safePrefix = prefix == null ? "" : prefix;

        String name = rawName;
        boolean resolvedBefore = false;
        if (!safePrefix.isEmpty() && name.startsWith(safePrefix) && name.length() > safePrefix.length()) {
            name = name.substring(safePrefix.length());
            // A prefixed name is an earlier result whose marker is already gone
            resolvedBefore = true;
        }
        if (stripLeadingMarker && !resolvedBefore && hasLeadingMarker(name)) {
            name = name.substring(1);
        }
        if (name.isEmpty()) {
            return safePrefix;
        }
        return safePrefix + applyConvention(name, convention);
    }

    public String resolve(String rawName, NamingOptions options) {
        return resolve(rawName, options.convention(), options.stripLeadingMarker(), options.prefix());
    }

    /**
     * Field name for a type-level dependency on {@code type}.
     */
    public String fieldName(TypeRef type, NamingOptions options) {
        return resolve(meaningfulName(type), options);
    }

    /**
     * Constructor parameter name for a dependency on {@code type}: always camelCase, no prefix,
     * stripping the marker as the declaration's naming settings say.
     */
    public String parameterName(TypeRef type, NamingOptions options) {
        return escapeKeyword(resolve(meaningfulName(type), NamingConvention.CAMEL_CASE,
            options.stripLeadingMarker(), ""));
    }

    /**
     * Constructor parameter name for an injected field: the field name without leading
     * underscores, camelCase.
     */
    public String parameterNameForField(String fieldName) {
        String name = fieldName;
        while (name.length() > 1 && name.charAt(0) == '_') {
            name = name.substring(1);
        }
        return escapeKeyword(resolve(name, NamingConvention.CAMEL_CASE, false, ""));
    }

    /**
     * Name an identifier is derived from: the simple name of the type, or of the element type
     * for collection dependencies.
     */
    public static String meaningfulName(TypeRef type) {
        TypeRef current = type;
        while (current.isCollection()) {
            current = current.elementType();
        }
        return current.simpleName();
    }

    private boolean hasLeadingMarker(String name) {
        return name.length() > 1 && name.charAt(0) == marker && Character.isUpperCase(name.charAt(1));
    }

    private static String applyConvention(String name, NamingConvention convention) {
        return switch (convention) {
            case CAMEL_CASE -> Character.toLowerCase(name.charAt(0)) + name.substring(1);
            case PASCAL_CASE -> Character.toUpperCase(name.charAt(0)) + name.substring(1);
            case SNAKE_CASE -> UPPER_CASE_TRANSITION.matcher(name).replaceAll("_$1").toLowerCase(Locale.ROOT);
        };
    }

    private static String escapeKeyword(String name) {
        return SourceVersion.isKeyword(name) ? name + "_" : name;
    }
}
