package com.wiregen.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Field types a configuration value can be bound to, with the conversion the generated code
 * applies to the raw string.
 */
public enum ConfigurationValueType {

    STRING(List.of("String", "java.lang.String"), null, "null"),
    INT(List.of("int"), "Integer.parseInt", "0"),
    INTEGER(List.of("Integer", "java.lang.Integer"), "Integer.valueOf", "null"),
    LONG(List.of("long"), "Long.parseLong", "0L"),
    LONG_WRAPPER(List.of("Long", "java.lang.Long"), "Long.valueOf", "null"),
    BOOLEAN(List.of("boolean"), "Boolean.parseBoolean", "false"),
    BOOLEAN_WRAPPER(List.of("Boolean", "java.lang.Boolean"), "Boolean.valueOf", "null"),
    DOUBLE(List.of("double"), "Double.parseDouble", "0.0"),
    DOUBLE_WRAPPER(List.of("Double", "java.lang.Double"), "Double.valueOf", "null");

    private final List<String> sourceNames;
    private final String parser;
    private final String absentValue;

    ConfigurationValueType(List<String> sourceNames, String parser, String absentValue) {
        this.sourceNames = sourceNames;
        this.parser = parser;
        this.absentValue = absentValue;
    }

    /**
     * @param typeSource field type as written in the source
     * @return the matching value type, empty when the type cannot be bound
     */
    public static Optional<ConfigurationValueType> fromSource(String typeSource) {
        return Arrays.stream(values())
            .filter(type -> type.sourceNames.contains(typeSource))
            .findFirst();
    }

    /**
     * Expression converting {@code raw}, a {@code String} expression, to the field type.
     */
    public String convert(String raw) {
        return parser == null ? raw : parser + "(" + raw + ")";
    }

    /**
     * Method reference of the conversion, {@code null} for strings.
     */
    public String converterReference() {
        return parser == null ? null : parser.replace(".", "::");
    }

    /**
     * Value a field keeps when an optional key without default is missing.
     */
    public String absentValue() {
        return absentValue;
    }

    /**
     * Whether {@code value} converts without error, used to check declared defaults.
     */
    public boolean accepts(String value) {
        try {
            switch (this) {
                case INT, INTEGER -> Integer.parseInt(value);
                case LONG, LONG_WRAPPER -> Long.parseLong(value);
                case DOUBLE, DOUBLE_WRAPPER -> Double.parseDouble(value);
                case BOOLEAN, BOOLEAN_WRAPPER -> {
                    return value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false");
                }
                default -> {
                    // Any string
                }
            }
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
