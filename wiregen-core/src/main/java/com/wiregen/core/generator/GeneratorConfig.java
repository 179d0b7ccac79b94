package com.wiregen.core.generator;

import java.util.Objects;

/**
 * Settings of the generated registration entry point.
 *
 * @param packageName package of the registration class, empty for the default package
 * @param className simple name of the registration class
 * @param methodName name of the static registration method
 * @param environmentVariable environment variable the conditional registrations compare against
 */
public record GeneratorConfig(
    String packageName,
    String className,
    String methodName,
    String environmentVariable
) {
    public static final String DEFAULT_PACKAGE = "com.wiregen.generated";
    public static final String DEFAULT_CLASS_NAME = "WireGenRegistrations";
    public static final String DEFAULT_METHOD_NAME = "addWireGenServices";
    public static final String DEFAULT_ENVIRONMENT_VARIABLE = "WIREGEN_ENVIRONMENT";

    public GeneratorConfig {
        packageName = packageName == null ? DEFAULT_PACKAGE : packageName;
        className = isBlank(className) ? DEFAULT_CLASS_NAME : className;
        methodName = isBlank(methodName) ? DEFAULT_METHOD_NAME : methodName;
        environmentVariable = isBlank(environmentVariable) ? DEFAULT_ENVIRONMENT_VARIABLE : environmentVariable;
    }

    public static GeneratorConfig defaults() {
        return new GeneratorConfig(DEFAULT_PACKAGE, DEFAULT_CLASS_NAME, DEFAULT_METHOD_NAME,
            DEFAULT_ENVIRONMENT_VARIABLE);
    }

    /**
     * Path of the registration source below the output directory.
     */
    public String registrationPath() {
        String directory = packageName.isEmpty() ? "" : packageName.replace('.', '/') + "/";
        return directory + className + ".java";
    }

    private static boolean isBlank(String value) {
        return Objects.requireNonNullElse(value, "").isBlank();
    }
}
