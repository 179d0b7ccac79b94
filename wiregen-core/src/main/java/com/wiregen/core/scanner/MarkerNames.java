package com.wiregen.core.scanner;

/**
 * Simple names of the annotations the extractor recognizes. Qualified usages must be in
 * {@value #API_PACKAGE}.
 */
public final class MarkerNames {

    public static final String API_PACKAGE = "com.wiregen.api";

    public static final String SINGLETON = "Singleton";
    public static final String SCOPED = "Scoped";
    public static final String TRANSIENT = "Transient";
    public static final String INJECT = "Inject";
    public static final String INJECT_CONFIGURATION = "InjectConfiguration";
    public static final String DEPENDS_ON = "DependsOn";
    public static final String EXTERNAL_SERVICE = "ExternalService";
    public static final String REGISTER_AS_ALL = "RegisterAsAll";
    public static final String REGISTER_AS = "RegisterAs";
    public static final String SKIP_REGISTRATION = "SkipRegistration";
    public static final String CONDITIONAL_SERVICE = "ConditionalService";

    /** Suffix of the containers of repeatable markers, e.g. {@code DependsOn.List}. */
    public static final String CONTAINER_SUFFIX = ".List";

    private MarkerNames() {
        // Constants
    }
}
