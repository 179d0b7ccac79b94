package com.wiregen.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.wiregen.core.generator.GeneratorConfig;

import java.util.List;
import java.util.Map;

/**
 * Root configuration of a WireGen run.
 *
 * <p>Loaded from {@code wiregen.yaml} in the project root. Every section is optional; missing
 * sections and values fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "orders"
 *
 * sources:
 *   - src/main/java
 *
 * diagnostics:
 *   enabled: true
 *   severities:
 *     WG013: error
 *     unresolved-dependency: "off"
 *
 * defaults:
 *   lifetime: scoped
 *   interfaceMarker: "I"
 *   reportUnknownTypes: false
 *
 * registration:
 *   packageName: "com.acme.orders.wiring"
 *   className: "OrderRegistrations"
 *
 * output:
 *   directory: "target/generated-sources/wiregen"
 * }</pre>
 *
 * @param project project metadata
 * @param sources source roots, relative to the project root
 * @param diagnostics diagnostic switch and severity overrides
 * @param analysisDefaults analysis defaults, the {@code defaults} section
 * @param registration generated registration entry point
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WireGenConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("sources") List<String> sources,
    @JsonProperty("diagnostics") DiagnosticsConfig diagnostics,
    @JsonProperty("defaults") DefaultsConfig analysisDefaults,
    @JsonProperty("registration") RegistrationConfig registration,
    @JsonProperty("output") OutputConfig output
) {
    public static final String DEFAULT_SOURCE_ROOT = "src/main/java";
    public static final String DEFAULT_OUTPUT_DIRECTORY = "target/generated-sources/wiregen";

    public WireGenConfig {
        project = project == null ? new ProjectInfo("project") : project;
        sources = sources == null || sources.isEmpty() ? List.of(DEFAULT_SOURCE_ROOT) : List.copyOf(sources);
        diagnostics = diagnostics == null ? new DiagnosticsConfig(true, Map.of()) : diagnostics;
        analysisDefaults = analysisDefaults == null ? new DefaultsConfig(null, null, false) : analysisDefaults;
        registration = registration == null ? new RegistrationConfig(null, null, null, null) : registration;
        output = output == null ? new OutputConfig(DEFAULT_OUTPUT_DIRECTORY) : output;
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static WireGenConfig defaults() {
        return new WireGenConfig(null, null, null, null, null, null);
    }

    /**
     * Project metadata.
     *
     * @param name project name
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name
    ) {}

    /**
     * Diagnostic settings.
     *
     * @param enabled global switch; {@code false} suppresses every diagnostic
     * @param severities severity per diagnostic id or name ("error", "warning", "info", "off")
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DiagnosticsConfig(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("severities") Map<String, String> severities
    ) {
        public DiagnosticsConfig {
            enabled = enabled == null ? Boolean.TRUE : enabled;
            severities = severities == null ? Map.of() : Map.copyOf(severities);
        }
    }

    /**
     * Analysis defaults.
     *
     * @param lifetime lifetime of services without a lifetime marker, {@code scoped} when absent
     * @param interfaceMarker leading character stripped from interface names, {@code I} when absent
     * @param reportUnknownTypes whether dependencies on types outside the sources are reported
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DefaultsConfig(
        @JsonProperty("lifetime") String lifetime,
        @JsonProperty("interfaceMarker") String interfaceMarker,
        @JsonProperty("reportUnknownTypes") boolean reportUnknownTypes
    ) {}

    /**
     * Generated registration entry point.
     *
     * @param packageName package of the generated class
     * @param className generated class name
     * @param methodName generated method name
     * @param environmentVariable environment variable read by conditional registrations
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RegistrationConfig(
        @JsonProperty("packageName") String packageName,
        @JsonProperty("className") String className,
        @JsonProperty("methodName") String methodName,
        @JsonProperty("environmentVariable") String environmentVariable
    ) {
        public GeneratorConfig toGeneratorConfig() {
            return new GeneratorConfig(packageName, className, methodName, environmentVariable);
        }
    }

    /**
     * Output settings.
     *
     * @param directory directory generated sources are written to
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory
    ) {
        public OutputConfig {
            directory = directory == null || directory.isBlank() ? DEFAULT_OUTPUT_DIRECTORY : directory;
        }
    }
}
