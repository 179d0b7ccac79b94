package com.wiregen.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.wiregen.core.diagnostic.DiagnosticCode;
import com.wiregen.core.diagnostic.DiagnosticSettings;
import com.wiregen.core.diagnostic.Severity;
import com.wiregen.core.model.Lifetime;
import com.wiregen.core.naming.NamingResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Loads {@code wiregen.yaml} and turns its raw values into the settings the engine uses.
 *
 * <p>Uses Jackson to deserialize the file into {@link WireGenConfig} records. A missing or
 * unparseable file yields {@link WireGenConfig#defaults()}; an unknown severity, diagnostic code
 * or lifetime is logged and ignored. Configuration problems never stop a run.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * WireGenConfig config = ConfigLoader.load(Paths.get("wiregen.yaml"));
 * DiagnosticSettings settings = ConfigLoader.diagnosticSettings(config);
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_FILE_NAME = "wiregen.yaml";

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code wiregen.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static WireGenConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.info("Configuration file not found: {}. Using defaults.", configPath);
            return WireGenConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return WireGenConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            WireGenConfig config = YAML_MAPPER.readValue(configPath.toFile(), WireGenConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return WireGenConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return WireGenConfig.defaults();
        }
    }

    /**
     * Resolves the severity overrides, keyed by diagnostic id or name.
     */
    public static DiagnosticSettings diagnosticSettings(WireGenConfig config) {
        Map<DiagnosticCode, Severity> overrides = new EnumMap<>(DiagnosticCode.class);
        config.diagnostics().severities().forEach((key, value) -> {
            Optional<DiagnosticCode> code = DiagnosticCode.find(key);
            if (code.isEmpty()) {
                log.warn("Ignoring severity for unknown diagnostic code: {}", key);
                return;
            }
            try {
                overrides.put(code.get(), Severity.parse(value));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring invalid severity '{}' for {}", value, key);
            }
        });
        return new DiagnosticSettings(config.diagnostics().enabled(), overrides);
    }

    /**
     * Lifetime of services without a lifetime marker; Scoped unless configured.
     */
    public static Lifetime defaultLifetime(WireGenConfig config) {
        String value = config.analysisDefaults().lifetime();
        if (value == null || value.isBlank()) {
            return Lifetime.SCOPED;
        }
        try {
            Lifetime lifetime = Lifetime.parse(value.trim());
            if (lifetime.isAssigned()) {
                return lifetime;
            }
        } catch (IllegalArgumentException e) {
            log.debug("Lifetime parse failure", e);
        }
        log.warn("Ignoring invalid default lifetime '{}'; using Scoped", value);
        return Lifetime.SCOPED;
    }

    /**
     * Interface marker character; the first character of the configured value, {@code I} when absent.
     */
    public static char interfaceMarker(WireGenConfig config) {
        String value = config.analysisDefaults().interfaceMarker();
        if (value == null || value.isEmpty()) {
            return NamingResolver.DEFAULT_MARKER;
        }
        if (value.length() > 1) {
            log.warn("Interface marker '{}' is longer than one character; using '{}'", value, value.charAt(0));
        }
        return value.charAt(0);
    }
}
