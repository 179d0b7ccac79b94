package com.wiregen.cli;

import com.wiregen.core.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to create a commented {@code wiregen.yaml} holding the default settings.
 */
@Command(
    name = "init",
    description = "Create a wiregen.yaml configuration file",
    mixinStandardHelpOptions = true
)
public class InitCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InitCommand.class);

    static final String TEMPLATE = """
        # WireGen configuration
        project:
          name: "%s"

        # Source roots, relative to this file
        sources:
          - src/main/java

        diagnostics:
          enabled: true
          # Severity per diagnostic id or name: error, warning, info, off
          severities: {}

        defaults:
          # Lifetime of services without @Singleton, @Scoped or @Transient
          lifetime: scoped
          interfaceMarker: "I"
          reportUnknownTypes: false

        registration:
          packageName: "com.wiregen.generated"
          className: "WireGenRegistrations"
          methodName: "addWireGenServices"
          environmentVariable: "WIREGEN_ENVIRONMENT"

        output:
          directory: "target/generated-sources/wiregen"
        """;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Project directory (default: current directory)", defaultValue = ".")
    private Path projectPath;

    @Option(names = {"-f", "--force"}, description = "Overwrite an existing configuration file")
    private boolean force;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        Path configFile = projectPath.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        if (Files.exists(configFile) && !force) {
            spec.commandLine().getErr().println(configFile + " already exists; use --force to overwrite it");
            return ExitCodes.FAILURE;
        }
        try {
            Files.createDirectories(projectPath);
            Files.writeString(configFile, TEMPLATE.formatted(projectName()));
            log.info("Created configuration: {}", configFile);
            out.println("Created " + configFile);
            return ExitCodes.OK;
        } catch (IOException e) {
            log.error("Failed to write configuration", e);
            spec.commandLine().getErr().println("Failed to write " + configFile + ": " + e.getMessage());
            return ExitCodes.FAILURE;
        }
    }

    private String projectName() {
        Path name = projectPath.toAbsolutePath().normalize().getFileName();
        return name == null ? "project" : name.toString();
    }
}
