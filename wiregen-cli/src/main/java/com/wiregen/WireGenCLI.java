package com.wiregen;

import ch.qos.logback.classic.Level;
import com.wiregen.cli.CodesCommand;
import com.wiregen.cli.GenerateCommand;
import com.wiregen.cli.InitCommand;
import com.wiregen.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;

/**
 * Main CLI entry point for WireGen.
 *
 * <p>WireGen reads annotated Java sources, validates their dependency wiring and generates
 * constructors and container registration code.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code init} - Create a {@code wiregen.yaml}</li>
 *   <li>{@code generate} - Analyse sources and write generated code</li>
 *   <li>{@code validate} - Analyse sources and print diagnostics only</li>
 *   <li>{@code codes} - List diagnostic codes and their default severities</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * wiregen init
 * wiregen generate --fail-on-error
 * wiregen -v validate path/to/project
 * }</pre>
 */
@Command(
    name = "wiregen",
    mixinStandardHelpOptions = true,
    version = "WireGen 1.0.0-SNAPSHOT",
    description = "Compile-time dependency wiring for annotated Java services",
    subcommands = {
        InitCommand.class,
        GenerateCommand.class,
        ValidateCommand.class,
        CodesCommand.class
    }
)
public class WireGenCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(WireGenCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        PrintWriter out = spec.commandLine().getOut();
        out.println("WireGen - compile-time dependency wiring");
        out.println("Version: 1.0.0-SNAPSHOT");
        out.println();
        out.println("Use 'wiregen --help' to see available commands");
        out.println("Use 'wiregen <command> --help' for command-specific help");
    }

    /**
     * Sets the root log level from the global options. Runs before any subcommand.
     */
    void configureLogging() {
        Level level = quiet ? Level.ERROR : verbose ? Level.DEBUG : Level.INFO;
        org.slf4j.Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
            logbackRoot.setLevel(level);
        }
        log.debug("Log level set to {}", level);
    }

    /**
     * Creates the configured command line.
     *
     * @return command line with the logging strategy installed
     */
    public static CommandLine commandLine() {
        WireGenCLI cli = new WireGenCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
