package com.wiregen.cli;

import com.wiregen.core.config.ConfigLoader;
import com.wiregen.core.config.WireGenConfig;
import com.wiregen.core.diagnostic.Diagnostic;
import com.wiregen.core.diagnostic.Severity;
import com.wiregen.core.engine.AnalysisResult;
import com.wiregen.core.model.DeclarationSnapshot;
import com.wiregen.core.scanner.SnapshotLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Options and helpers shared by the commands that analyse a project.
 */
public class ProjectOptions {

    private static final Logger log = LoggerFactory.getLogger(ProjectOptions.class);

    @Parameters(
        index = "0",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file, relative to the project directory (default: wiregen.yaml)"
    )
    Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"--fail-on-error"},
        description = "Exit with code 2 when error diagnostics are reported"
    )
    boolean failOnError;

    WireGenConfig loadConfiguration() {
        Path absoluteConfigPath = configPath.isAbsolute() ? configPath : projectPath.resolve(configPath);
        log.debug("Loading configuration from: {}", absoluteConfigPath);
        return ConfigLoader.load(absoluteConfigPath);
    }

    DeclarationSnapshot loadSnapshot(WireGenConfig config) throws IOException {
        List<Path> roots = config.sources().stream().map(projectPath::resolve).toList();
        return SnapshotLoader.load(roots);
    }

    /**
     * Prints every diagnostic followed by a summary line.
     */
    static void printDiagnostics(AnalysisResult result, PrintWriter out) {
        for (Diagnostic diagnostic : result.diagnostics()) {
            out.println(diagnostic.format());
        }
        out.printf("%d error(s), %d warning(s), %d info(s)%s%n",
            result.count(Severity.ERROR),
            result.count(Severity.WARNING),
            result.count(Severity.INFO),
            result.suppressedCount() > 0 ? ", " + result.suppressedCount() + " suppressed" : "");
    }

    int exitCodeFor(AnalysisResult result) {
        return failOnError && result.hasErrors() ? ExitCodes.DIAGNOSTIC_ERRORS : ExitCodes.OK;
    }
}
