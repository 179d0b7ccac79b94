package com.wiregen.cli;

import com.wiregen.core.config.WireGenConfig;
import com.wiregen.core.engine.GenerationResult;
import com.wiregen.core.engine.WiringEngine;
import com.wiregen.core.model.DeclarationSnapshot;
import com.wiregen.core.renderer.OutputRenderer;
import com.wiregen.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to analyse a project and write the generated sources.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Generate for the current directory
 * wiregen generate
 *
 * # Print the generated code instead of writing it
 * wiregen generate --dry-run
 *
 * # Fail the build on error diagnostics
 * wiregen generate --fail-on-error
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Analyse sources and generate constructors and registration code",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private ProjectOptions project;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"--dry-run"},
        description = "Print generated files instead of writing them"
    )
    private boolean dryRun;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            log.info("Generating for: {}", project.projectPath.toAbsolutePath());
            WireGenConfig config = project.loadConfiguration();
            DeclarationSnapshot snapshot = project.loadSnapshot(config);
            out.println("Analysing " + snapshot.units().size() + " source file(s)");

            GenerationResult result = new WiringEngine(config).generate(snapshot);
            ProjectOptions.printDiagnostics(result.analysis(), out);

            Path target = outputDirectory(config);
            String rendererId = dryRun ? "console" : "filesystem";
            findRenderer(rendererId).render(result.output(),
                new RenderContext(target.toString(), Map.of("console.colors", "false")));
            if (!dryRun) {
                out.println("Wrote " + result.output().files().size() + " file(s) to " + target);
            }
            return project.exitCodeFor(result.analysis());
        } catch (IOException | IllegalStateException e) {
            log.error("Generation failed", e);
            err.println("Generation failed: " + e.getMessage());
            return ExitCodes.FAILURE;
        }
    }

    private Path outputDirectory(WireGenConfig config) {
        if (outputDir != null) {
            return outputDir;
        }
        Path configured = Path.of(config.output().directory());
        return configured.isAbsolute() ? configured : project.projectPath.resolve(configured);
    }

    private static OutputRenderer findRenderer(String id) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equals(id)) {
                return renderer;
            }
        }
        throw new IllegalStateException("No output renderer registered with id: " + id);
    }
}
