package com.wiregen.cli;

import com.wiregen.core.config.WireGenConfig;
import com.wiregen.core.engine.AnalysisResult;
import com.wiregen.core.engine.WiringEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command to analyse a project and print its diagnostics without generating code.
 */
@Command(
    name = "validate",
    description = "Analyse sources and report wiring problems",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private ProjectOptions project;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            WireGenConfig config = project.loadConfiguration();
            AnalysisResult result = new WiringEngine(config).analyze(project.loadSnapshot(config));

            out.printf("Analysed %d type(s), %d registration(s)%n",
                result.graph().types().size(), result.plan().all().size());
            for (List<String> cycle : result.cycles()) {
                log.debug("Cycle: {}", String.join(" -> ", cycle));
            }
            ProjectOptions.printDiagnostics(result, out);
            if (!result.cycles().isEmpty()) {
                out.println("Cycles: " + result.cycles().stream()
                    .map(cycle -> String.join(" -> ", cycle))
                    .collect(Collectors.joining("; ")));
            }
            return project.exitCodeFor(result);
        } catch (IOException e) {
            log.error("Validation failed", e);
            spec.commandLine().getErr().println("Validation failed: " + e.getMessage());
            return ExitCodes.FAILURE;
        }
    }
}
