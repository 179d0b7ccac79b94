package com.wiregen.cli;

import com.wiregen.core.diagnostic.DiagnosticCode;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list the diagnostic codes. Ids and names are the keys accepted by
 * {@code diagnostics.severities} in {@code wiregen.yaml}.
 */
@Command(
    name = "codes",
    description = "List diagnostic codes and their default severities",
    mixinStandardHelpOptions = true
)
public class CodesCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Diagnostic codes (" + DiagnosticCode.values().length + "):");
        for (DiagnosticCode code : DiagnosticCode.values()) {
            out.printf("  • %s %-45s %s%n", code.id(), code.codeName(),
                code.defaultSeverity().name().toLowerCase(Locale.ROOT));
        }
        return ExitCodes.OK;
    }
}
