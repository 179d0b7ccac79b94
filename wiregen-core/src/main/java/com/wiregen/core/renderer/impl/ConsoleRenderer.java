package com.wiregen.core.renderer.impl;

import com.wiregen.core.renderer.GeneratedFile;
import com.wiregen.core.renderer.GeneratedOutput;
import com.wiregen.core.renderer.OutputRenderer;
import com.wiregen.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Renderer that prints generated files, used for dry runs.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors ("true"/"false", default: "true")</li>
 *   <li>{@code console.showHeaders} - Show file headers ("true"/"false", default: "true")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String SEPARATOR = "-".repeat(80);

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean useColors = context.isEnabled("console.colors", true);
        boolean showHeaders = context.isEnabled("console.showHeaders", true);
        String reset = useColors ? ANSI_RESET : "";

        out.println((useColors ? ANSI_BOLD + ANSI_GREEN : "") + "Generated " + output.files().size()
            + " file(s)" + reset);
        for (int i = 0; i < output.files().size(); i++) {
            GeneratedFile file = output.files().get(i);
            out.println((useColors ? ANSI_YELLOW : "") + SEPARATOR + reset);
            if (showHeaders) {
                out.println((useColors ? ANSI_BOLD + ANSI_CYAN : "") + "File " + (i + 1) + "/"
                    + output.files().size() + ": " + file.relativePath() + reset);
                out.println();
            }
            out.println(file.content());
        }
        logger.debug("Printed {} files to console", output.files().size());
    }
}
