package com.wiregen.core.renderer.impl;

import com.wiregen.core.renderer.GeneratedFile;
import com.wiregen.core.renderer.GeneratedOutput;
import com.wiregen.core.renderer.OutputRenderer;
import com.wiregen.core.renderer.RenderContext;
import com.wiregen.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Renderer that writes generated sources below the output directory.
 *
 * <p>Files whose content is unchanged are not rewritten, so their timestamps stay stable and
 * incremental compilers do not recompile them.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RenderContext context = new RenderContext("target/generated-sources/wiregen", Map.of());
 * new FileSystemRenderer().render(output, context);
 * // Creates: target/generated-sources/wiregen/com/acme/orders/OrderService.java
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = Paths.get(context.outputDirectory());
        logger.info("Rendering {} files to filesystem at: {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        int written = 0;
        for (GeneratedFile file : output.files()) {
            if (writeFile(outputDir, file)) {
                written++;
            }
        }
        logger.info("Wrote {} of {} files ({} unchanged)", written, output.files().size(),
            output.files().size() - written);
    }

    private boolean writeFile(Path outputDir, GeneratedFile file) {
        Path targetPath = outputDir.resolve(file.relativePath()).normalize();
        if (!targetPath.startsWith(outputDir.normalize())) {
            throw new IllegalStateException("Generated file escapes the output directory: " + file.relativePath());
        }
        try {
            boolean changed = FileUtils.writeIfChanged(targetPath, file.content());
            logger.debug("{} file: {}", changed ? "Wrote" : "Unchanged", targetPath);
            return changed;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
