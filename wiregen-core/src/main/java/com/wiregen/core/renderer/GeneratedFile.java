package com.wiregen.core.renderer;

import java.util.Objects;

/**
 * A generated source file to be rendered.
 *
 * @param relativePath path below the output directory, {@code /} separated
 *                     (e.g., "com/acme/orders/OrderService.java")
 * @param content file content
 * @param generatorId id of the generator that produced it
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String generatorId
) {
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(generatorId, "generatorId must not be null");
        if (relativePath.isBlank() || relativePath.startsWith("/")) {
            throw new IllegalArgumentException("relativePath must be a relative file path: " + relativePath);
        }
    }
}
