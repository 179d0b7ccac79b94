package com.wiregen.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Collection of generated files to be rendered.
 *
 * @param files generated files, in generation order
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public static GeneratedOutput empty() {
        return new GeneratedOutput(List.of());
    }

    /**
     * Files produced by one generator.
     *
     * @param generatorId generator id
     * @return matching files
     */
    public List<GeneratedFile> filesOf(String generatorId) {
        return files.stream().filter(file -> generatorId.equals(file.generatorId())).toList();
    }
}
