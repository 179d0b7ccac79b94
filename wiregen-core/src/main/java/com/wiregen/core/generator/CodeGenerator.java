package com.wiregen.core.generator;

import com.wiregen.core.diagnostic.DiagnosticReporter;
import com.wiregen.core.renderer.GeneratedFile;

import java.util.List;

/**
 * Produces Java source from the analysis of one run.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI). A generator must not
 * throw for problems confined to one type: it reports them and carries on with the next type,
 * so that unrelated output is still produced.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.wiregen.core.generator.CodeGenerator}
 *
 * @see GenerationInput
 * @see GeneratorConfig
 */
public interface CodeGenerator {

    /**
     * Returns unique identifier for this generator, lowercase (e.g., "constructors").
     *
     * @return generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name, used in CLI output and logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Generates source files.
     *
     * @param input analysed snapshot
     * @param config generation settings
     * @param reporter receives per-type emission failures
     * @return generated files, in a deterministic order
     */
    List<GeneratedFile> generate(GenerationInput input, GeneratorConfig config, DiagnosticReporter reporter);
}
