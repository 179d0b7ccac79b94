package com.wiregen.core.engine;

import com.wiregen.core.renderer.GeneratedOutput;

import java.util.Objects;

/**
 * Outcome of a generating run.
 *
 * @param analysis analysis, its diagnostics including those reported during generation
 * @param output generated files
 */
public record GenerationResult(AnalysisResult analysis, GeneratedOutput output) {

    public GenerationResult {
        Objects.requireNonNull(analysis, "analysis must not be null");
        Objects.requireNonNull(output, "output must not be null");
    }
}
