package com.wiregen.core.renderer;

/**
 * Writes generated files to a destination.
 *
 * <p><b>Registration:</b> implementations are listed in
 * {@code META-INF/services/com.wiregen.core.renderer.OutputRenderer} and looked up by
 * {@link #getId()}.
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer, lowercase (e.g., "filesystem", "console").
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Renders the generated output.
     *
     * @param output generated files
     * @param context output directory and renderer settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
