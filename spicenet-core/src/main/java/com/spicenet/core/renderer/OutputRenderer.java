package com.spicenet.core.renderer;

/**
 * Writes a {@link GeneratedDeck} to a destination.
 *
 * <p>Renderers are discovered through {@link java.util.ServiceLoader}; register implementations in
 * {@code META-INF/services/com.spicenet.core.renderer.OutputRenderer}.
 *
 * @see GeneratedDeck
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns the identifier used to select this renderer in configuration and on the command line.
     *
     * @return lowercase renderer identifier (e.g., "filesystem", "console")
     */
    String getId();

    /**
     * Renders the deck to the target destination.
     *
     * @param deck deck to render
     * @param context output directory and renderer settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedDeck deck, RenderContext context);
}
