package com.spicenet.core.renderer.impl;

import com.spicenet.core.renderer.GeneratedDeck;
import com.spicenet.core.renderer.OutputRenderer;
import com.spicenet.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Renderer that writes decks to the filesystem.
 *
 * <p>Creates the output directory when missing and overwrites existing decks.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RenderContext context = new RenderContext("./build/netlists", Map.of());
 * new FileSystemRenderer().render(GeneratedDeck.of(circuit, "cir"), context);
 * // Creates: ./build/netlists/<title>.cir
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedDeck deck, RenderContext context) {
        Path outputDir = Paths.get(context.outputDirectory());
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        Path target = outputDir.resolve(deck.fileName());
        logger.debug("Writing deck: {}", target);
        try {
            Files.writeString(target, deck.content());
            logger.info("Wrote deck: {} ({} bytes)", target, deck.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write deck: " + target, e);
        }
    }
}
