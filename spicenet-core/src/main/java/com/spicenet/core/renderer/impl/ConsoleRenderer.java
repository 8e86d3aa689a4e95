package com.spicenet.core.renderer.impl;

import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import com.spicenet.core.renderer.GeneratedDeck;
import com.spicenet.core.renderer.OutputRenderer;
import com.spicenet.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renderer that prints decks to a console stream.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.showHeaders} - Print a comment line naming the deck ("true"/"false", default: "false")</li>
 * </ul>
 *
 * <p>The header is a SPICE comment, so the printed text stays a valid deck.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private final PrintWriter out;

    public ConsoleRenderer() {
        this(new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true));
    }

    public ConsoleRenderer(PrintWriter out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedDeck deck, RenderContext context) {
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault("console.showHeaders", "false"));
        logger.debug("Rendering deck {} to console (headers: {})", deck.fileName(), showHeaders);

        if (showHeaders) {
            out.print("* " + deck.fileName() + "\n");
        }
        out.print(deck.content());
        out.flush();
    }
}
