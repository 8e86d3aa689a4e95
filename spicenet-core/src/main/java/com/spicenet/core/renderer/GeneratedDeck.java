package com.spicenet.core.renderer;

import java.util.Locale;
import java.util.Objects;

import com.spicenet.core.netlist.Circuit;

/**
 * A rendered SPICE deck ready to be written somewhere.
 *
 * @param name base name of the deck, without extension
 * @param content netlist text
 * @param extension file extension without the leading dot (e.g., "cir")
 */
public record GeneratedDeck(
    String name,
    String content,
    String extension
) {
    private static final String FALLBACK_NAME = "circuit";

    /**
     * Compact constructor with validation.
     */
    public GeneratedDeck {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (extension == null || extension.isBlank()) {
            extension = "cir";
        } else if (extension.startsWith(".")) {
            extension = extension.substring(1);
        }
    }

    /**
     * @return the file name, {@code name.extension}
     */
    public String fileName() {
        return name + "." + extension;
    }

    /**
     * Renders a circuit and names the deck after its title.
     *
     * <p>Characters outside {@code [a-zA-Z0-9_-]} become {@code -}; an empty title yields "circuit".
     *
     * @param circuit circuit to render
     * @param extension file extension
     * @return the deck
     */
    public static GeneratedDeck of(Circuit circuit, String extension) {
        return new GeneratedDeck(deckName(circuit.title()), circuit.toSpice(), extension);
    }

    static String deckName(String title) {
        String sanitized = title.strip().toLowerCase(Locale.ROOT).replaceAll("[^a-zA-Z0-9_-]", "-");
        return sanitized.isEmpty() ? FALLBACK_NAME : sanitized;
    }
}
