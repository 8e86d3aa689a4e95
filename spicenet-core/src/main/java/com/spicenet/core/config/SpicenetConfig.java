package com.spicenet.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration, loaded from {@code spicenet.yaml}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * output:
 *   directory: "./build/netlists"
 *   extension: "cir"
 *   renderer: filesystem
 *
 * validation:
 *   checkSubcircuits: true
 * }</pre>
 *
 * <p>Sections or keys missing from the file fall back to {@link #defaults()} through the
 * accessor methods.
 *
 * @param output output configuration
 * @param validation validation configuration
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpicenetConfig(
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("validation") ValidationConfig validation
) {
    private static final String DEFAULT_DIRECTORY = "./build/netlists";
    private static final String DEFAULT_EXTENSION = "cir";
    private static final String DEFAULT_RENDERER = "filesystem";

    /**
     * Creates the default configuration: decks written as {@code .cir} files under
     * {@code ./build/netlists}, sub-circuits checked before rendering.
     *
     * @return default configuration
     */
    public static SpicenetConfig defaults() {
        return new SpicenetConfig(
            new OutputConfig(DEFAULT_DIRECTORY, DEFAULT_EXTENSION, DEFAULT_RENDERER),
            new ValidationConfig(true)
        );
    }

    public String outputDirectory() {
        return output != null && output.directory() != null ? output.directory() : DEFAULT_DIRECTORY;
    }

    public String outputExtension() {
        return output != null && output.extension() != null ? output.extension() : DEFAULT_EXTENSION;
    }

    public String rendererId() {
        return output != null && output.renderer() != null ? output.renderer() : DEFAULT_RENDERER;
    }

    public boolean checkSubcircuits() {
        return validation == null || validation.checkSubcircuits() == null || validation.checkSubcircuits();
    }

    /**
     * Output configuration.
     *
     * @param directory output directory path
     * @param extension file extension of written decks, without leading dot
     * @param renderer renderer ID ("filesystem" or "console")
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("extension") String extension,
        @JsonProperty("renderer") String renderer
    ) {}

    /**
     * Validation configuration.
     *
     * @param checkSubcircuits whether sub-circuit interface nodes are checked before rendering
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidationConfig(
        @JsonProperty("checkSubcircuits") Boolean checkSubcircuits
    ) {}
}
