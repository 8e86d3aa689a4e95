package com.spicenet.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("spicenet.yaml");
        Files.writeString(configFile, """
            output:
              directory: "./out/decks"
              extension: "sp"
              renderer: console

            validation:
              checkSubcircuits: false
            """);

        SpicenetConfig config = ConfigLoader.load(configFile);

        assertThat(config).isNotNull();
        assertThat(config.outputDirectory()).isEqualTo("./out/decks");
        assertThat(config.outputExtension()).isEqualTo("sp");
        assertThat(config.rendererId()).isEqualTo("console");
        assertThat(config.checkSubcircuits()).isFalse();
    }

    @Test
    void load_partialYaml_fallsBackPerKey() throws IOException {
        Path configFile = tempDir.resolve("spicenet.yaml");
        Files.writeString(configFile, """
            output:
              extension: "net"
            """);

        SpicenetConfig config = ConfigLoader.load(configFile);

        assertThat(config.output().directory()).isNull();
        assertThat(config.outputDirectory()).isEqualTo("./build/netlists");
        assertThat(config.outputExtension()).isEqualTo("net");
        assertThat(config.rendererId()).isEqualTo("filesystem");
        assertThat(config.checkSubcircuits()).isTrue();
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("spicenet.yaml");
        Files.writeString(configFile, """
            simulator:
              name: ngspice
            output:
              directory: "decks"
              colour: blue
            """);

        SpicenetConfig config = ConfigLoader.load(configFile);

        assertThat(config.outputDirectory()).isEqualTo("decks");
    }

    @Test
    void load_missingFile_returnsDefaults() {
        SpicenetConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(SpicenetConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(SpicenetConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("spicenet.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(SpicenetConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("spicenet.yaml");
        Files.writeString(configFile, """
            output:
              directory: [unclosed
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(SpicenetConfig.defaults());
    }

    @Test
    void defaults_haveExpectedValues() {
        SpicenetConfig config = SpicenetConfig.defaults();

        assertThat(config.outputDirectory()).isEqualTo("./build/netlists");
        assertThat(config.outputExtension()).isEqualTo("cir");
        assertThat(config.rendererId()).isEqualTo("filesystem");
        assertThat(config.checkSubcircuits()).isTrue();
    }
}
