package com.spicenet.core.renderer.impl;

import com.spicenet.core.renderer.GeneratedDeck;
import com.spicenet.core.renderer.OutputRenderer;
import com.spicenet.core.renderer.RenderContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    @TempDir
    Path tempDir;

    private final FileSystemRenderer renderer = new FileSystemRenderer();

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_createsDirectoriesAndWritesDeck() throws IOException {
        Path outputDir = tempDir.resolve("nested/decks");
        GeneratedDeck deck = new GeneratedDeck("amp", ".title amp\n.end\n", "cir");

        renderer.render(deck, new RenderContext(outputDir.toString(), Map.of()));

        Path written = outputDir.resolve("amp.cir");
        assertThat(written).exists();
        assertThat(Files.readString(written)).isEqualTo(".title amp\n.end\n");
    }

    @Test
    void render_existingFile_isOverwritten() throws IOException {
        Files.writeString(tempDir.resolve("amp.cir"), "stale");

        renderer.render(new GeneratedDeck("amp", "fresh\n", "cir"), new RenderContext(tempDir.toString(), Map.of()));

        assertThat(Files.readString(tempDir.resolve("amp.cir"))).isEqualTo("fresh\n");
    }

    @Test
    void render_outputDirectoryIsAFile_throwsException() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");

        assertThatThrownBy(() -> renderer.render(new GeneratedDeck("amp", "", "cir"),
            new RenderContext(blocker.toString(), Map.of())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("output directory");
    }

    @Test
    void serviceLoader_discoversBuiltInRenderers() {
        assertThat(ServiceLoader.load(OutputRenderer.class))
            .extracting(OutputRenderer::getId)
            .contains("filesystem", "console");
    }
}
