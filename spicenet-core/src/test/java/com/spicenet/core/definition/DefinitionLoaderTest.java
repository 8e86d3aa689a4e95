package com.spicenet.core.definition;

import com.spicenet.core.definition.CircuitDefinition.ElementDefinition;
import com.spicenet.core.error.DefinitionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DefinitionLoader}.
 */
class DefinitionLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_fixture_readsEverySection() throws URISyntaxException {
        Path fixture = Path.of(getClass().getResource("/definitions/rc-filter.yaml").toURI());

        CircuitDefinition definition = DefinitionLoader.load(fixture);

        assertThat(definition.title()).isEqualTo("RC filter");
        assertThat(definition.includes()).containsExactly("models.lib");
        assertThat(definition.globals()).containsExactly("VCC");
        assertThat(definition.parameters()).containsEntry("rval", "1k");
        assertThat(definition.models()).singleElement()
            .satisfies(model -> {
                assertThat(model.name()).isEqualTo("dmod");
                assertThat(model.type()).isEqualTo("D");
                assertThat(model.parameters()).containsEntry("is", "1e-14");
            });
        assertThat(definition.subcircuits()).singleElement()
            .satisfies(sub -> {
                assertThat(sub.nodes()).containsExactly("in", "out");
                assertThat(sub.elements()).hasSize(2);
            });
        assertThat(definition.elements()).extracting(ElementDefinition::kind)
            .containsExactly("voltage-source", "resistor", "capacitor", "diode", "subcircuit");
    }

    @Test
    void parse_scalarNamesAndNodes_becomeStrings() {
        CircuitDefinition definition = DefinitionLoader.parse("""
            title: t
            elements:
              - kind: R
                name: 1
                nodes: [1, 0]
                args: [1000]
            """);

        ElementDefinition element = definition.elements().get(0);
        assertThat(element.name()).isEqualTo("1");
        assertThat(element.nodes()).containsExactly("1", "0");
        assertThat(element.args()).containsExactly(1000);
    }

    @Test
    void parse_missingSections_defaultToEmpty() {
        CircuitDefinition definition = DefinitionLoader.parse("title: bare\n");

        assertThat(definition.ground()).isNull();
        assertThat(definition.globals()).isEmpty();
        assertThat(definition.includes()).isEmpty();
        assertThat(definition.parameters()).isEmpty();
        assertThat(definition.models()).isEmpty();
        assertThat(definition.subcircuits()).isEmpty();
        assertThat(definition.elements()).isEmpty();
    }

    @Test
    void parse_elementWithoutOptionalFields_defaultsToEmpty() {
        CircuitDefinition definition = DefinitionLoader.parse("""
            elements:
              - kind: K
                name: 1
            """);

        ElementDefinition element = definition.elements().get(0);
        assertThat(definition.title()).isEmpty();
        assertThat(element.nodes()).isEmpty();
        assertThat(element.args()).isEmpty();
        assertThat(element.params()).isEmpty();
        assertThat(element.probes()).isEmpty();
    }

    @Test
    void parse_invalidYaml_throwsDefinitionException() {
        assertThatThrownBy(() -> DefinitionLoader.parse("elements: [unclosed"))
            .isInstanceOf(DefinitionException.class)
            .hasMessageContaining("Failed to parse circuit definition");
    }

    @Test
    void parse_wrongShape_throwsDefinitionException() {
        assertThatThrownBy(() -> DefinitionLoader.parse("elements: just-a-string"))
            .isInstanceOf(DefinitionException.class);
    }

    @Test
    void load_missingFile_throwsDefinitionException() {
        assertThatThrownBy(() -> DefinitionLoader.load(tempDir.resolve("missing.yaml")))
            .isInstanceOf(DefinitionException.class)
            .hasMessageContaining("not found");
    }

    @Test
    void load_emptyFile_throwsDefinitionException() throws IOException {
        Path file = tempDir.resolve("empty.yaml");
        Files.writeString(file, "");

        assertThatThrownBy(() -> DefinitionLoader.load(file))
            .isInstanceOf(DefinitionException.class);
    }
}
