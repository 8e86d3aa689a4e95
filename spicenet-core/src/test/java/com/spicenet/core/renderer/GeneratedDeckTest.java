package com.spicenet.core.renderer;

import com.spicenet.core.netlist.Circuit;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link GeneratedDeck}.
 */
class GeneratedDeckTest {

    @Test
    void of_namesDeckAfterTitle() {
        Circuit circuit = new Circuit("RC Low-Pass (v2)");
        circuit.resistor("1", "in", "out", "1k");

        GeneratedDeck deck = GeneratedDeck.of(circuit, "cir");

        assertThat(deck.name()).isEqualTo("rc-low-pass--v2-");
        assertThat(deck.fileName()).isEqualTo("rc-low-pass--v2-.cir");
        assertThat(deck.content()).isEqualTo(circuit.toSpice());
    }

    @Test
    void of_emptyTitle_usesFallbackName() {
        assertThat(GeneratedDeck.of(new Circuit(""), "cir").name()).isEqualTo("circuit");
    }

    @Test
    void constructor_normalizesExtension() {
        assertThat(new GeneratedDeck("amp", "", ".sp").fileName()).isEqualTo("amp.sp");
        assertThat(new GeneratedDeck("amp", "", null).fileName()).isEqualTo("amp.cir");
    }

    @Test
    void constructor_invalidArguments_throwException() {
        assertThatThrownBy(() -> new GeneratedDeck(null, "", "cir"))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("name");
        assertThatThrownBy(() -> new GeneratedDeck("amp", null, "cir"))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("content");
        assertThatThrownBy(() -> new GeneratedDeck(" ", "", "cir"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
