package com.spicenet.core.util;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SpiceStrings}.
 */
class SpiceStringsTest {

    @Test
    void joinFields_skipsNullAndEmptyTokens() {
        assertThat(SpiceStrings.joinFields(Arrays.asList("R1", null, "", "a", "0", "1k")))
            .isEqualTo("R1 a 0 1k");
    }

    @Test
    void joinFields_noTokens_returnsEmptyString() {
        assertThat(SpiceStrings.joinFields(List.of())).isEmpty();
    }

    @Test
    void joinLines_prefixesAndTerminatesEveryLine() {
        assertThat(SpiceStrings.joinLines(List.of("a.lib", "b.lib"), ".include "))
            .isEqualTo(".include a.lib\n.include b.lib\n");
        assertThat(SpiceStrings.joinLines(List.of(), ".include ")).isEmpty();
    }

    @Test
    void joinDict_keepsIterationOrder() {
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put("is", "1e-14");
        entries.put("n", 1.5);
        entries.put("bv", 100);

        assertThat(SpiceStrings.joinDict(entries)).isEqualTo("is=1e-14, n=1.5, bv=100");
    }

    @Test
    void requireToken_validToken_returnsIt() {
        assertThat(SpiceStrings.requireToken("out", "node")).isEqualTo("out");
    }

    @Test
    void requireToken_blankOrWhitespace_throwsException() {
        assertThatThrownBy(() -> SpiceStrings.requireToken(" ", "node"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("node must not be blank");
        assertThatThrownBy(() -> SpiceStrings.requireToken("my node", "node"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("whitespace");
        assertThatThrownBy(() -> SpiceStrings.requireToken(null, "node"))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void singleLine_collapsesLineBreaks() {
        assertThat(SpiceStrings.singleLine("first line\n  second line\r\nthird")).isEqualTo("first line second line third");
        assertThat(SpiceStrings.singleLine("  padded  ")).isEqualTo("padded");
    }

    @Test
    void quoteIfNeeded_quotesOnlyPathsWithWhitespace() {
        assertThat(SpiceStrings.quoteIfNeeded("models/diodes.lib")).isEqualTo("models/diodes.lib");
        assertThat(SpiceStrings.quoteIfNeeded("my models/diodes.lib")).isEqualTo("\"my models/diodes.lib\"");
    }

    @Test
    void formatNumber_usesPlainNotation() {
        assertThat(SpiceStrings.formatNumber(1000.0)).isEqualTo("1000");
        assertThat(SpiceStrings.formatNumber(0.0)).isEqualTo("0");
        assertThat(SpiceStrings.formatNumber(0.6)).isEqualTo("0.6");
        assertThat(SpiceStrings.formatNumber(-27.5)).isEqualTo("-27.5");
    }

    @Test
    void formatNumber_notFinite_throwsException() {
        assertThatThrownBy(() -> SpiceStrings.formatNumber(Double.NaN))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SpiceStrings.formatNumber(Double.POSITIVE_INFINITY))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
