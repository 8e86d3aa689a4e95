package com.spicenet.cli;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ListCommand}.
 */
class ListCommandTest {

    @Test
    void list_elements_printsCatalogue() {
        CliTestSupport.Result result = CliTestSupport.run("list", "elements");

        assertThat(result.exitCode()).isZero();
        assertThat(result.out())
            .contains("Resistor (prefix: R, nodes: 2)")
            .contains("MOS field effect transistor (prefix: M, nodes: 4)")
            .contains("Sub-circuit instance (prefix: X, nodes: any)");
    }

    @Test
    void list_models_printsModelTypes() {
        CliTestSupport.Result result = CliTestSupport.run("list", "models");

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).contains("• NPN").contains("• NMOS").contains("• LTRA");
    }

    @Test
    void list_renderers_printsDiscoveredRenderers() {
        CliTestSupport.Result result = CliTestSupport.run("list", "renderers");

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).contains("• filesystem").contains("• console");
    }

    @Test
    void list_unknownType_fails() {
        CliTestSupport.Result result = CliTestSupport.run("list", "widgets");

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("Unknown type: widgets");
    }
}
