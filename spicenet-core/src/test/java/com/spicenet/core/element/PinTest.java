package com.spicenet.core.element;

import com.spicenet.core.element.impl.Resistor;
import com.spicenet.core.element.impl.VoltageSource;
import com.spicenet.core.error.DuplicateNameException;
import com.spicenet.core.netlist.Netlist;
import com.spicenet.core.netlist.Node;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Pin}, in particular current probe insertion.
 */
class PinTest {

    private Netlist netlist;
    private Resistor resistor;

    @BeforeEach
    void setUp() {
        netlist = new Netlist();
        resistor = netlist.resistor("1", "in", "0", "1k");
    }

    @Test
    void pin_reportsOwnerRoleAndNode() {
        Pin minus = resistor.minus();

        assertThat(minus.owner()).isSameAs(resistor);
        assertThat(minus.role()).isEqualTo("minus");
        assertThat(minus.node()).isEqualTo("0");
        assertThat(minus).hasToString("Pin minus of R1 on node 0");
    }

    @Test
    void addCurrentProbe_splicesZeroVoltSourceInSeries() {
        VoltageSource probe = resistor.minus().addCurrentProbe(netlist);

        assertThat(probe.name()).isEqualTo("VR1_minus");
        assertThat(probe.nodes()).containsExactly("0", "R1_minus");
        assertThat(resistor.minus().node()).isEqualTo("R1_minus");
        assertThat(resistor.plus().node()).isEqualTo("in");
        assertThat(netlist.toSpice()).isEqualTo("""
            R1 in R1_minus 1k
            VR1_minus 0 R1_minus 0
            """);
    }

    @Test
    void addCurrentProbe_updatesNodeIndex() {
        assertThat(netlist.nodes()).extracting(Node::name).containsExactly("in", "0");

        resistor.plus().addCurrentProbe(netlist);

        assertThat(netlist.findNode("R1_plus")).get()
            .extracting(Node::elementNames)
            .isEqualTo(Set.of("R1", "VR1_plus"));
        assertThat(netlist.findNode("in")).get()
            .extracting(Node::elementNames)
            .isEqualTo(Set.of("VR1_plus"));
    }

    @Test
    void addCurrentProbe_calledTwice_failsAndKeepsState() {
        resistor.minus().addCurrentProbe(netlist);
        String before = netlist.toSpice();

        assertThatThrownBy(() -> resistor.minus().addCurrentProbe(netlist))
            .isInstanceOf(DuplicateNameException.class)
            .hasMessageContaining("VR1_minus");

        assertThat(resistor.minus().node()).isEqualTo("R1_minus");
        assertThat(netlist.elements()).hasSize(2);
        assertThat(netlist.toSpice()).isEqualTo(before);
    }
}
