package com.spicenet.core.element;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import com.spicenet.core.element.impl.BehavioralSource;
import com.spicenet.core.element.impl.BipolarTransistor;
import com.spicenet.core.element.impl.Capacitor;
import com.spicenet.core.element.impl.CoupledInductor;
import com.spicenet.core.element.impl.CurrentControlledCurrentSource;
import com.spicenet.core.element.impl.CurrentControlledSwitch;
import com.spicenet.core.element.impl.CurrentControlledVoltageSource;
import com.spicenet.core.element.impl.CurrentSource;
import com.spicenet.core.element.impl.Diode;
import com.spicenet.core.element.impl.Inductor;
import com.spicenet.core.element.impl.JunctionFieldEffectTransistor;
import com.spicenet.core.element.impl.Mosfet;
import com.spicenet.core.element.impl.Resistor;
import com.spicenet.core.element.impl.SubCircuitInstance;
import com.spicenet.core.element.impl.TransmissionLine;
import com.spicenet.core.element.impl.VoltageControlledCurrentSource;
import com.spicenet.core.element.impl.VoltageControlledSwitch;
import com.spicenet.core.element.impl.VoltageControlledVoltageSource;
import com.spicenet.core.element.impl.VoltageSource;

/**
 * Catalogue of the element kinds, used to create elements from declarative definitions.
 *
 * <p>Two-port kinds take their nodes input first ({@code in+ in- out+ out-}), like the
 * {@link TwoPortElement} constructor.
 */
public enum ElementKind {

    RESISTOR("Resistor", Resistor.PREFIX, 2,
        (name, n, args, kwargs) -> new Resistor(name, n.get(0), n.get(1), args, kwargs)),
    CAPACITOR("Capacitor", Capacitor.PREFIX, 2,
        (name, n, args, kwargs) -> new Capacitor(name, n.get(0), n.get(1), args, kwargs)),
    INDUCTOR("Inductor", Inductor.PREFIX, 2,
        (name, n, args, kwargs) -> new Inductor(name, n.get(0), n.get(1), args, kwargs)),
    COUPLED_INDUCTOR("Coupled inductors", CoupledInductor.PREFIX, 0,
        (name, n, args, kwargs) -> new CoupledInductor(name, args, kwargs)),
    VOLTAGE_SOURCE("Voltage source", VoltageSource.PREFIX, 2,
        (name, n, args, kwargs) -> new VoltageSource(name, n.get(0), n.get(1), args, kwargs)),
    CURRENT_SOURCE("Current source", CurrentSource.PREFIX, 2,
        (name, n, args, kwargs) -> new CurrentSource(name, n.get(0), n.get(1), args, kwargs)),
    VOLTAGE_CONTROLLED_VOLTAGE_SOURCE("Voltage controlled voltage source", VoltageControlledVoltageSource.PREFIX, 4,
        (name, n, args, kwargs) -> new VoltageControlledVoltageSource(name, n.get(0), n.get(1), n.get(2), n.get(3), args, kwargs)),
    VOLTAGE_CONTROLLED_CURRENT_SOURCE("Voltage controlled current source", VoltageControlledCurrentSource.PREFIX, 4,
        (name, n, args, kwargs) -> new VoltageControlledCurrentSource(name, n.get(0), n.get(1), n.get(2), n.get(3), args, kwargs)),
    CURRENT_CONTROLLED_CURRENT_SOURCE("Current controlled current source", CurrentControlledCurrentSource.PREFIX, 2,
        (name, n, args, kwargs) -> new CurrentControlledCurrentSource(name, n.get(0), n.get(1), args, kwargs)),
    CURRENT_CONTROLLED_VOLTAGE_SOURCE("Current controlled voltage source", CurrentControlledVoltageSource.PREFIX, 2,
        (name, n, args, kwargs) -> new CurrentControlledVoltageSource(name, n.get(0), n.get(1), args, kwargs)),
    BEHAVIORAL_SOURCE("Behavioral source", BehavioralSource.PREFIX, 2,
        (name, n, args, kwargs) -> new BehavioralSource(name, n.get(0), n.get(1), args, kwargs)),
    VOLTAGE_CONTROLLED_SWITCH("Voltage controlled switch", VoltageControlledSwitch.PREFIX, 4,
        (name, n, args, kwargs) -> new VoltageControlledSwitch(name, n.get(0), n.get(1), n.get(2), n.get(3), args, kwargs)),
    CURRENT_CONTROLLED_SWITCH("Current controlled switch", CurrentControlledSwitch.PREFIX, 2,
        (name, n, args, kwargs) -> new CurrentControlledSwitch(name, n.get(0), n.get(1), args, kwargs)),
    TRANSMISSION_LINE("Transmission line", TransmissionLine.PREFIX, 4,
        (name, n, args, kwargs) -> new TransmissionLine(name, n.get(0), n.get(1), n.get(2), n.get(3), args, kwargs)),
    DIODE("Diode", Diode.PREFIX, 2,
        (name, n, args, kwargs) -> new Diode(name, n.get(0), n.get(1), args, kwargs)),
    BIPOLAR_TRANSISTOR("Bipolar transistor", BipolarTransistor.PREFIX, 3,
        (name, n, args, kwargs) -> new BipolarTransistor(name, n.get(0), n.get(1), n.get(2), args, kwargs)),
    JFET("Junction field effect transistor", JunctionFieldEffectTransistor.PREFIX, 3,
        (name, n, args, kwargs) -> new JunctionFieldEffectTransistor(name, n.get(0), n.get(1), n.get(2), args, kwargs)),
    MOSFET("MOS field effect transistor", Mosfet.PREFIX, 4,
        (name, n, args, kwargs) -> new Mosfet(name, n.get(0), n.get(1), n.get(2), n.get(3), args, kwargs)),
    SUBCIRCUIT("Sub-circuit instance", SubCircuitInstance.PREFIX, -1,
        (name, n, args, kwargs) -> new SubCircuitInstance(name, n, args, kwargs));

    private final String displayName;
    private final String prefix;
    private final int nodeCount;
    private final ElementFactory factory;

    ElementKind(String displayName, String prefix, int nodeCount, ElementFactory factory) {
        this.displayName = displayName;
        this.prefix = prefix;
        this.nodeCount = nodeCount;
        this.factory = factory;
    }

    public String displayName() {
        return displayName;
    }

    public String prefix() {
        return prefix;
    }

    /**
     * @return number of nodes the kind takes, or -1 if it takes any number
     */
    public int nodeCount() {
        return nodeCount;
    }

    /**
     * Creates an element of this kind.
     *
     * @param name local name, without prefix
     * @param nodes nodes in constructor order
     * @param args positional arguments
     * @param kwargs keyword arguments
     * @return new element, not yet added to any netlist
     * @throws IllegalArgumentException if the node count does not match
     */
    public Element create(String name, List<String> nodes, List<?> args, Map<String, ?> kwargs) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        if (nodeCount >= 0 && nodes.size() != nodeCount) {
            throw new IllegalArgumentException(displayName + " " + prefix + name + " takes " + nodeCount
                + " node(s) but " + nodes.size() + " were given");
        }
        return factory.create(name, nodes, args, kwargs);
    }

    /**
     * Resolves a kind from its constant name ({@code resistor}, {@code voltage-source}) or its
     * prefix letter ({@code R}), ignoring case.
     *
     * @param text kind name or prefix
     * @return matching kind
     * @throws IllegalArgumentException if nothing matches
     */
    public static ElementKind fromString(String text) {
        Objects.requireNonNull(text, "text must not be null");
        String normalized = text.strip().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ElementKind kind : values()) {
            if (kind.name().equals(normalized) || kind.prefix.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown element kind: " + text);
    }
}
