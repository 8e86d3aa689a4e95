package com.spicenet.core.netlist;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.spicenet.core.element.Element;
import com.spicenet.core.error.UnconnectedNodeException;
import com.spicenet.core.util.SpiceStrings;

/**
 * Reusable netlist fragment with a name and an ordered list of interface nodes.
 *
 * <p>A sub-circuit is built standalone and then attached to a circuit with
 * {@link Circuit#subcircuit(SubCircuit)}. Reusable building blocks subclass it and populate
 * themselves in their constructor:
 * <pre>{@code
 * public class Divider extends SubCircuit {
 *     public Divider() {
 *         super("divider", "in", "out");
 *         resistor("1", "in", "out", "10k");
 *         resistor("2", "out", gnd(), "10k");
 *     }
 * }
 * }</pre>
 */
public class SubCircuit extends Netlist {

    private final String name;
    private final List<String> externalNodes;

    public SubCircuit(String name, String... externalNodes) {
        this(name, Arrays.asList(externalNodes), DEFAULT_GROUND);
    }

    public SubCircuit(String name, List<String> externalNodes, String ground) {
        super(ground);
        this.name = SpiceStrings.requireToken(name, "subcircuit name");
        List<String> nodes = new ArrayList<>(externalNodes.size());
        for (String node : externalNodes) {
            nodes.add(SpiceStrings.requireToken(node, "interface node"));
        }
        if (new HashSet<>(nodes).size() != nodes.size()) {
            throw new IllegalArgumentException("SubCircuit " + name + " declares an interface node twice: " + nodes);
        }
        this.externalNodes = List.copyOf(nodes);
    }

    public String name() {
        return name;
    }

    public List<String> externalNodes() {
        return externalNodes;
    }

    /**
     * Checks that every interface node is connected to at least one element.
     *
     * <p>Not part of rendering; callers run it explicitly.
     *
     * @throws UnconnectedNodeException listing the unconnected nodes in interface order
     */
    public void checkNodes() {
        Set<String> connected = new HashSet<>();
        for (Element element : elements()) {
            connected.addAll(element.nodes());
        }
        List<String> unconnected = externalNodes.stream()
            .filter(node -> !connected.contains(node))
            .toList();
        if (!unconnected.isEmpty()) {
            throw new UnconnectedNodeException(name, unconnected);
        }
    }

    /**
     * @return {@code .subckt} header, body and {@code .ends} trailer
     */
    @Override
    public String toSpice() {
        List<String> header = new ArrayList<>();
        header.add(".subckt");
        header.add(name);
        header.addAll(externalNodes);
        return SpiceStrings.joinFields(header) + SpiceStrings.NEWLINE
            + super.toSpice()
            + ".ends" + SpiceStrings.NEWLINE;
    }
}
